package com.g2e.brokerage.domain.broker;

import java.util.Map;

/**
 * Where to send the user to authorize, plus vendor metadata (request token pair for OAuth 1.0a).
 *
 * @param oob true when the vendor shows a verifier code instead of redirecting back
 */
public record AuthorizationRequest(String url, Map<String, String> metadata, boolean oob) {

    public AuthorizationRequest {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AuthorizationRequest redirect(String url) {
        return new AuthorizationRequest(url, Map.of(), false);
    }
}
