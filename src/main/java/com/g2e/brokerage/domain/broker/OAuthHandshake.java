package com.g2e.brokerage.domain.broker;

import java.time.Instant;
import java.util.UUID;

/**
 * Server-side record of an in-flight OAuth handshake, keyed by the state token.
 * requestToken and requestTokenSecret are only set for OAuth 1.0a vendors.
 */
public record OAuthHandshake(
    String state,
    UUID userId,
    BrokerId brokerId,
    String redirectUri,
    String requestToken,
    String requestTokenSecret,
    Instant createdAt
) {
    public boolean isOAuth1() {
        return requestTokenSecret != null;
    }

    @Override
    public String toString() {
        return "OAuthHandshake[userId=" + userId + ", brokerId=" + brokerId
            + ", oauth1=" + isOAuth1() + ", createdAt=" + createdAt + "]";
    }
}
