package com.g2e.brokerage.domain.broker;

import java.time.Instant;

public record OAuth2TokenSet(String accessToken, String refreshToken, Instant expiresAt) implements TokenSet {

    public OAuth2TokenSet {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken is required");
        }
    }

    @Override
    public String toString() {
        return "OAuth2TokenSet[accessToken=***, refreshToken=" + (refreshToken == null ? "null" : "***")
            + ", expiresAt=" + expiresAt + "]";
    }
}
