package com.g2e.brokerage.domain.broker;

import java.time.Instant;

public record OAuth1TokenSet(String accessToken, String accessTokenSecret, Instant expiresAt) implements TokenSet {

    public OAuth1TokenSet {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken is required");
        }
        if (accessTokenSecret == null) {
            throw new IllegalArgumentException("accessTokenSecret is required");
        }
    }

    public OAuth1TokenSet withExpiresAt(Instant newExpiresAt) {
        return new OAuth1TokenSet(accessToken, accessTokenSecret, newExpiresAt);
    }

    @Override
    public String toString() {
        return "OAuth1TokenSet[accessToken=***, accessTokenSecret=***, expiresAt=" + expiresAt + "]";
    }
}
