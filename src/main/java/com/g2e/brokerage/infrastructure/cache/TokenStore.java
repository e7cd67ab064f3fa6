package com.g2e.brokerage.infrastructure.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.OAuth1TokenSet;
import com.g2e.brokerage.domain.broker.OAuth2TokenSet;
import com.g2e.brokerage.domain.broker.TokenSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Token bundles serialized as JSON with a "type" discriminator.
 */
public final class TokenStore {
    private static final Logger log = LoggerFactory.getLogger(TokenStore.class);

    static final String TYPE_OAUTH2 = "oauth2";
    static final String TYPE_OAUTH1 = "oauth1";

    private final KeyValueCache cache;
    private final Duration ttl;
    private final ObjectMapper mapper;

    public TokenStore(KeyValueCache cache, Duration ttl, ObjectMapper mapper) {
        this.cache = cache;
        this.ttl = ttl;
        this.mapper = mapper;
    }

    public static String tokenKey(UUID userId, BrokerId brokerId) {
        return "token:" + userId + ":" + brokerId.code();
    }

    /**
     * False when the backing cache is not configured; tokens will not survive the request.
     */
    public boolean isPersistent() {
        return cache.isAvailable();
    }

    public boolean save(String key, TokenSet tokens) {
        try {
            return cache.set(key, mapper.writeValueAsBytes(toJson(tokens)), ttl);
        } catch (IOException e) {
            log.error("Failed to serialize token bundle for {}: {}", key, e.getMessage());
            return false;
        }
    }

    public Optional<TokenSet> load(String key) {
        Optional<byte[]> raw = cache.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(fromJson(mapper.readTree(raw.get())));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Discarding unreadable token bundle for {}: {}", key, e.getMessage());
            cache.delete(key);
            return Optional.empty();
        }
    }

    public boolean delete(String key) {
        return cache.delete(key);
    }

    private ObjectNode toJson(TokenSet tokens) {
        ObjectNode node = mapper.createObjectNode();
        if (tokens instanceof OAuth2TokenSet oauth2) {
            node.put("type", TYPE_OAUTH2);
            node.put("access_token", oauth2.accessToken());
            if (oauth2.refreshToken() != null) {
                node.put("refresh_token", oauth2.refreshToken());
            }
        } else if (tokens instanceof OAuth1TokenSet oauth1) {
            node.put("type", TYPE_OAUTH1);
            node.put("access_token", oauth1.accessToken());
            node.put("access_token_secret", oauth1.accessTokenSecret());
        } else {
            throw new IllegalArgumentException("Unknown token bundle type: " + tokens.getClass().getSimpleName());
        }
        if (tokens.expiresAt() != null) {
            node.put("expires_at", tokens.expiresAt().getEpochSecond());
        }
        return node;
    }

    private TokenSet fromJson(JsonNode node) {
        String type = node.path("type").asText("");
        Instant expiresAt = node.hasNonNull("expires_at")
            ? Instant.ofEpochSecond(node.get("expires_at").asLong())
            : null;
        return switch (type) {
            case TYPE_OAUTH2 -> new OAuth2TokenSet(
                node.path("access_token").asText(null),
                node.hasNonNull("refresh_token") ? node.get("refresh_token").asText() : null,
                expiresAt
            );
            case TYPE_OAUTH1 -> new OAuth1TokenSet(
                node.path("access_token").asText(null),
                node.path("access_token_secret").asText(null),
                expiresAt
            );
            default -> throw new IllegalArgumentException("Unknown token bundle type: " + type);
        };
    }
}
