package com.g2e.brokerage.infrastructure.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.OAuthHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * TTL store for in-flight OAuth handshakes, keyed by "oauth_state:{state}".
 *
 * When no shared cache is configured the store runs on a process-local cache; handshakes
 * then only complete on the instance that started them.
 */
public final class HandshakeStateStore {
    private static final Logger log = LoggerFactory.getLogger(HandshakeStateStore.class);

    private final KeyValueCache cache;
    private final Duration ttl;
    private final ObjectMapper mapper;
    private final boolean processLocal;

    public HandshakeStateStore(KeyValueCache cache, Duration ttl, ObjectMapper mapper, boolean processLocal) {
        this.cache = cache;
        this.ttl = ttl;
        this.mapper = mapper;
        this.processLocal = processLocal;
    }

    public static HandshakeStateStore create(KeyValueCache shared, Duration ttl, ObjectMapper mapper, Clock clock) {
        if (shared.isAvailable()) {
            return new HandshakeStateStore(shared, ttl, mapper, false);
        }
        log.warn("[CONNECT] No shared cache configured - OAuth handshake state is process-local");
        return new HandshakeStateStore(new InMemoryKeyValueCache(clock), ttl, mapper, true);
    }

    static String stateKey(String state) {
        return "oauth_state:" + state;
    }

    public boolean isProcessLocal() {
        return processLocal;
    }

    public Duration ttl() {
        return ttl;
    }

    public boolean save(OAuthHandshake handshake) {
        ObjectNode node = mapper.createObjectNode();
        node.put("user_id", handshake.userId().toString());
        node.put("broker_id", handshake.brokerId().code());
        node.put("redirect_uri", handshake.redirectUri());
        node.put("request_token", handshake.requestToken());
        node.put("request_token_secret", handshake.requestTokenSecret());
        node.put("created_at", handshake.createdAt().toEpochMilli());
        try {
            return cache.set(stateKey(handshake.state()), mapper.writeValueAsBytes(node), ttl);
        } catch (IOException e) {
            log.error("[CONNECT] Failed to serialize handshake state: {}", e.getMessage());
            return false;
        }
    }

    public Optional<OAuthHandshake> find(String state) {
        Optional<byte[]> raw = cache.get(stateKey(state));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(raw.get());
            return Optional.of(new OAuthHandshake(
                state,
                UUID.fromString(node.get("user_id").asText()),
                BrokerId.fromCode(node.get("broker_id").asText()),
                textOrNull(node, "redirect_uri"),
                textOrNull(node, "request_token"),
                textOrNull(node, "request_token_secret"),
                Instant.ofEpochMilli(node.path("created_at").asLong())
            ));
        } catch (IOException | RuntimeException e) {
            log.warn("[CONNECT] Discarding unreadable handshake state: {}", e.getMessage());
            cache.delete(stateKey(state));
            return Optional.empty();
        }
    }

    /**
     * Removes the handshake. Returns true for exactly one caller per stored state.
     */
    public boolean consume(String state) {
        return cache.delete(stateKey(state));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
