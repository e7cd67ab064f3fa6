package com.g2e.brokerage.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Byte-oriented TTL cache used for token bundles and handshake state.
 *
 * Implementations never throw when the backend is down: reads return empty and
 * writes return false.
 */
public interface KeyValueCache {

    Optional<byte[]> get(String key);

    /**
     * @return true when the value was stored
     */
    boolean set(String key, byte[] value, Duration ttl);

    /**
     * @return true when a live entry was removed by this call
     */
    boolean delete(String key);

    boolean isAvailable();
}
