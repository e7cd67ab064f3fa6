package com.g2e.brokerage.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Stand-in when no shared cache backend is configured. Every write reports failure.
 */
public final class UnavailableKeyValueCache implements KeyValueCache {

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.empty();
    }

    @Override
    public boolean set(String key, byte[] value, Duration ttl) {
        return false;
    }

    @Override
    public boolean delete(String key) {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
