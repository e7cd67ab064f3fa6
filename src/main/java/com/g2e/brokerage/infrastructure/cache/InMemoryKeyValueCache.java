package com.g2e.brokerage.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local TTL cache. Expired entries are dropped on access, and a write sweeps
 * the whole map once {@link #SWEEP_INTERVAL} has passed since the last sweep.
 */
public final class InMemoryKeyValueCache implements KeyValueCache {

    static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicReference<Instant> lastSweep;

    public InMemoryKeyValueCache(Clock clock) {
        this.clock = clock;
        this.lastSweep = new AtomicReference<>(clock.instant());
    }

    @Override
    public Optional<byte[]> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value().clone());
    }

    @Override
    public boolean set(String key, byte[] value, Duration ttl) {
        if (key == null || value == null || ttl == null || ttl.isNegative() || ttl.isZero()) {
            return false;
        }
        Instant now = clock.instant();
        sweepIfDue(now);
        entries.put(key, new Entry(value.clone(), now.plus(ttl)));
        return true;
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Drop every expired entry.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        lastSweep.set(now);
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now));
        return Math.max(0, before - entries.size());
    }

    private void sweepIfDue(Instant now) {
        Instant last = lastSweep.get();
        if (now.isBefore(last.plus(SWEEP_INTERVAL)) || !lastSweep.compareAndSet(last, now)) {
            return;
        }
        entries.values().removeIf(e -> e.isExpired(now));
    }

    private record Entry(byte[] value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
