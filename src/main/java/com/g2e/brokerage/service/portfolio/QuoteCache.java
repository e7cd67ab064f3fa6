package com.g2e.brokerage.service.portfolio;

import com.g2e.brokerage.domain.model.Quote;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Short-lived in-memory cache of the latest quote per symbol. Writes sweep out stale
 * symbols at most once per TTL.
 */
public final class QuoteCache {

    private final ConcurrentHashMap<String, CachedQuote> quotes = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private final AtomicReference<Instant> lastSweep;

    public QuoteCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        this.lastSweep = new AtomicReference<>(clock.instant());
    }

    public Optional<Quote> get(String symbol) {
        String key = symbol.toUpperCase(Locale.ROOT);
        CachedQuote cached = quotes.get(key);
        if (cached == null) {
            return Optional.empty();
        }
        if (isStale(cached, clock.instant())) {
            quotes.remove(key, cached);
            return Optional.empty();
        }
        return Optional.of(cached.quote());
    }

    public void put(Quote quote) {
        if (quote.symbol() == null) {
            return;
        }
        Instant now = clock.instant();
        Instant last = lastSweep.get();
        if (!now.isBefore(last.plus(ttl)) && lastSweep.compareAndSet(last, now)) {
            quotes.values().removeIf(c -> isStale(c, now));
        }
        quotes.put(quote.symbol().toUpperCase(Locale.ROOT), new CachedQuote(quote, now));
    }

    private boolean isStale(CachedQuote cached, Instant now) {
        return !now.isBefore(cached.cachedAt().plus(ttl));
    }

    public int size() {
        return quotes.size();
    }

    private record CachedQuote(Quote quote, Instant cachedAt) {}
}
