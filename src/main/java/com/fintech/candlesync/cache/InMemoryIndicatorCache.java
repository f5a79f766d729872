package com.fintech.candlesync.cache;

import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.domain.SeriesKey;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local TTL cache, the default when no Redis is configured.
 * Expired entries are dropped lazily on read.
 */
public class InMemoryIndicatorCache implements IndicatorCache {

    private final Map<SeriesKey, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIndicatorCache(Clock clock) {
        this.clock = clock;
    }

    private record Entry(IndicatorSet indicators, long expiresAtMillis) {
    }

    @Override
    public void put(IndicatorSet indicators, Duration ttl) {
        entries.put(indicators.series(), new Entry(indicators, clock.millis() + ttl.toMillis()));
    }

    @Override
    public Optional<IndicatorSet> get(SeriesKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.millis() >= entry.expiresAtMillis()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.indicators());
    }
}
