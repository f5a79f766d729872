package com.fintech.candlesync.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one candle series in storage: (source, instrument, timeframe).
 * Implements natural ordering by source, then instrument, then timeframe.
 */
public record SeriesKey(
    String source,
    String instrument,
    Timeframe timeframe
) implements Comparable<SeriesKey> {

    private static final Comparator<SeriesKey> ORDER = Comparator
        .comparing(SeriesKey::source)
        .thenComparing(SeriesKey::instrument)
        .thenComparing(SeriesKey::timeframe);

    public SeriesKey {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(timeframe, "Timeframe cannot be null");
    }

    /** Returns the key of the same instrument at another timeframe. */
    public SeriesKey withTimeframe(Timeframe other) {
        return new SeriesKey(source, instrument, other);
    }

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }

    /**
     * Creates a cache key.
     * Format: "PREFIX:SOURCE:INSTRUMENT:TIMEFRAME", e.g. "indicators:binance:BTCUSDT:1m"
     */
    public String toCacheKey(String prefix) {
        return prefix + ":" + source + ":" + instrument + ":" + timeframe.code();
    }

    @Override
    public String toString() {
        return source + "/" + instrument + "/" + timeframe.code();
    }
}
