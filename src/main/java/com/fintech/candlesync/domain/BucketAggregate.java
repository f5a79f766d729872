package com.fintech.candlesync.domain;

import java.util.Objects;

/**
 * A derived-timeframe candle together with the provenance its additive merge needs.
 *
 * @param candle The rolled-up bar
 * @param firstBaseStart Bucket start of the base candle that supplied {@code open}
 * @param lastBaseStart Bucket start of the base candle that supplied {@code close}
 * @param baseCount Number of distinct base candles that contributed
 */
public record BucketAggregate(
    Candle candle,
    long firstBaseStart,
    long lastBaseStart,
    int baseCount
) {

    public BucketAggregate {
        Objects.requireNonNull(candle, "Candle cannot be null");
        if (firstBaseStart > lastBaseStart) {
            throw new IllegalArgumentException(
                "firstBaseStart (" + firstBaseStart + ") cannot be after lastBaseStart (" + lastBaseStart + ")");
        }
        if (baseCount < 1) {
            throw new IllegalArgumentException("An aggregate needs at least one contributing candle");
        }
    }

    public long bucketStart() {
        return candle.bucketStart();
    }
}
