package com.fintech.candlesync.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Complete set of named indicator values for one bucket of a series.
 * Always written as a whole; never partially.
 *
 * @param series The candle series the values were computed from
 * @param bucketStart Bucket the values belong to
 * @param values Indicator name to value, in configuration order
 * @param computedAt Wall time of computation
 */
public record IndicatorSet(
    SeriesKey series,
    long bucketStart,
    Map<String, Double> values,
    Instant computedAt
) {

    public IndicatorSet {
        Objects.requireNonNull(series, "Series cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        Objects.requireNonNull(computedAt, "ComputedAt cannot be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
