package com.fintech.candlesync.cache;

import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.domain.SeriesKey;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived copy of the newest indicator set per series, read by dashboards and APIs
 * outside this service.
 */
public interface IndicatorCache {

    /** Stores {@code indicators} under its series key, replacing the previous set. */
    void put(IndicatorSet indicators, Duration ttl);

    /** Newest cached set for the series, empty when absent or expired. */
    Optional<IndicatorSet> get(SeriesKey key);
}
