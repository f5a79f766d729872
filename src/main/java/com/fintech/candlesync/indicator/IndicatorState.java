package com.fintech.candlesync.indicator;

/**
 * Indicator progress of one series.
 */
public enum IndicatorState {
    /** Nothing known yet; next tick reads the store to find where to start. */
    COLD,
    /** More uncovered buckets than one lookback window; processed in batches, oldest first. */
    CATCHING_UP,
    /** Steady state; each tick evaluates the newest buckets from one window fetch. */
    CURRENT
}
