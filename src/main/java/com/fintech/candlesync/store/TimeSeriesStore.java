package com.fintech.candlesync.store;

import com.fintech.candlesync.domain.BucketAggregate;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.domain.SeriesKey;

import java.util.List;
import java.util.Optional;

/**
 * Durable candle and indicator storage keyed by (source, instrument, timeframe, bucket).
 *
 * <p>Two write policies exist. Base candles are replace-on-key: the last write for a bucket
 * wins. Derived candles are additive-merge: columns combine as defined by
 * {@link com.fintech.candlesync.aggregation.AggregationPolicy#merge}. Both kinds of write are
 * idempotent, so re-writing an overlapping window is always safe.
 *
 * <p>Implementations may tolerate only one in-flight call; callers go through the gated
 * primary bean rather than a backing implementation.
 *
 * @throws com.fintech.candlesync.exception.StoreUnavailableException from any method when
 *         the store cannot be reached or a call times out
 */
public interface TimeSeriesStore {

    /** Writes base-timeframe candles, replacing any row with the same bucket. */
    void insertCandles(SeriesKey key, List<Candle> candles);

    /** Writes derived-timeframe aggregates, merging with any row already stored for the bucket. */
    void mergeAggregates(SeriesKey key, List<BucketAggregate> aggregates);

    /**
     * Returns candles with {@code fromInclusive <= bucketStart < toExclusive}, oldest first.
     */
    List<Candle> queryCandles(SeriesKey key, long fromInclusive, long toExclusive);

    /** Returns the newest {@code limit} candles, oldest first. */
    List<Candle> latestCandles(SeriesKey key, int limit);

    /** Bucket start of the newest stored candle, empty when the series has none. */
    Optional<Long> latestBucket(SeriesKey key);

    /** Writes one complete indicator set; every value replaces any stored value of the same name. */
    void insertIndicators(IndicatorSet indicators);

    /**
     * Returns indicator sets with {@code fromInclusive <= bucketStart < toExclusive}, oldest first.
     */
    List<IndicatorSet> queryIndicators(SeriesKey key, long fromInclusive, long toExclusive);

    /** Bucket start of the newest stored indicator set, empty when none exists. */
    Optional<Long> latestIndicatorBucket(SeriesKey key);

    boolean isHealthy();
}
