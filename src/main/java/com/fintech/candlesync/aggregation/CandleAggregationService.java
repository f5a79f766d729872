package com.fintech.candlesync.aggregation;

import com.fintech.candlesync.config.PipelineConfig;
import com.fintech.candlesync.domain.BucketAggregate;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.store.TimeSeriesStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Re-derives coarser timeframes after base candles were written.
 *
 * For each target timeframe every affected bucket is recomputed wholesale from the stored
 * base candles (one range query per target) and merged into the store. Buckets that are
 * still filling are recomputed on every pass until their window elapses.
 * A failed bucket is logged and remembered; the remaining buckets are still written and the
 * failed one is recomputed on the next pass for the same series.
 */
@Service
public class CandleAggregationService {

    private static final Logger log = LoggerFactory.getLogger(CandleAggregationService.class);

    private final TimeSeriesStore store;
    private final PipelineConfig.AggregationConfig config;
    private final Clock clock;
    private final Counter mergedCounter;
    private final Counter failedCounter;

    /** Target series to buckets whose last merge failed. */
    private final Map<SeriesKey, NavigableSet<Long>> failedBuckets = new ConcurrentHashMap<>();

    public CandleAggregationService(TimeSeriesStore store, PipelineConfig pipelineConfig,
                                    Clock clock, MeterRegistry meterRegistry) {
        this.store = store;
        this.config = pipelineConfig.aggregation();
        this.clock = clock;
        this.mergedCounter = meterRegistry.counter("pipeline.aggregation.buckets.merged");
        this.failedCounter = meterRegistry.counter("pipeline.aggregation.buckets.failed");
        meterRegistry.gauge("pipeline.aggregation.buckets.pending", failedBuckets,
            pending -> pending.values().stream().mapToInt(Set::size).sum());
    }

    /**
     * Recomputes and merges every target bucket touched by {@code written}, after retrying
     * the buckets of this series that failed on an earlier pass.
     *
     * @param baseKey series the candles were written to
     * @param written base candles just written
     * @return number of derived buckets merged
     */
    public int aggregate(SeriesKey baseKey, Collection<Candle> written) {
        int merged = retryFailed(baseKey);
        if (written.isEmpty()) {
            return merged;
        }
        for (Timeframe target : config.targets()) {
            merged += mergeBuckets(baseKey, target, AggregationPolicy.affectedBuckets(written, target));
        }
        return merged;
    }

    /**
     * Recomputes the derived buckets of {@code baseKey} whose merge failed before.
     *
     * @return number of derived buckets merged
     */
    public int retryFailed(SeriesKey baseKey) {
        int merged = 0;
        for (Timeframe target : config.targets()) {
            SeriesKey targetKey = baseKey.withTimeframe(target);
            NavigableSet<Long> pending = failedBuckets.remove(targetKey);
            if (pending == null || pending.isEmpty()) {
                continue;
            }
            log.info("Retrying {} failed buckets of {}", pending.size(), targetKey);
            for (Long bucket : pending) {
                merged += mergeBuckets(baseKey, target, List.of(bucket));
            }
        }
        return merged;
    }

    /** Buckets of {@code targetKey} waiting for a retry. */
    public Set<Long> pendingRetries(SeriesKey targetKey) {
        NavigableSet<Long> pending = failedBuckets.get(targetKey);
        return pending == null ? Set.of() : Set.copyOf(pending);
    }

    private int mergeBuckets(SeriesKey baseKey, Timeframe target, List<Long> affected) {
        SeriesKey targetKey = baseKey.withTimeframe(target);
        List<Candle> base;
        try {
            long from = affected.get(0);
            long to = target.windowEnd(affected.get(affected.size() - 1));
            base = store.queryCandles(baseKey, from, to);
        } catch (RuntimeException e) {
            failedCounter.increment();
            markFailed(targetKey, affected);
            log.error("Aggregation into {} failed for {}", target.code(), baseKey, e);
            return 0;
        }

        Set<Long> wanted = new HashSet<>(affected);
        long now = clock.millis();
        int merged = 0;
        for (BucketAggregate aggregate : AggregationPolicy.rollUp(base, target)) {
            if (!wanted.contains(aggregate.bucketStart())) {
                continue;
            }
            try {
                store.mergeAggregates(targetKey, List.of(aggregate));
                mergedCounter.increment();
                merged++;
                if (log.isDebugEnabled() && !AggregationPolicy.isComplete(aggregate.bucketStart(), target, now)) {
                    log.debug("Bucket {} of {} still filling ({} base candles so far)",
                        aggregate.bucketStart(), targetKey, aggregate.baseCount());
                }
            } catch (RuntimeException e) {
                failedCounter.increment();
                markFailed(targetKey, List.of(aggregate.bucketStart()));
                log.error("Failed to merge bucket {} of {}, retrying on the next pass",
                    aggregate.bucketStart(), targetKey, e);
            }
        }
        return merged;
    }

    private void markFailed(SeriesKey targetKey, Collection<Long> buckets) {
        failedBuckets.computeIfAbsent(targetKey, k -> new ConcurrentSkipListSet<>()).addAll(buckets);
    }
}
