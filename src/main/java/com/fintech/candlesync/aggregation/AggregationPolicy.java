package com.fintech.candlesync.aggregation;

import com.fintech.candlesync.domain.BucketAggregate;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.Timeframe;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Deterministic roll-up of base candles into coarser timeframes, and the merge rule for
 * repeated writes to the same derived bucket.
 *
 * <p>Roll-up per target bucket:
 * <ul>
 *   <li>open of the earliest contributor, close of the latest</li>
 *   <li>high = max, low = min</li>
 *   <li>volumes and trade count summed over the full contributor set</li>
 *   <li>synthetic only if every contributor is synthetic</li>
 * </ul>
 *
 * <p>Merge is idempotent and order independent: open follows the earliest known base bucket,
 * close the latest, extremes only widen, and sums keep the larger total. Each write carries a
 * sum recomputed from every base candle known at the time, so the larger total is the union
 * and never a double count.
 *
 * <p>No I/O and no state; safe to call from any thread.
 */
public final class AggregationPolicy {

    private AggregationPolicy() {
    }

    /**
     * Rolls base candles up into {@code target} buckets.
     * Duplicate base rows for one bucket start collapse to the last one given (replace-on-key).
     * Buckets with no contributors are never produced.
     *
     * @return one aggregate per non-empty target bucket, ordered by bucket start
     */
    public static List<BucketAggregate> rollUp(Collection<Candle> base, Timeframe target) {
        NavigableMap<Long, Candle> deduplicated = new TreeMap<>();
        for (Candle candle : base) {
            deduplicated.put(candle.bucketStart(), candle);
        }

        NavigableMap<Long, List<Candle>> groups = new TreeMap<>();
        for (Candle candle : deduplicated.values()) {
            groups.computeIfAbsent(target.alignTimestamp(candle.bucketStart()), k -> new ArrayList<>()).add(candle);
        }

        List<BucketAggregate> aggregates = new ArrayList<>(groups.size());
        for (Map.Entry<Long, List<Candle>> group : groups.entrySet()) {
            aggregates.add(aggregateGroup(group.getKey(), group.getValue()));
        }
        return aggregates;
    }

    private static BucketAggregate aggregateGroup(long bucketStart, List<Candle> members) {
        Candle first = members.get(0);
        Candle last = members.get(members.size() - 1);
        double high = first.high();
        double low = first.low();
        double baseVolume = 0.0;
        double quoteVolume = 0.0;
        long tradeCount = 0L;
        boolean synthetic = true;
        for (Candle candle : members) {
            high = Math.max(high, candle.high());
            low = Math.min(low, candle.low());
            baseVolume += candle.baseVolume();
            quoteVolume += candle.quoteVolume();
            tradeCount += candle.tradeCount();
            synthetic &= candle.synthetic();
        }
        Candle rolled = new Candle(bucketStart, first.open(), high, low, last.close(),
            baseVolume, quoteVolume, tradeCount, synthetic);
        return new BucketAggregate(rolled, first.bucketStart(), last.bucketStart(), members.size());
    }

    /**
     * Combines two writes of the same derived bucket.
     * Ties on provenance resolve to {@code incoming}, matching replace-on-key for the base row.
     *
     * @throws IllegalArgumentException if the aggregates belong to different buckets
     */
    public static BucketAggregate merge(BucketAggregate existing, BucketAggregate incoming) {
        if (existing.bucketStart() != incoming.bucketStart()) {
            throw new IllegalArgumentException("Cannot merge buckets " + existing.bucketStart()
                + " and " + incoming.bucketStart());
        }
        Candle a = existing.candle();
        Candle b = incoming.candle();
        double open = incoming.firstBaseStart() <= existing.firstBaseStart() ? b.open() : a.open();
        double close = incoming.lastBaseStart() >= existing.lastBaseStart() ? b.close() : a.close();
        Candle merged = new Candle(
            a.bucketStart(),
            open,
            Math.max(a.high(), b.high()),
            Math.min(a.low(), b.low()),
            close,
            Math.max(a.baseVolume(), b.baseVolume()),
            Math.max(a.quoteVolume(), b.quoteVolume()),
            Math.max(a.tradeCount(), b.tradeCount()),
            a.synthetic() && b.synthetic());
        return new BucketAggregate(
            merged,
            Math.min(existing.firstBaseStart(), incoming.firstBaseStart()),
            Math.max(existing.lastBaseStart(), incoming.lastBaseStart()),
            Math.max(existing.baseCount(), incoming.baseCount()));
    }

    /** Target bucket starts touched by the given base candles, ascending and distinct. */
    public static List<Long> affectedBuckets(Collection<Candle> written, Timeframe target) {
        TreeSet<Long> buckets = new TreeSet<>();
        for (Candle candle : written) {
            buckets.add(target.alignTimestamp(candle.bucketStart()));
        }
        return new ArrayList<>(buckets);
    }

    /** True once the bucket's window has fully elapsed at {@code nowMillis}. */
    public static boolean isComplete(long bucketStart, Timeframe target, long nowMillis) {
        return target.windowEnd(bucketStart) <= nowMillis;
    }
}
