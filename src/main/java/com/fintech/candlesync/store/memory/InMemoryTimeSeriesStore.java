package com.fintech.candlesync.store.memory;

import com.fintech.candlesync.aggregation.AggregationPolicy;
import com.fintech.candlesync.domain.BucketAggregate;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.store.GatedTimeSeriesStore;
import com.fintech.candlesync.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local store applying the same merge rules as the database.
 * Used for local runs without PostgreSQL and as the backing store in tests.
 * Nothing survives a restart.
 */
@Repository
@Qualifier(GatedTimeSeriesStore.BACKING)
@ConditionalOnProperty(name = "pipeline.store.type", havingValue = "memory")
public class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTimeSeriesStore.class);

    private final Map<SeriesKey, ConcurrentNavigableMap<Long, BucketAggregate>> candles = new ConcurrentHashMap<>();
    private final Map<SeriesKey, ConcurrentNavigableMap<Long, IndicatorSet>> indicators = new ConcurrentHashMap<>();

    public InMemoryTimeSeriesStore() {
        log.info("In-memory time series store initialized");
    }

    @Override
    public void insertCandles(SeriesKey key, List<Candle> rows) {
        ConcurrentNavigableMap<Long, BucketAggregate> series = candleSeries(key);
        for (Candle candle : rows) {
            series.put(candle.bucketStart(),
                new BucketAggregate(candle, candle.bucketStart(), candle.bucketStart(), 1));
        }
    }

    @Override
    public void mergeAggregates(SeriesKey key, List<BucketAggregate> aggregates) {
        ConcurrentNavigableMap<Long, BucketAggregate> series = candleSeries(key);
        for (BucketAggregate aggregate : aggregates) {
            series.merge(aggregate.bucketStart(), aggregate, AggregationPolicy::merge);
        }
    }

    @Override
    public List<Candle> queryCandles(SeriesKey key, long fromInclusive, long toExclusive) {
        ConcurrentNavigableMap<Long, BucketAggregate> series = candles.get(key);
        if (series == null || fromInclusive >= toExclusive) {
            return List.of();
        }
        List<Candle> result = new ArrayList<>();
        series.subMap(fromInclusive, true, toExclusive, false).values()
            .forEach(aggregate -> result.add(aggregate.candle()));
        return result;
    }

    @Override
    public List<Candle> latestCandles(SeriesKey key, int limit) {
        ConcurrentNavigableMap<Long, BucketAggregate> series = candles.get(key);
        if (series == null || limit <= 0) {
            return List.of();
        }
        List<Candle> newestFirst = new ArrayList<>(limit);
        for (BucketAggregate aggregate : series.descendingMap().values()) {
            if (newestFirst.size() == limit) {
                break;
            }
            newestFirst.add(aggregate.candle());
        }
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    public Optional<Long> latestBucket(SeriesKey key) {
        ConcurrentNavigableMap<Long, BucketAggregate> series = candles.get(key);
        return series == null || series.isEmpty() ? Optional.empty() : Optional.of(series.lastKey());
    }

    @Override
    public void insertIndicators(IndicatorSet set) {
        indicators.computeIfAbsent(set.series(), k -> new ConcurrentSkipListMap<>())
            .merge(set.bucketStart(), set, (existing, incoming) -> {
                Map<String, Double> values = new LinkedHashMap<>(existing.values());
                values.putAll(incoming.values());
                return new IndicatorSet(incoming.series(), incoming.bucketStart(), values, incoming.computedAt());
            });
    }

    @Override
    public List<IndicatorSet> queryIndicators(SeriesKey key, long fromInclusive, long toExclusive) {
        ConcurrentNavigableMap<Long, IndicatorSet> series = indicators.get(key);
        if (series == null || fromInclusive >= toExclusive) {
            return List.of();
        }
        return new ArrayList<>(series.subMap(fromInclusive, true, toExclusive, false).values());
    }

    @Override
    public Optional<Long> latestIndicatorBucket(SeriesKey key) {
        ConcurrentNavigableMap<Long, IndicatorSet> series = indicators.get(key);
        return series == null || series.isEmpty() ? Optional.empty() : Optional.of(series.lastKey());
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    private ConcurrentNavigableMap<Long, BucketAggregate> candleSeries(SeriesKey key) {
        return candles.computeIfAbsent(key, k -> new ConcurrentSkipListMap<>());
    }
}
