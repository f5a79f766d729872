package com.fintech.candlesync.store.timescaledb;

import com.fintech.candlesync.domain.BucketAggregate;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.exception.StoreUnavailableException;
import com.fintech.candlesync.store.GatedTimeSeriesStore;
import com.fintech.candlesync.store.TimeSeriesStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * TimescaleDB (PostgreSQL) implementation of {@link TimeSeriesStore}.
 *
 * Merge policies are applied by the database in one upsert statement per row, so
 * overlapping re-writes never need a read-modify-write round trip. Every batch is one
 * transaction: a failed batch leaves no partial rows behind, which is what keeps an
 * indicator set all-or-nothing.
 *
 * Database errors surface as {@link StoreUnavailableException}.
 */
@Repository
@Qualifier(GatedTimeSeriesStore.BACKING)
@ConditionalOnProperty(name = "pipeline.store.type", havingValue = "timescaledb", matchIfMissing = true)
public class TimescaleTimeSeriesStore implements TimeSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(TimescaleTimeSeriesStore.class);

    private final CandleJpaRepository candleRepository;
    private final IndicatorJpaRepository indicatorRepository;
    private final Clock clock;

    private final AtomicLong writeCounter = new AtomicLong(0);
    private final AtomicLong readCounter = new AtomicLong(0);
    private final AtomicLong errorCounter = new AtomicLong(0);
    private final Timer writeTimer;
    private final Timer readTimer;

    public TimescaleTimeSeriesStore(
            CandleJpaRepository candleRepository,
            IndicatorJpaRepository indicatorRepository,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.candleRepository = candleRepository;
        this.indicatorRepository = indicatorRepository;
        this.clock = clock;

        meterRegistry.gauge("timescaledb.rows.written", writeCounter);
        meterRegistry.gauge("timescaledb.rows.read", readCounter);
        meterRegistry.gauge("timescaledb.errors", errorCounter);

        this.writeTimer = meterRegistry.timer("timescaledb.write.latency");
        this.readTimer = meterRegistry.timer("timescaledb.read.latency");

        log.info("TimescaleDB time series store initialized");
    }

    @Override
    @Transactional
    public void insertCandles(SeriesKey key, List<Candle> candles) {
        execute("insertCandles", key, () -> writeTimer.record(() -> {
            long now = clock.millis();
            for (Candle candle : candles) {
                candleRepository.upsertReplace(
                    toEntity(key, new BucketAggregate(candle, candle.bucketStart(), candle.bucketStart(), 1), now));
            }
            writeCounter.addAndGet(candles.size());
            if (log.isTraceEnabled()) {
                log.trace("Replaced {} candles for {}", candles.size(), key);
            }
            return null;
        }));
    }

    @Override
    @Transactional
    public void mergeAggregates(SeriesKey key, List<BucketAggregate> aggregates) {
        execute("mergeAggregates", key, () -> writeTimer.record(() -> {
            long now = clock.millis();
            for (BucketAggregate aggregate : aggregates) {
                candleRepository.upsertMerge(toEntity(key, aggregate, now));
            }
            writeCounter.addAndGet(aggregates.size());
            if (log.isTraceEnabled()) {
                log.trace("Merged {} aggregates for {}", aggregates.size(), key);
            }
            return null;
        }));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Candle> queryCandles(SeriesKey key, long fromInclusive, long toExclusive) {
        return execute("queryCandles", key, () -> readTimer.record(() -> {
            List<CandleEntity> entities = candleRepository.findRange(
                key.source(), key.instrument(), key.timeframe().code(), fromInclusive, toExclusive);
            readCounter.addAndGet(entities.size());
            if (log.isDebugEnabled()) {
                log.debug("Range query {} [{}, {}) -> {} rows", key, fromInclusive, toExclusive, entities.size());
            }
            return entities.stream().map(this::fromEntity).toList();
        }));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Candle> latestCandles(SeriesKey key, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return execute("latestCandles", key, () -> readTimer.record(() -> {
            List<CandleEntity> newestFirst = candleRepository.findNewest(
                key.source(), key.instrument(), key.timeframe().code(), PageRequest.of(0, limit));
            readCounter.addAndGet(newestFirst.size());
            List<Candle> candles = new ArrayList<>(newestFirst.size());
            for (CandleEntity entity : newestFirst) {
                candles.add(fromEntity(entity));
            }
            Collections.reverse(candles);
            return candles;
        }));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Long> latestBucket(SeriesKey key) {
        return execute("latestBucket", key, () ->
            candleRepository.findLatestBucket(key.source(), key.instrument(), key.timeframe().code()));
    }

    @Override
    @Transactional
    public void insertIndicators(IndicatorSet set) {
        SeriesKey key = set.series();
        execute("insertIndicators", key, () -> writeTimer.record(() -> {
            long computedAt = set.computedAt().toEpochMilli();
            for (Map.Entry<String, Double> value : set.values().entrySet()) {
                indicatorRepository.upsert(IndicatorEntity.builder()
                    .id(IndicatorEntity.generateId(key.source(), key.instrument(), key.timeframe().code(),
                        set.bucketStart(), value.getKey()))
                    .source(key.source())
                    .instrument(key.instrument())
                    .timeframe(key.timeframe().code())
                    .bucketStart(set.bucketStart())
                    .name(value.getKey())
                    .value(value.getValue())
                    .computedAt(computedAt)
                    .build());
            }
            writeCounter.addAndGet(set.values().size());
            return null;
        }));
    }

    @Override
    @Transactional(readOnly = true)
    public List<IndicatorSet> queryIndicators(SeriesKey key, long fromInclusive, long toExclusive) {
        return execute("queryIndicators", key, () -> readTimer.record(() -> {
            List<IndicatorEntity> rows = indicatorRepository.findRange(
                key.source(), key.instrument(), key.timeframe().code(), fromInclusive, toExclusive);
            readCounter.addAndGet(rows.size());
            Map<Long, Map<String, Double>> byBucket = new LinkedHashMap<>();
            Map<Long, Long> computedAt = new LinkedHashMap<>();
            for (IndicatorEntity row : rows) {
                byBucket.computeIfAbsent(row.getBucketStart(), k -> new LinkedHashMap<>()).put(row.getName(), row.getValue());
                computedAt.merge(row.getBucketStart(), row.getComputedAt(), Math::max);
            }
            List<IndicatorSet> sets = new ArrayList<>(byBucket.size());
            byBucket.forEach((bucket, values) ->
                sets.add(new IndicatorSet(key, bucket, values, Instant.ofEpochMilli(computedAt.get(bucket)))));
            return sets;
        }));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Long> latestIndicatorBucket(SeriesKey key) {
        return execute("latestIndicatorBucket", key, () ->
            indicatorRepository.findLatestBucket(key.source(), key.instrument(), key.timeframe().code()));
    }

    @Override
    public boolean isHealthy() {
        try {
            candleRepository.count();
            return true;
        } catch (DataAccessException e) {
            log.error("TimescaleDB health check failed", e);
            return false;
        }
    }

    private <T> T execute(String operation, SeriesKey key, Supplier<T> body) {
        try {
            return body.get();
        } catch (DataAccessException e) {
            errorCounter.incrementAndGet();
            log.error("TimescaleDB {} failed for {}", operation, key, e);
            throw new StoreUnavailableException("TimescaleDB " + operation + " failed for " + key, e);
        }
    }

    private CandleEntity toEntity(SeriesKey key, BucketAggregate aggregate, long now) {
        Candle candle = aggregate.candle();
        return CandleEntity.builder()
            .id(CandleEntity.generateId(key.source(), key.instrument(), key.timeframe().code(), candle.bucketStart()))
            .source(key.source())
            .instrument(key.instrument())
            .timeframe(key.timeframe().code())
            .bucketStart(candle.bucketStart())
            .open(candle.open())
            .high(candle.high())
            .low(candle.low())
            .close(candle.close())
            .baseVolume(candle.baseVolume())
            .quoteVolume(candle.quoteVolume())
            .tradeCount(candle.tradeCount())
            .synthetic(candle.synthetic())
            .firstBaseStart(aggregate.firstBaseStart())
            .lastBaseStart(aggregate.lastBaseStart())
            .baseCount(aggregate.baseCount())
            .updatedAt(now)
            .build();
    }

    private Candle fromEntity(CandleEntity entity) {
        return new Candle(
            entity.getBucketStart(),
            entity.getOpen(),
            entity.getHigh(),
            entity.getLow(),
            entity.getClose(),
            entity.getBaseVolume(),
            entity.getQuoteVolume(),
            entity.getTradeCount(),
            entity.getSynthetic()
        );
    }
}
