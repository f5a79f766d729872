package com.fintech.candlesync.store.timescaledb;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for candle rows.
 *
 * The two upserts encode the store's merge policies in PostgreSQL's ON CONFLICT clause,
 * so a write is a single statement regardless of whether the row already exists.
 */
@Repository
public interface CandleJpaRepository extends JpaRepository<CandleEntity, String> {

    String INSERT_COLUMNS =
        "INSERT INTO candles (id, source, instrument, timeframe, bucket_start, open, high, low, close, " +
        "base_volume, quote_volume, trade_count, synthetic, first_base_start, last_base_start, base_count, updated_at) " +
        "VALUES (:#{#c.id}, :#{#c.source}, :#{#c.instrument}, :#{#c.timeframe}, :#{#c.bucketStart}, " +
        ":#{#c.open}, :#{#c.high}, :#{#c.low}, :#{#c.close}, :#{#c.baseVolume}, :#{#c.quoteVolume}, " +
        ":#{#c.tradeCount}, :#{#c.synthetic}, :#{#c.firstBaseStart}, :#{#c.lastBaseStart}, :#{#c.baseCount}, " +
        ":#{#c.updatedAt}) ";

    /**
     * Replace-on-key: the incoming row wins every column.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(nativeQuery = true, value = INSERT_COLUMNS +
        "ON CONFLICT (id) DO UPDATE SET " +
        "open = EXCLUDED.open, high = EXCLUDED.high, low = EXCLUDED.low, close = EXCLUDED.close, " +
        "base_volume = EXCLUDED.base_volume, quote_volume = EXCLUDED.quote_volume, " +
        "trade_count = EXCLUDED.trade_count, synthetic = EXCLUDED.synthetic, " +
        "first_base_start = EXCLUDED.first_base_start, last_base_start = EXCLUDED.last_base_start, " +
        "base_count = EXCLUDED.base_count, updated_at = EXCLUDED.updated_at")
    int upsertReplace(@Param("c") CandleEntity candle);

    /**
     * Additive merge: open follows the earliest base bucket, close the latest,
     * extremes widen, sums keep the larger full recomputation, synthetic only if both are.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(nativeQuery = true, value = INSERT_COLUMNS +
        "ON CONFLICT (id) DO UPDATE SET " +
        "open = CASE WHEN EXCLUDED.first_base_start <= candles.first_base_start " +
        "THEN EXCLUDED.open ELSE candles.open END, " +
        "close = CASE WHEN EXCLUDED.last_base_start >= candles.last_base_start " +
        "THEN EXCLUDED.close ELSE candles.close END, " +
        "high = GREATEST(candles.high, EXCLUDED.high), " +
        "low = LEAST(candles.low, EXCLUDED.low), " +
        "base_volume = GREATEST(candles.base_volume, EXCLUDED.base_volume), " +
        "quote_volume = GREATEST(candles.quote_volume, EXCLUDED.quote_volume), " +
        "trade_count = GREATEST(candles.trade_count, EXCLUDED.trade_count), " +
        "synthetic = candles.synthetic AND EXCLUDED.synthetic, " +
        "first_base_start = LEAST(candles.first_base_start, EXCLUDED.first_base_start), " +
        "last_base_start = GREATEST(candles.last_base_start, EXCLUDED.last_base_start), " +
        "base_count = GREATEST(candles.base_count, EXCLUDED.base_count), " +
        "updated_at = EXCLUDED.updated_at")
    int upsertMerge(@Param("c") CandleEntity candle);

    /**
     * Candles with fromInclusive <= bucket_start < toExclusive, oldest first.
     */
    @Query("SELECT c FROM CandleEntity c " +
           "WHERE c.source = :source " +
           "AND c.instrument = :instrument " +
           "AND c.timeframe = :timeframe " +
           "AND c.bucketStart >= :fromInclusive " +
           "AND c.bucketStart < :toExclusive " +
           "ORDER BY c.bucketStart ASC")
    List<CandleEntity> findRange(
        @Param("source") String source,
        @Param("instrument") String instrument,
        @Param("timeframe") String timeframe,
        @Param("fromInclusive") long fromInclusive,
        @Param("toExclusive") long toExclusive
    );

    /**
     * Newest candles first; page size bounds the count.
     */
    @Query("SELECT c FROM CandleEntity c " +
           "WHERE c.source = :source AND c.instrument = :instrument AND c.timeframe = :timeframe " +
           "ORDER BY c.bucketStart DESC")
    List<CandleEntity> findNewest(
        @Param("source") String source,
        @Param("instrument") String instrument,
        @Param("timeframe") String timeframe,
        Pageable page
    );

    @Query("SELECT MAX(c.bucketStart) FROM CandleEntity c " +
           "WHERE c.source = :source AND c.instrument = :instrument AND c.timeframe = :timeframe")
    Optional<Long> findLatestBucket(
        @Param("source") String source,
        @Param("instrument") String instrument,
        @Param("timeframe") String timeframe
    );
}
