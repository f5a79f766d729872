package com.fintech.candlesync.store.timescaledb;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for indicator values.
 */
@Repository
public interface IndicatorJpaRepository extends JpaRepository<IndicatorEntity, String> {

    /**
     * Replace-on-key per (series, bucket, name).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(nativeQuery = true, value =
        "INSERT INTO indicators (id, source, instrument, timeframe, bucket_start, name, value, computed_at) " +
        "VALUES (:#{#i.id}, :#{#i.source}, :#{#i.instrument}, :#{#i.timeframe}, :#{#i.bucketStart}, " +
        ":#{#i.name}, :#{#i.value}, :#{#i.computedAt}) " +
        "ON CONFLICT (id) DO UPDATE SET value = EXCLUDED.value, computed_at = EXCLUDED.computed_at")
    int upsert(@Param("i") IndicatorEntity indicator);

    @Query("SELECT i FROM IndicatorEntity i " +
           "WHERE i.source = :source AND i.instrument = :instrument AND i.timeframe = :timeframe " +
           "AND i.bucketStart >= :fromInclusive AND i.bucketStart < :toExclusive " +
           "ORDER BY i.bucketStart ASC, i.name ASC")
    List<IndicatorEntity> findRange(
        @Param("source") String source,
        @Param("instrument") String instrument,
        @Param("timeframe") String timeframe,
        @Param("fromInclusive") long fromInclusive,
        @Param("toExclusive") long toExclusive
    );

    @Query("SELECT MAX(i.bucketStart) FROM IndicatorEntity i " +
           "WHERE i.source = :source AND i.instrument = :instrument AND i.timeframe = :timeframe")
    Optional<Long> findLatestBucket(
        @Param("source") String source,
        @Param("instrument") String instrument,
        @Param("timeframe") String timeframe
    );
}
