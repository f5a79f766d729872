package com.fintech.candlesync.store.timescaledb;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA entity for one candle row.
 *
 * Base and derived timeframes share the table. Derived rows carry the provenance columns
 * the additive merge needs; base rows have first = last = bucket_start and base_count = 1.
 * Writes go through native upserts in {@link CandleJpaRepository}; the entity is used for reads.
 */
@Entity
@Table(
    name = "candles",
    indexes = {
        @Index(name = "idx_candles_series_bucket", columnList = "source, instrument, timeframe, bucket_start DESC")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_candle", columnNames = {"source", "instrument", "timeframe", "bucket_start"})
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandleEntity {

    /**
     * Composite key: source_instrument_timeframe_bucket
     * Example: "binance_BTCUSDT_1m_1703000000000"
     */
    @Id
    @Column(length = 120)
    private String id;

    @Column(nullable = false, length = 30)
    private String source;

    @Column(nullable = false, length = 30)
    private String instrument;

    @Column(nullable = false, length = 5)
    private String timeframe;

    /**
     * Bucket start (Unix epoch milliseconds), hypertable partition key
     */
    @Column(name = "bucket_start", nullable = false)
    private Long bucketStart;

    @Column(nullable = false)
    private Double open;

    @Column(nullable = false)
    private Double high;

    @Column(nullable = false)
    private Double low;

    @Column(nullable = false)
    private Double close;

    @Column(name = "base_volume", nullable = false)
    private Double baseVolume;

    @Column(name = "quote_volume", nullable = false)
    private Double quoteVolume;

    @Column(name = "trade_count", nullable = false)
    private Long tradeCount;

    @Column(nullable = false)
    private Boolean synthetic;

    /**
     * Base bucket that supplied open
     */
    @Column(name = "first_base_start", nullable = false)
    private Long firstBaseStart;

    /**
     * Base bucket that supplied close
     */
    @Column(name = "last_base_start", nullable = false)
    private Long lastBaseStart;

    @Column(name = "base_count", nullable = false)
    private Integer baseCount;

    @Column(name = "updated_at", nullable = false)
    private Long updatedAt;

    public static String generateId(String source, String instrument, String timeframe, long bucketStart) {
        return String.format("%s_%s_%s_%d", source, instrument, timeframe, bucketStart);
    }
}
