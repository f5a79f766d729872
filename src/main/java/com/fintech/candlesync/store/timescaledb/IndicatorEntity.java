package com.fintech.candlesync.store.timescaledb;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA entity for one indicator value: (series, bucket, name) -> value.
 */
@Entity
@Table(
    name = "indicators",
    indexes = {
        @Index(name = "idx_indicators_series_bucket", columnList = "source, instrument, timeframe, bucket_start DESC")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorEntity {

    /**
     * Composite key: source_instrument_timeframe_bucket_name
     */
    @Id
    @Column(length = 200)
    private String id;

    @Column(nullable = false, length = 30)
    private String source;

    @Column(nullable = false, length = 30)
    private String instrument;

    @Column(nullable = false, length = 5)
    private String timeframe;

    @Column(name = "bucket_start", nullable = false)
    private Long bucketStart;

    @Column(nullable = false, length = 60)
    private String name;

    @Column(nullable = false)
    private Double value;

    @Column(name = "computed_at", nullable = false)
    private Long computedAt;

    public static String generateId(String source, String instrument, String timeframe, long bucketStart, String name) {
        return String.format("%s_%s_%s_%d_%s", source, instrument, timeframe, bucketStart, name);
    }
}
