package com.fintech.candlesync.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Common tags and timer distribution settings for Prometheus.
 *
 * Timers here measure network and database round trips (milliseconds to seconds), so the
 * SLO buckets are coarse. Percentiles are computed client-side with HdrHistogram.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(
            @Value("${spring.profiles.active:local}") String environment) {
        return registry -> {
            registry.config().commonTags(
                "application", "candle-sync-pipeline",
                "environment", environment
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        .serviceLevelObjectives(
                            Duration.ofMillis(1).toNanos(),
                            Duration.ofMillis(10).toNanos(),
                            Duration.ofMillis(100).toNanos(),
                            Duration.ofMillis(500).toNanos(),
                            Duration.ofSeconds(1).toNanos(),
                            Duration.ofSeconds(5).toNanos(),
                            Duration.ofSeconds(30).toNanos()
                        )
                        .percentilesHistogram(true)
                        // 60s max age, 3 rotations
                        .expiry(Duration.ofSeconds(60))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }
}
