package com.fintech.candlesync.config;

import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.indicator.IndicatorDefinition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, validated pipeline configuration handed to every scheduler at startup.
 * Built from {@link PipelineProperties#toConfig()}; tests construct it directly.
 */
public record PipelineConfig(
    List<SourceConfig> sources,
    SyncConfig sync,
    AggregationConfig aggregation,
    IndicatorConfig indicators,
    CacheConfig cache
) {

    public PipelineConfig {
        sources = List.copyOf(sources);
        Objects.requireNonNull(sync, "Sync config cannot be null");
        Objects.requireNonNull(aggregation, "Aggregation config cannot be null");
        Objects.requireNonNull(indicators, "Indicator config cannot be null");
        Objects.requireNonNull(cache, "Cache config cannot be null");
        long distinct = sources.stream().map(SourceConfig::name).distinct().count();
        if (distinct != sources.size()) {
            throw new IllegalArgumentException("Source names must be unique");
        }
    }

    /** Every (source, instrument) pair in configured order. */
    public List<SyncTarget> syncTargets() {
        List<SyncTarget> targets = new ArrayList<>();
        for (SourceConfig source : sources) {
            for (String instrument : source.instruments()) {
                targets.add(new SyncTarget(source.name(), instrument));
            }
        }
        return targets;
    }

    public record SyncTarget(String source, String instrument) {
    }

    public record SourceConfig(String name, String type, String baseUrl, List<String> instruments) {
        public SourceConfig {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Source name cannot be blank");
            }
            type = type == null || type.isBlank() ? name : type;
            instruments = List.copyOf(instruments);
        }
    }

    /**
     * @param interval Fixed tick period
     * @param backfillCount Bars fetched on the first run for a pair, paged by maxFetchLimit
     * @param refreshCount Trailing overlap window re-fetched every tick
     * @param maxFetchLimit Largest page the source accepts
     * @param connectTimeout Connect timeout for source calls
     * @param requestTimeout Per-request timeout for source calls
     * @param retry Backoff for transient source failures
     */
    public record SyncConfig(
        Duration interval,
        int backfillCount,
        int refreshCount,
        int maxFetchLimit,
        Duration connectTimeout,
        Duration requestTimeout,
        RetrySettings retry
    ) {
        public SyncConfig {
            requirePositive(interval, "sync.interval");
            requirePositive(connectTimeout, "sync.connect-timeout");
            requirePositive(requestTimeout, "sync.request-timeout");
            if (backfillCount < 1 || refreshCount < 1 || maxFetchLimit < 1) {
                throw new IllegalArgumentException("sync counts must be positive");
            }
            if (refreshCount > maxFetchLimit) {
                throw new IllegalArgumentException("sync.refresh-count cannot exceed max-fetch-limit " + maxFetchLimit);
            }
            Objects.requireNonNull(retry, "Retry settings cannot be null");
        }
    }

    public record RetrySettings(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        public RetrySettings {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("retry.max-attempts must be at least 1");
            }
            requirePositive(initialBackoff, "retry.initial-backoff");
            requirePositive(maxBackoff, "retry.max-backoff");
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("retry.multiplier must be >= 1.0");
            }
        }
    }

    public record AggregationConfig(Timeframe baseTimeframe, List<Timeframe> targets) {
        public AggregationConfig {
            Objects.requireNonNull(baseTimeframe, "Base timeframe cannot be null");
            targets = List.copyOf(targets);
            for (Timeframe target : targets) {
                if (!target.isCoarserThan(baseTimeframe)) {
                    throw new IllegalArgumentException(
                        "Aggregation target " + target.code() + " is not a multiple of base " + baseTimeframe.code());
                }
            }
        }
    }

    /**
     * @param interval Fixed tick period
     * @param timeframes Timeframes indicators are computed on
     * @param lookback History window each bucket is evaluated on
     * @param catchUpHorizon How far back a series with no stored indicators starts
     * @param catchUpBatchSize Buckets fetched per catch-up query
     * @param minCandles Series shorter than this are skipped
     * @param definitions Configured indicators in output order
     * @param gapFillingEnabled Forward-fill missing buckets before evaluation
     * @param maxGapRatio Largest tolerated share of synthetic candles in a window
     */
    public record IndicatorConfig(
        Duration interval,
        List<Timeframe> timeframes,
        int lookback,
        int catchUpHorizon,
        int catchUpBatchSize,
        int minCandles,
        List<IndicatorDefinition> definitions,
        boolean gapFillingEnabled,
        double maxGapRatio
    ) {
        public IndicatorConfig {
            requirePositive(interval, "indicators.interval");
            timeframes = List.copyOf(timeframes);
            definitions = List.copyOf(definitions);
            if (lookback < 1 || catchUpHorizon < 1 || catchUpBatchSize < 1 || minCandles < 1) {
                throw new IllegalArgumentException("indicator window sizes must be positive");
            }
            if (minCandles > lookback) {
                throw new IllegalArgumentException("indicators.min-candles " + minCandles
                    + " exceeds lookback " + lookback + "; no series could ever be evaluated");
            }
            for (IndicatorDefinition definition : definitions) {
                if (definition.warmUp() > lookback) {
                    throw new IllegalArgumentException("Warm-up " + definition.warmUp() + " of " + definition.name()
                        + " exceeds lookback " + lookback);
                }
            }
            long distinct = definitions.stream().flatMap(d -> d.outputNames().stream()).distinct().count();
            long total = definitions.stream().mapToLong(d -> d.outputNames().size()).sum();
            if (distinct != total) {
                throw new IllegalArgumentException("Indicator output names must be unique");
            }
            if (maxGapRatio < 0.0 || maxGapRatio > 1.0) {
                throw new IllegalArgumentException("indicators.gap-filling.max-gap-ratio must be within [0, 1]");
            }
        }
    }

    public record CacheConfig(Duration ttl, String keyPrefix) {
        public CacheConfig {
            requirePositive(ttl, "cache.ttl");
            if (keyPrefix == null || keyPrefix.isBlank()) {
                throw new IllegalArgumentException("cache.key-prefix cannot be blank");
            }
        }
    }

    private static void requirePositive(Duration duration, String property) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(property + " must be a positive duration, got " + duration);
        }
    }
}
