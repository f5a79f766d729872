package com.fintech.candlesync.config;

import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.indicator.IndicatorDefinition;
import com.fintech.candlesync.indicator.IndicatorKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration for the candle sync pipeline.
 * Maps to 'pipeline.*' properties in application.yml.
 * Only used to build the immutable {@link PipelineConfig}; schedulers never read it directly.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineProperties {

    @Valid
    private List<Source> sources = new ArrayList<>();
    @Valid
    private Sync sync = new Sync();
    @Valid
    private Aggregation aggregation = new Aggregation();
    @Valid
    private Indicators indicators = new Indicators();
    private Cache cache = new Cache();
    private Store store = new Store();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Source {
        @NotBlank
        private String name = "binance";
        private String type = "binance";
        private String baseUrl = "https://api.binance.com";
        private boolean enabled = true;
        private List<String> instruments = new ArrayList<>();
    }

    @Data
    public static class Sync {
        private Duration interval = Duration.ofSeconds(60);
        @Min(1)
        private int backfillCount = 100;
        @Min(1)
        private int refreshCount = 5;
        private int maxFetchLimit = 1000;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Retry retry = new Retry();

        @Data
        public static class Retry {
            private int maxAttempts = 3;
            private Duration initialBackoff = Duration.ofMillis(500);
            private double multiplier = 2.0;
            private Duration maxBackoff = Duration.ofSeconds(5);
        }
    }

    @Data
    public static class Aggregation {
        @NotNull
        private String baseTimeframe = "1m";
        private List<String> targets = new ArrayList<>(List.of("5m", "1h"));
    }

    @Data
    public static class Indicators {
        private Duration interval = Duration.ofSeconds(60);
        private List<String> timeframes = new ArrayList<>(List.of("1m", "5m", "1h"));
        @Min(1)
        private int lookback = 200;
        private int catchUpHorizon = 1000;
        private int catchUpBatchSize = 500;
        private int minCandles = 20;
        @Valid
        private List<Definition> definitions = new ArrayList<>();
        private GapFilling gapFilling = new GapFilling();

        @Data
        public static class Definition {
            @NotBlank
            private String name;
            @NotBlank
            private String type;
            private Map<String, Integer> params = new LinkedHashMap<>();
            private Integer warmUp;  // null = the kind's default for these params
        }

        @Data
        public static class GapFilling {
            private boolean enabled = false;
            private double maxGapRatio = 0.1;
        }
    }

    @Data
    public static class Cache {
        private String type = "memory";  // memory | redis
        private Duration ttl = Duration.ofSeconds(60);
        private String keyPrefix = "indicators";
    }

    @Data
    public static class Store {
        private String type = "timescaledb";  // timescaledb | memory
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
    }

    /**
     * Validates the bound properties and builds the immutable configuration.
     *
     * @throws IllegalArgumentException on any invalid value
     */
    public PipelineConfig toConfig() {
        List<PipelineConfig.SourceConfig> sourceConfigs = new ArrayList<>();
        for (Source source : sources) {
            if (source.isEnabled()) {
                sourceConfigs.add(new PipelineConfig.SourceConfig(
                    source.getName(), source.getType(), source.getBaseUrl(), source.getInstruments()));
            }
        }

        Sync.Retry retry = sync.getRetry();
        PipelineConfig.SyncConfig syncConfig = new PipelineConfig.SyncConfig(
            sync.getInterval(),
            sync.getBackfillCount(),
            sync.getRefreshCount(),
            sync.getMaxFetchLimit(),
            sync.getConnectTimeout(),
            sync.getRequestTimeout(),
            new PipelineConfig.RetrySettings(
                retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier(), retry.getMaxBackoff()));

        PipelineConfig.AggregationConfig aggregationConfig = new PipelineConfig.AggregationConfig(
            Timeframe.fromCode(aggregation.getBaseTimeframe()),
            aggregation.getTargets().stream().map(Timeframe::fromCode).toList());

        List<IndicatorDefinition> definitions = new ArrayList<>();
        for (Indicators.Definition definition : indicators.getDefinitions()) {
            definitions.add(toDefinition(definition));
        }
        PipelineConfig.IndicatorConfig indicatorConfig = new PipelineConfig.IndicatorConfig(
            indicators.getInterval(),
            indicators.getTimeframes().stream().map(Timeframe::fromCode).toList(),
            indicators.getLookback(),
            indicators.getCatchUpHorizon(),
            indicators.getCatchUpBatchSize(),
            indicators.getMinCandles(),
            definitions,
            indicators.getGapFilling().isEnabled(),
            indicators.getGapFilling().getMaxGapRatio());

        return new PipelineConfig(
            sourceConfigs,
            syncConfig,
            aggregationConfig,
            indicatorConfig,
            new PipelineConfig.CacheConfig(cache.getTtl(), cache.getKeyPrefix()));
    }

    private static IndicatorDefinition toDefinition(Indicators.Definition definition) {
        IndicatorKind kind = IndicatorKind.fromName(definition.getType());
        IndicatorDefinition withDefaults = IndicatorDefinition.of(definition.getName(), kind, definition.getParams());
        if (definition.getWarmUp() == null) {
            return withDefaults;
        }
        return new IndicatorDefinition(
            withDefaults.name(), kind, withDefaults.params(), definition.getWarmUp());
    }
}
