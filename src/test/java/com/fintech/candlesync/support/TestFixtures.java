package com.fintech.candlesync.support;

import com.fintech.candlesync.config.ApplicationConfig;
import com.fintech.candlesync.config.PipelineConfig;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.indicator.IndicatorDefinition;
import com.fintech.candlesync.indicator.IndicatorKind;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

/**
 * Builders for candles and configurations shared by the unit tests.
 */
public final class TestFixtures {

    /** 2023-11-15T00:00:00Z, aligned to every timeframe. */
    public static final long T0 = 1_700_006_400_000L;

    private TestFixtures() {
    }

    public static Candle candle(long bucketStart, double close) {
        return new Candle(bucketStart, close, close + 1.0, close - 1.0, close, 1.0, close, 10L, false);
    }

    public static Candle candle(long bucketStart, double open, double high, double low, double close, double volume) {
        return new Candle(bucketStart, open, high, low, close, volume, volume * close, 1L, false);
    }

    /** {@code count} contiguous candles from {@code start}; close of the i-th is {@code closes.applyAsDouble(i)}. */
    public static List<Candle> series(long start, Timeframe timeframe, int count, IntToDoubleFunction closes) {
        List<Candle> candles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            candles.add(candle(timeframe.shift(start, i), closes.applyAsDouble(i)));
        }
        return candles;
    }

    public static IndicatorDefinition sma(int period) {
        return IndicatorDefinition.of("SMA_" + period, IndicatorKind.SMA, Map.of("period", period));
    }

    public static IndicatorDefinition ema(int period) {
        return IndicatorDefinition.of("EMA_" + period, IndicatorKind.EMA, Map.of("period", period));
    }

    public static IndicatorDefinition rsi(int period) {
        return IndicatorDefinition.of("RSI_" + period, IndicatorKind.RSI, Map.of("period", period));
    }

    public static PipelineConfig config(List<String> instruments) {
        return config(instruments, List.of(sma(20), rsi(14)), List.of(Timeframe.M1), 200, 500, 20, false);
    }

    public static PipelineConfig config(List<String> instruments,
                                        List<IndicatorDefinition> definitions,
                                        List<Timeframe> indicatorTimeframes,
                                        int lookback,
                                        int catchUpBatchSize,
                                        int minCandles,
                                        boolean gapFilling) {
        return new PipelineConfig(
            List.of(new PipelineConfig.SourceConfig("binance", "binance", "http://localhost", instruments)),
            new PipelineConfig.SyncConfig(
                Duration.ofSeconds(60), 100, 5, 1000, Duration.ofSeconds(1), Duration.ofSeconds(2),
                new PipelineConfig.RetrySettings(3, Duration.ofMillis(1), 1.0, Duration.ofMillis(1))),
            new PipelineConfig.AggregationConfig(Timeframe.M1, List.of(Timeframe.M5, Timeframe.H1)),
            new PipelineConfig.IndicatorConfig(
                Duration.ofSeconds(60), indicatorTimeframes, lookback, 1000, catchUpBatchSize, minCandles,
                definitions, gapFilling, 0.1),
            new PipelineConfig.CacheConfig(Duration.ofSeconds(60), "indicators"));
    }

    /** The production retry policy built from {@code config}. */
    public static Retry retry(PipelineConfig config) {
        return new ApplicationConfig().exchangeSourceRetry(RetryRegistry.ofDefaults(), config);
    }
}
