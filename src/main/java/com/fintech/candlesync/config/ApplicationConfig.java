package com.fintech.candlesync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.candlesync.exception.SourceUnavailableException;
import com.fintech.candlesync.gate.SequentialAccessGate;
import com.fintech.candlesync.indicator.IndicatorEngine;
import com.fintech.candlesync.source.ExchangeSourceRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Validated, immutable configuration. Startup fails here on invalid properties.
     */
    @Bean
    public PipelineConfig pipelineConfig(PipelineProperties properties) {
        PipelineConfig config = properties.toConfig();
        if (config.syncTargets().isEmpty()) {
            log.warn("No instruments configured under pipeline.sources; schedulers will idle");
        }
        if (config.indicators().definitions().isEmpty()) {
            log.warn("No indicators configured under pipeline.indicators.definitions");
        }
        return config;
    }

    @Bean
    public SequentialAccessGate sequentialAccessGate(MeterRegistry meterRegistry) {
        return new SequentialAccessGate(meterRegistry);
    }

    @Bean
    public IndicatorEngine indicatorEngine(PipelineConfig pipelineConfig) {
        return new IndicatorEngine(pipelineConfig.indicators().definitions());
    }

    @Bean
    public HttpClient exchangeHttpClient(PipelineConfig pipelineConfig) {
        return HttpClient.newBuilder()
            .connectTimeout(pipelineConfig.sync().connectTimeout())
            .build();
    }

    @Bean
    public ExchangeSourceRegistry exchangeSourceRegistry(PipelineConfig pipelineConfig,
                                                         HttpClient exchangeHttpClient,
                                                         ObjectMapper objectMapper) {
        return ExchangeSourceRegistry.fromConfig(pipelineConfig, exchangeHttpClient, objectMapper);
    }

    /**
     * Bounded exponential backoff for transient source failures.
     * Non-retryable failures (rejected requests) and malformed payloads fail immediately.
     */
    @Bean
    public Retry exchangeSourceRetry(RetryRegistry retryRegistry, PipelineConfig pipelineConfig) {
        PipelineConfig.RetrySettings settings = pipelineConfig.sync().retry();
        RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(settings.maxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                settings.initialBackoff(), settings.multiplier(), settings.maxBackoff()))
            .retryOnException(e -> e instanceof SourceUnavailableException s && s.isRetryable())
            .build();
        Retry retry = retryRegistry.retry("exchangeSource", retryConfig);
        retry.getEventPublisher()
            .onRetry(event -> log.warn("Retrying exchange call (attempt {}) after {}: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        return retry;
    }
}
