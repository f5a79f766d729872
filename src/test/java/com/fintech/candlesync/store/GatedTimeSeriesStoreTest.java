package com.fintech.candlesync.store;

import com.fintech.candlesync.aggregation.CandleAggregationService;
import com.fintech.candlesync.cache.InMemoryIndicatorCache;
import com.fintech.candlesync.config.PipelineConfig;
import com.fintech.candlesync.domain.BucketAggregate;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.exception.StoreUnavailableException;
import com.fintech.candlesync.gate.SequentialAccessGate;
import com.fintech.candlesync.indicator.IndicatorEngine;
import com.fintech.candlesync.indicator.IndicatorScheduler;
import com.fintech.candlesync.source.ExchangeSourceRegistry;
import com.fintech.candlesync.store.memory.InMemoryTimeSeriesStore;
import com.fintech.candlesync.support.MutableClock;
import com.fintech.candlesync.support.StubExchangeSource;
import com.fintech.candlesync.support.TestFixtures;
import com.fintech.candlesync.sync.CandleValidator;
import com.fintech.candlesync.sync.SyncScheduler;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.fintech.candlesync.support.TestFixtures.T0;
import static com.fintech.candlesync.support.TestFixtures.candle;
import static com.fintech.candlesync.support.TestFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GatedTimeSeriesStore Tests")
class GatedTimeSeriesStoreTest {

    private static final long MINUTE = 60_000L;
    private static final SeriesKey KEY = new SeriesKey("binance", "BTCUSDT", Timeframe.M1);

    /** Counts concurrent calls into the backing store and remembers the peak. */
    static class OverlapDetectingStore implements TimeSeriesStore {
        final InMemoryTimeSeriesStore delegate = new InMemoryTimeSeriesStore();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final AtomicInteger calls = new AtomicInteger();

        private <T> T guard(Supplier<T> body) {
            calls.incrementAndGet();
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(1);
                return body.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StoreUnavailableException("interrupted");
            } finally {
                inFlight.decrementAndGet();
            }
        }

        @Override
        public void insertCandles(SeriesKey key, List<Candle> candles) {
            guard(() -> {
                delegate.insertCandles(key, candles);
                return null;
            });
        }

        @Override
        public void mergeAggregates(SeriesKey key, List<BucketAggregate> aggregates) {
            guard(() -> {
                delegate.mergeAggregates(key, aggregates);
                return null;
            });
        }

        @Override
        public List<Candle> queryCandles(SeriesKey key, long fromInclusive, long toExclusive) {
            return guard(() -> delegate.queryCandles(key, fromInclusive, toExclusive));
        }

        @Override
        public List<Candle> latestCandles(SeriesKey key, int limit) {
            return guard(() -> delegate.latestCandles(key, limit));
        }

        @Override
        public Optional<Long> latestBucket(SeriesKey key) {
            return guard(() -> delegate.latestBucket(key));
        }

        @Override
        public void insertIndicators(IndicatorSet indicators) {
            guard(() -> {
                delegate.insertIndicators(indicators);
                return null;
            });
        }

        @Override
        public List<IndicatorSet> queryIndicators(SeriesKey key, long fromInclusive, long toExclusive) {
            return guard(() -> delegate.queryIndicators(key, fromInclusive, toExclusive));
        }

        @Override
        public Optional<Long> latestIndicatorBucket(SeriesKey key) {
            return guard(() -> delegate.latestIndicatorBucket(key));
        }

        @Override
        public boolean isHealthy() {
            return guard(delegate::isHealthy);
        }
    }

    private OverlapDetectingStore backing;
    private CircuitBreakerRegistry circuitBreakerRegistry;
    private SimpleMeterRegistry meterRegistry;
    private GatedTimeSeriesStore gated;

    @BeforeEach
    void setUp() {
        backing = new OverlapDetectingStore();
        circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        meterRegistry = new SimpleMeterRegistry();
        gated = new GatedTimeSeriesStore(backing, new SequentialAccessGate(meterRegistry), circuitBreakerRegistry);
    }

    @Test
    @DisplayName("Concurrent sync and indicator ticks never overlap inside the store")
    void testNoOverlapUnderConcurrentSchedulers() throws Exception {
        List<String> instruments = List.of("BTCUSDT", "ETHUSDT");
        MutableClock clock = new MutableClock(T0 + 299 * MINUTE + 30_000L);
        StubExchangeSource exchange = new StubExchangeSource("binance", clock);
        instruments.forEach(i -> exchange.publish(i, series(T0, Timeframe.M1, 300, n -> 100.0 + (n % 13))));
        PipelineConfig config = TestFixtures.config(instruments, List.of(TestFixtures.sma(20), TestFixtures.rsi(14)),
            List.of(Timeframe.M1, Timeframe.M5), 200, 50, 20, false);
        SyncScheduler sync = new SyncScheduler(config, new ExchangeSourceRegistry(List.of(exchange)), gated,
            new CandleAggregationService(gated, config, clock, meterRegistry), new CandleValidator(meterRegistry),
            TestFixtures.retry(config), clock, meterRegistry);
        IndicatorScheduler indicators = new IndicatorScheduler(config, gated,
            new IndicatorEngine(config.indicators().definitions()), new InMemoryIndicatorCache(clock), clock,
            meterRegistry);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> syncRuns = executor.submit(() -> {
                for (int i = 0; i < 5; i++) {
                    sync.tick();
                }
            });
            Future<?> indicatorRuns = executor.submit(() -> {
                for (int i = 0; i < 5; i++) {
                    indicators.tick();
                }
            });
            syncRuns.get(60, TimeUnit.SECONDS);
            indicatorRuns.get(60, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        indicators.tick();

        assertThat(backing.calls.get()).isGreaterThan(10);
        assertThat(backing.maxInFlight.get()).isEqualTo(1);
        assertThat(backing.delegate.latestBucket(KEY)).contains(T0 + 299 * MINUTE);
        assertThat(backing.delegate.latestIndicatorBucket(KEY)).contains(T0 + 299 * MINUTE);
    }

    @Test
    @DisplayName("Open breaker rejects calls without touching the backing store")
    void testOpenBreakerFailsFast() {
        circuitBreakerRegistry.circuitBreaker("store").transitionToOpenState();

        assertThatThrownBy(() -> gated.latestBucket(KEY))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("circuit breaker is open");
        assertThat(backing.calls.get()).isZero();
        assertThat(gated.getCircuitBreakerState()).isEqualTo("OPEN");
    }

    @Test
    @DisplayName("Health probe still reaches the store while the breaker is open")
    void testHealthBypassesBreaker() {
        circuitBreakerRegistry.circuitBreaker("store").transitionToOpenState();

        assertThat(gated.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Empty writes are not forwarded")
    void testEmptyWritesSkipped() {
        gated.insertCandles(KEY, List.of());
        gated.mergeAggregates(KEY, List.of());
        gated.insertIndicators(new IndicatorSet(KEY, T0, Map.of(), Instant.ofEpochMilli(T0)));

        assertThat(backing.calls.get()).isZero();
    }

    @Test
    @DisplayName("Calls pass through to the backing store")
    void testDelegation() {
        gated.insertCandles(KEY, List.of(candle(T0, 100.0)));

        assertThat(gated.queryCandles(KEY, T0, T0 + MINUTE)).hasSize(1);
        assertThat(gated.latestCandles(KEY, 5)).hasSize(1);
        assertThat(backing.calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Backing store failures propagate and are recorded by the breaker")
    void testFailuresPropagate() {
        TimeSeriesStore failing = new InMemoryTimeSeriesStore() {
            @Override
            public Optional<Long> latestBucket(SeriesKey key) {
                throw new StoreUnavailableException("connection refused");
            }
        };
        GatedTimeSeriesStore store = new GatedTimeSeriesStore(failing,
            new SequentialAccessGate(meterRegistry), circuitBreakerRegistry);

        assertThatThrownBy(() -> store.latestBucket(KEY))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessage("connection refused");
        assertThat(circuitBreakerRegistry.circuitBreaker("store").getMetrics().getNumberOfFailedCalls()).isEqualTo(1);
    }
}
