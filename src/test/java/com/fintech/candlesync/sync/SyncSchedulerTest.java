package com.fintech.candlesync.sync;

import com.fintech.candlesync.aggregation.CandleAggregationService;
import com.fintech.candlesync.config.PipelineConfig;
import com.fintech.candlesync.domain.BucketAggregate;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.exception.StoreUnavailableException;
import com.fintech.candlesync.source.ExchangeSourceRegistry;
import com.fintech.candlesync.store.memory.InMemoryTimeSeriesStore;
import com.fintech.candlesync.support.MutableClock;
import com.fintech.candlesync.support.StubExchangeSource;
import com.fintech.candlesync.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.fintech.candlesync.support.TestFixtures.T0;
import static com.fintech.candlesync.support.TestFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SyncScheduler Tests")
class SyncSchedulerTest {

    private static final long MINUTE = 60_000L;
    private static final List<String> INSTRUMENTS = List.of("BTCUSDT", "ETHUSDT", "SOLUSDT");

    private MutableClock clock;
    private StubExchangeSource exchange;
    private InMemoryTimeSeriesStore store;
    private SimpleMeterRegistry meterRegistry;
    private PipelineConfig config;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0 + 499 * MINUTE + 30_000L);
        exchange = new StubExchangeSource("binance", clock);
        for (String instrument : INSTRUMENTS) {
            exchange.publish(instrument, series(T0, Timeframe.M1, 2000, i -> 100.0 + (i % 11)));
        }
        store = new InMemoryTimeSeriesStore();
        meterRegistry = new SimpleMeterRegistry();
        config = TestFixtures.config(INSTRUMENTS);
        scheduler = newScheduler(store);
    }

    private SyncScheduler newScheduler(InMemoryTimeSeriesStore target) {
        return newScheduler(target, exchange);
    }

    private SyncScheduler newScheduler(InMemoryTimeSeriesStore target, StubExchangeSource source) {
        return new SyncScheduler(config, new ExchangeSourceRegistry(List.of(source)), target,
            new CandleAggregationService(target, config, clock, meterRegistry),
            new CandleValidator(meterRegistry), TestFixtures.retry(config), clock, meterRegistry);
    }

    private static SeriesKey key(String instrument) {
        return new SeriesKey("binance", instrument, Timeframe.M1);
    }

    @Test
    @DisplayName("First tick backfills the latest backfillCount bars and derives coarser timeframes")
    void testBackfillOnEmptyStore() {
        Optional<SyncScheduler.TickSummary> summary = scheduler.tick();

        assertThat(summary).isPresent();
        assertThat(summary.get().succeeded()).isEqualTo(3);
        List<Candle> stored = store.queryCandles(key("BTCUSDT"), T0, T0 + 1000 * MINUTE);
        assertThat(stored).hasSize(100);
        assertThat(stored.get(0).bucketStart()).isEqualTo(T0 + 400 * MINUTE);
        assertThat(stored.get(99).bucketStart()).isEqualTo(T0 + 499 * MINUTE);
        assertThat(exchange.calls("BTCUSDT")).containsExactly(new StubExchangeSource.Call("BTCUSDT", null, 100));
        assertThat(store.queryCandles(key("BTCUSDT").withTimeframe(Timeframe.M5), T0, T0 + 1000 * MINUTE))
            .hasSize(20);
        assertThat(store.latestBucket(key("BTCUSDT").withTimeframe(Timeframe.H1))).isPresent();
        assertThat(meterRegistry.counter("pipeline.sync.candles.written").count()).isEqualTo(300.0);
    }

    @Test
    @DisplayName("Later ticks re-fetch the trailing refresh window")
    void testRefreshWindow() {
        scheduler.tick();
        clock.advance(Duration.ofMinutes(1));

        scheduler.tick();

        assertThat(exchange.calls("BTCUSDT")).last()
            .isEqualTo(new StubExchangeSource.Call("BTCUSDT", null, 5));
        assertThat(store.latestBucket(key("BTCUSDT"))).contains(T0 + 500 * MINUTE);
    }

    @Test
    @DisplayName("A lagging cursor catches up from the cursor instead of the trailing window")
    void testCatchUpAfterOutage() {
        scheduler.tick();
        clock.advance(Duration.ofMinutes(300));

        scheduler.tick();

        assertThat(exchange.calls("BTCUSDT")).last()
            .isEqualTo(new StubExchangeSource.Call("BTCUSDT", T0 + 499 * MINUTE, 301));
        assertThat(store.queryCandles(key("BTCUSDT"), T0 + 400 * MINUTE, T0 + 800 * MINUTE)).hasSize(400);
    }

    @Test
    @DisplayName("Catch-up is paged by maxFetchLimit across ticks")
    void testCatchUpPaging() {
        scheduler.tick();
        clock.advance(Duration.ofMinutes(1400));

        scheduler.tick();
        assertThat(exchange.calls("BTCUSDT")).last()
            .isEqualTo(new StubExchangeSource.Call("BTCUSDT", T0 + 499 * MINUTE, 1000));
        assertThat(store.latestBucket(key("BTCUSDT"))).contains(T0 + 1498 * MINUTE);

        scheduler.tick();
        assertThat(store.latestBucket(key("BTCUSDT"))).contains(T0 + 1899 * MINUTE);
    }

    @Test
    @DisplayName("A failing pair does not stop the others and recovers on the next tick")
    void testPartialFailureIsolation() {
        exchange.failNext("ETHUSDT", 3, true);

        Optional<SyncScheduler.TickSummary> first = scheduler.tick();

        assertThat(first.get().succeeded()).isEqualTo(2);
        assertThat(first.get().failed()).isEqualTo(1);
        assertThat(store.latestBucket(key("BTCUSDT"))).contains(T0 + 499 * MINUTE);
        assertThat(store.latestBucket(key("ETHUSDT"))).isEmpty();
        assertThat(store.latestBucket(key("SOLUSDT"))).contains(T0 + 499 * MINUTE);
        assertThat(meterRegistry.counter("pipeline.sync.pairs", "outcome", "failure").count()).isEqualTo(1.0);

        clock.advance(Duration.ofMinutes(1));
        Optional<SyncScheduler.TickSummary> second = scheduler.tick();

        assertThat(second.get().failed()).isZero();
        assertThat(store.latestBucket(key("ETHUSDT"))).contains(T0 + 500 * MINUTE);
    }

    @Test
    @DisplayName("Transient source errors are retried before the pair fails")
    void testRetryThenSucceed() {
        exchange.failNext("BTCUSDT", 2, true);

        Optional<SyncScheduler.TickSummary> summary = scheduler.tick();

        assertThat(summary.get().failed()).isZero();
        assertThat(exchange.calls("BTCUSDT")).hasSize(3);
        assertThat(store.latestBucket(key("BTCUSDT"))).isPresent();
    }

    @Test
    @DisplayName("Rejected requests are not retried")
    void testNonRetryableFailsFast() {
        exchange.failNext("BTCUSDT", 1, false);

        Optional<SyncScheduler.TickSummary> summary = scheduler.tick();

        assertThat(summary.get().failed()).isEqualTo(1);
        assertThat(exchange.calls("BTCUSDT")).hasSize(1);
    }

    @Test
    @DisplayName("Malformed bars are dropped while the rest of the batch is written")
    void testMalformedBarsDropped() {
        exchange.publish("BTCUSDT", List.of(
            new Candle(T0 + 498 * MINUTE, 100.0, 90.0, 95.0, 92.0, 1.0, 1.0, 1L, false)));

        scheduler.tick();

        assertThat(store.queryCandles(key("BTCUSDT"), T0, T0 + 1000 * MINUTE)).hasSize(99);
        assertThat(meterRegistry.counter("pipeline.sync.candles.malformed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("After a restart the cursor is rebuilt from the store instead of backfilling again")
    void testCursorRebuiltFromStore() {
        scheduler.tick();
        clock.advance(Duration.ofMinutes(2));
        SyncScheduler restarted = newScheduler(store);

        restarted.tick();

        assertThat(exchange.calls("BTCUSDT")).last()
            .isEqualTo(new StubExchangeSource.Call("BTCUSDT", null, 5));
        assertThat(store.latestBucket(key("BTCUSDT"))).contains(T0 + 501 * MINUTE);
    }

    @Test
    @DisplayName("runBackfill pages forward when the lookback exceeds maxFetchLimit")
    void testBackfillPagesBeyondFetchLimit() {
        clock.setMillis(T0 + 1999 * MINUTE + 30_000L);

        int written = scheduler.runBackfill("binance", "BTCUSDT", 1500);

        assertThat(written).isEqualTo(1500);
        assertThat(exchange.calls("BTCUSDT")).containsExactly(
            new StubExchangeSource.Call("BTCUSDT", T0 + 500 * MINUTE, 1000),
            new StubExchangeSource.Call("BTCUSDT", T0 + 1500 * MINUTE, 500));
        List<Candle> stored = store.queryCandles(key("BTCUSDT"), T0, T0 + 3000 * MINUTE);
        assertThat(stored).hasSize(1500);
        assertThat(stored.get(0).bucketStart()).isEqualTo(T0 + 500 * MINUTE);
        assertThat(stored.get(1499).bucketStart()).isEqualTo(T0 + 1999 * MINUTE);
    }

    @Test
    @DisplayName("Paged backfill stops when the source has no older history")
    void testPagedBackfillStopsAtHistoryStart() {
        int written = scheduler.runBackfill("binance", "BTCUSDT", 5000);

        assertThat(written).isEqualTo(500);
        assertThat(exchange.calls("BTCUSDT")).containsExactly(
            new StubExchangeSource.Call("BTCUSDT", T0 - 4500 * MINUTE, 1000));
        assertThat(store.latestBucket(key("BTCUSDT"))).contains(T0 + 499 * MINUTE);
    }

    @Test
    @DisplayName("A bar stored while open is re-fetched once the lag reaches refreshCount")
    void testCursorBarRefetchedAtRefreshBoundary() {
        scheduler.tick();
        exchange.publish("BTCUSDT", List.of(TestFixtures.candle(T0 + 499 * MINUTE, 150.0)));
        clock.advance(Duration.ofMinutes(5));

        scheduler.tick();

        assertThat(exchange.calls("BTCUSDT")).last()
            .isEqualTo(new StubExchangeSource.Call("BTCUSDT", T0 + 499 * MINUTE, 6));
        Candle finalized = store.queryCandles(key("BTCUSDT"), T0 + 499 * MINUTE, T0 + 500 * MINUTE).get(0);
        assertThat(finalized.close()).isEqualTo(150.0);
        assertThat(store.latestBucket(key("BTCUSDT"))).contains(T0 + 504 * MINUTE);
        Candle fiveMinute = store.queryCandles(key("BTCUSDT").withTimeframe(Timeframe.M5),
            T0 + 495 * MINUTE, T0 + 500 * MINUTE).get(0);
        assertThat(fiveMinute.close()).isEqualTo(150.0);
    }

    @Test
    @DisplayName("A derived bucket whose merge failed is written on a later tick")
    void testFailedDerivedBucketRetriedNextTick() {
        SeriesKey fiveMinuteKey = key("BTCUSDT").withTimeframe(Timeframe.M5);
        AtomicBoolean failOnce = new AtomicBoolean(true);
        InMemoryTimeSeriesStore flaky = new InMemoryTimeSeriesStore() {
            @Override
            public void mergeAggregates(SeriesKey key, List<BucketAggregate> aggregates) {
                if (key.equals(fiveMinuteKey) && aggregates.get(0).bucketStart() == T0 + 400 * MINUTE
                        && failOnce.getAndSet(false)) {
                    throw new StoreUnavailableException("write timed out");
                }
                super.mergeAggregates(key, aggregates);
            }
        };
        SyncScheduler flakyScheduler = newScheduler(flaky);

        flakyScheduler.tick();
        assertThat(flaky.queryCandles(fiveMinuteKey, T0 + 400 * MINUTE, T0 + 405 * MINUTE)).isEmpty();

        clock.advance(Duration.ofMinutes(1));
        flakyScheduler.tick();

        List<Candle> recovered = flaky.queryCandles(fiveMinuteKey, T0 + 400 * MINUTE, T0 + 405 * MINUTE);
        assertThat(recovered).hasSize(1);
        assertThat(recovered.get(0).baseVolume()).isCloseTo(5.0, within(1e-12));
        assertThat(meterRegistry.counter("pipeline.aggregation.buckets.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Unknown sources are rejected")
    void testUnknownSource() {
        assertThatThrownBy(() -> scheduler.runBackfill("kraken", "BTCUSDT", 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("kraken");
    }

    @Test
    @DisplayName("A tick started while another runs is skipped")
    void testOverlappingTickSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemoryTimeSeriesStore blocking = new InMemoryTimeSeriesStore() {
            @Override
            public Optional<Long> latestBucket(SeriesKey key) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.latestBucket(key);
            }
        };
        SyncScheduler blocked = newScheduler(blocking);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<SyncScheduler.TickSummary>> first = executor.submit(blocked::tick);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(blocked.tick()).isEmpty();

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
            assertThat(meterRegistry.counter("pipeline.sync.ticks.skipped").count()).isEqualTo(1.0);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("The tick after an overrunning tick is skipped")
    void testOverrunSkipsNextTick() {
        InMemoryTimeSeriesStore slow = new InMemoryTimeSeriesStore() {
            @Override
            public void insertCandles(SeriesKey key, List<Candle> candles) {
                clock.advance(Duration.ofSeconds(30));
                super.insertCandles(key, candles);
            }
        };
        SyncScheduler slowScheduler = newScheduler(slow);

        assertThat(slowScheduler.tick()).isPresent();
        assertThat(slowScheduler.tick()).isEmpty();
        assertThat(slowScheduler.tick()).isPresent();
    }
}
