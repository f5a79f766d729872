package com.fintech.candlesync.sync;

import com.fintech.candlesync.aggregation.CandleAggregationService;
import com.fintech.candlesync.config.PipelineConfig;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.exception.SourceUnavailableException;
import com.fintech.candlesync.exception.StoreUnavailableException;
import com.fintech.candlesync.source.ExchangeSource;
import com.fintech.candlesync.source.ExchangeSourceRegistry;
import com.fintech.candlesync.store.TimeSeriesStore;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps base-timeframe candles current for every configured (source, instrument) pair.
 *
 * <p>First run for a pair backfills the most recent {@code backfillCount} bars. Later ticks
 * re-fetch a small trailing window ({@code refreshCount} bars) and rely on replace-on-key to
 * settle the still-open bar. When the cursor lags further behind (restart, outage) the
 * fetch starts at the cursor instead, one source page per tick, until the gap closes.
 *
 * <p>Pairs are synced one after another in configured order. A failing pair is logged and
 * counted without affecting the others. Transient source errors are retried with
 * exponential backoff first.
 *
 * <p>Ticks never overlap: a tick that fires while another is running, or that fires late
 * because the previous one overran its period, is skipped and logged.
 */
@Component
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final PipelineConfig config;
    private final ExchangeSourceRegistry sources;
    private final TimeSeriesStore store;
    private final CandleAggregationService aggregationService;
    private final CandleValidator validator;
    private final Retry retry;
    private final Clock clock;
    private final Timeframe baseTimeframe;
    private final SyncCursors cursors = new SyncCursors();

    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private volatile boolean previousTickOverran = false;

    private final Counter pairsSucceeded;
    private final Counter pairsFailed;
    private final Counter ticksSkipped;
    private final Counter candlesWritten;
    private final Timer tickTimer;

    public SyncScheduler(
            PipelineConfig config,
            ExchangeSourceRegistry sources,
            TimeSeriesStore store,
            CandleAggregationService aggregationService,
            CandleValidator validator,
            Retry exchangeSourceRetry,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.config = config;
        this.sources = sources;
        this.store = store;
        this.aggregationService = aggregationService;
        this.validator = validator;
        this.retry = exchangeSourceRetry;
        this.clock = clock;
        this.baseTimeframe = config.aggregation().baseTimeframe();

        this.pairsSucceeded = meterRegistry.counter("pipeline.sync.pairs", "outcome", "success");
        this.pairsFailed = meterRegistry.counter("pipeline.sync.pairs", "outcome", "failure");
        this.ticksSkipped = meterRegistry.counter("pipeline.sync.ticks.skipped");
        this.candlesWritten = meterRegistry.counter("pipeline.sync.candles.written");
        this.tickTimer = meterRegistry.timer("pipeline.sync.tick.duration");

        log.info("Sync scheduler ready: {} pairs, base timeframe {}, interval {}",
            config.syncTargets().size(), baseTimeframe.code(), config.sync().interval());
    }

    /**
     * Outcome of one tick.
     *
     * @param succeeded pairs synced without error
     * @param failed pairs that failed and will be retried next tick
     * @param elapsedMs wall time of the tick
     */
    public record TickSummary(int succeeded, int failed, long elapsedMs) {
    }

    @Scheduled(
        fixedRateString = "#{@pipelineConfig.sync().interval().toMillis()}",
        initialDelayString = "${pipeline.sync.initial-delay-ms:5000}")
    public void scheduledTick() {
        tick();
    }

    /**
     * Syncs every configured pair once, sequentially.
     *
     * @return the summary, or empty when the tick was skipped
     */
    public Optional<TickSummary> tick() {
        if (!tickInProgress.compareAndSet(false, true)) {
            ticksSkipped.increment();
            log.warn("Skipping sync tick: previous tick still running");
            return Optional.empty();
        }
        try {
            if (previousTickOverran) {
                previousTickOverran = false;
                ticksSkipped.increment();
                log.warn("Skipping sync tick: previous tick overran its {} period", config.sync().interval());
                return Optional.empty();
            }
            long started = clock.millis();
            int succeeded = 0;
            int failed = 0;
            for (PipelineConfig.SyncTarget target : config.syncTargets()) {
                if (syncPair(target)) {
                    succeeded++;
                } else {
                    failed++;
                }
            }
            long elapsed = clock.millis() - started;
            tickTimer.record(elapsed, TimeUnit.MILLISECONDS);
            previousTickOverran = elapsed > config.sync().interval().toMillis();
            log.info("Sync tick complete: {} succeeded, {} failed, {}ms", succeeded, failed, elapsed);
            return Optional.of(new TickSummary(succeeded, failed, elapsed));
        } finally {
            tickInProgress.set(false);
        }
    }

    private boolean syncPair(PipelineConfig.SyncTarget target) {
        try {
            runIncrementalSync(target.source(), target.instrument());
            pairsSucceeded.increment();
            return true;
        } catch (SourceUnavailableException e) {
            pairsFailed.increment();
            log.error("Sync failed for {}/{}: source unavailable (retryable={}): {}",
                target.source(), target.instrument(), e.isRetryable(), e.getMessage());
        } catch (StoreUnavailableException e) {
            pairsFailed.increment();
            log.error("Sync failed for {}/{}: store unavailable", target.source(), target.instrument(), e);
        } catch (RuntimeException e) {
            pairsFailed.increment();
            log.error("Sync failed for {}/{}: unexpected error", target.source(), target.instrument(), e);
        }
        return false;
    }

    /**
     * Fetches the most recent {@code lookbackCount} base bars and writes them.
     * A lookback larger than the source's page size is paged forward from the oldest
     * bar of the window.
     *
     * @return number of candles written
     * @throws SourceUnavailableException if the source stays unreachable after retries
     */
    public int runBackfill(String sourceName, String instrument, int lookbackCount) {
        SeriesKey key = new SeriesKey(sourceName, instrument, baseTimeframe);
        int maxFetchLimit = config.sync().maxFetchLimit();
        if (lookbackCount <= maxFetchLimit) {
            log.info("Backfilling {} with the latest {} bars", key, lookbackCount);
            int written = write(key, fetch(sourceName, instrument, null, lookbackCount));
            log.info("Backfill of {} complete: {} candles written", key, written);
            return written;
        }

        long current = baseTimeframe.alignTimestamp(clock.millis());
        long since = baseTimeframe.shift(current, -(lookbackCount - 1L));
        log.info("Backfilling {} with the latest {} bars in pages of {} from {}",
            key, lookbackCount, maxFetchLimit, since);
        int written = 0;
        int pages = 0;
        long remaining = lookbackCount;
        while (remaining > 0) {
            List<Candle> page = fetch(sourceName, instrument, since, (int) Math.min(remaining, maxFetchLimit));
            if (page.isEmpty()) {
                log.warn("Backfill of {} stopped at {}: source returned no bars", key, since);
                break;
            }
            pages++;
            written += write(key, page);
            long last = page.get(page.size() - 1).bucketStart();
            if (last >= current) {
                break;
            }
            remaining = (current - last) / baseTimeframe.toMillis();
            since = baseTimeframe.shift(last, 1);
        }
        log.info("Backfill of {} complete: {} candles written in {} pages", key, written, pages);
        return written;
    }

    /**
     * Re-fetches the trailing window for one pair, or catches up from the cursor when it lags.
     * Backfills instead when the store holds nothing for the pair yet.
     *
     * @return number of candles written
     */
    public int runIncrementalSync(String sourceName, String instrument) {
        SeriesKey key = new SeriesKey(sourceName, instrument, baseTimeframe);
        Optional<Long> cursor = cursors.get(key);
        if (cursor.isEmpty()) {
            cursor = store.latestBucket(key);
            if (cursor.isEmpty()) {
                return runBackfill(sourceName, instrument, config.sync().backfillCount());
            }
            cursors.advance(key, cursor.get());
            log.info("Rebuilt sync cursor for {} from store at {}", key, cursor.get());
        }

        long current = baseTimeframe.alignTimestamp(clock.millis());
        long lag = (current - cursor.get()) / baseTimeframe.toMillis();
        int refreshCount = config.sync().refreshCount();
        List<Candle> fetched;
        // the trailing window must still include the cursor bar
        if (lag >= refreshCount) {
            int limit = (int) Math.min(lag + 1, config.sync().maxFetchLimit());
            log.info("{} is {} bars behind, catching up from {} ({} bars)", key, lag, cursor.get(), limit);
            fetched = fetch(sourceName, instrument, cursor.get(), limit);
        } else {
            fetched = fetch(sourceName, instrument, null, refreshCount);
        }
        return write(key, fetched);
    }

    private List<Candle> fetch(String sourceName, String instrument, Long since, int limit) {
        ExchangeSource source = sources.get(sourceName);
        return Retry.decorateSupplier(retry, () -> source.fetchOhlcv(instrument, baseTimeframe, since, limit)).get();
    }

    private int write(SeriesKey key, List<Candle> fetched) {
        List<Candle> valid = validator.validate(key, fetched, clock.millis());
        if (valid.isEmpty()) {
            log.warn("No valid candles returned for {} ({} fetched)", key, fetched.size());
            aggregationService.retryFailed(key);
            return 0;
        }
        store.insertCandles(key, valid);
        candlesWritten.increment(valid.size());
        cursors.advance(key, valid.get(valid.size() - 1).bucketStart());
        int derived = aggregationService.aggregate(key, valid);
        if (log.isDebugEnabled()) {
            log.debug("Wrote {} candles for {} and merged {} derived buckets", valid.size(), key, derived);
        }
        return valid.size();
    }
}
