package com.fintech.candlesync.indicator;

import com.fintech.candlesync.cache.IndicatorCache;
import com.fintech.candlesync.config.PipelineConfig;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.store.TimeSeriesStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Computes the configured indicators for every (source, instrument, timeframe) series and
 * writes them to the store and the cache.
 *
 * <p>Each series moves through {@link IndicatorState}:
 * <ul>
 *   <li>COLD: reads the newest lookback window and the newest stored indicator bucket once to
 *       decide where to resume</li>
 *   <li>CATCHING_UP: one range query per batch; every uncovered bucket in the batch is evaluated,
 *       oldest first, on its trailing lookback window from that in-memory history</li>
 *   <li>CURRENT: one query for the newest window; the buckets from the cursor onwards are
 *       evaluated, and the freshest bucket is recomputed on every tick since it may still be filling</li>
 * </ul>
 *
 * <p>The cursor is the first bucket that still has to be (re)computed. It lives in memory only;
 * after a restart it is rebuilt from the newest stored indicator bucket.
 *
 * <p>A failed write of one bucket's set holds the cursor at that bucket, so it is retried on
 * the next tick, while the later buckets of the same pass are still written.
 */
@Component
public class IndicatorScheduler {

    private static final Logger log = LoggerFactory.getLogger(IndicatorScheduler.class);

    private final PipelineConfig config;
    private final PipelineConfig.IndicatorConfig settings;
    private final TimeSeriesStore store;
    private final IndicatorEngine engine;
    private final IndicatorCache cache;
    private final Clock clock;

    private final Map<SeriesKey, Progress> progress = new ConcurrentHashMap<>();
    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private volatile boolean previousTickOverran = false;

    private final Counter bucketsWritten;
    private final Counter bucketsFailed;
    private final Counter seriesFailed;
    private final Counter ticksSkipped;
    private final Timer tickTimer;

    public IndicatorScheduler(
            PipelineConfig config,
            TimeSeriesStore store,
            IndicatorEngine engine,
            IndicatorCache cache,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.config = config;
        this.settings = config.indicators();
        this.store = store;
        this.engine = engine;
        this.cache = cache;
        this.clock = clock;

        this.bucketsWritten = meterRegistry.counter("pipeline.indicators.buckets", "outcome", "written");
        this.bucketsFailed = meterRegistry.counter("pipeline.indicators.buckets", "outcome", "failed");
        this.seriesFailed = meterRegistry.counter("pipeline.indicators.series.failed");
        this.ticksSkipped = meterRegistry.counter("pipeline.indicators.ticks.skipped");
        this.tickTimer = meterRegistry.timer("pipeline.indicators.tick.duration");

        log.info("Indicator scheduler ready: {} indicators on {} timeframes, lookback {}, gap filling {}",
            engine.definitions().size(), settings.timeframes().size(), settings.lookback(),
            settings.gapFillingEnabled() ? "on" : "off");
    }

    /** Mutable per-series progress; only touched by the thread running the tick. */
    private static final class Progress {
        IndicatorState state = IndicatorState.COLD;
        long nextBucket;
        long latestKnown;
    }

    /**
     * Outcome of one tick.
     *
     * @param seriesProcessed series handled without error
     * @param seriesFailed series that threw and will be retried next tick
     * @param bucketsWritten indicator sets written
     * @param elapsedMs wall time of the tick
     */
    public record TickSummary(int seriesProcessed, int seriesFailed, int bucketsWritten, long elapsedMs) {
    }

    private record PassResult(int written, Long firstFailure, Long lastEvaluated) {
    }

    @Scheduled(
        fixedRateString = "#{@pipelineConfig.indicators().interval().toMillis()}",
        initialDelayString = "${pipeline.indicators.initial-delay-ms:10000}")
    public void scheduledTick() {
        tick();
    }

    /**
     * Processes every series once, sequentially.
     *
     * @return the summary, or empty when the tick was skipped
     */
    public Optional<TickSummary> tick() {
        if (!tickInProgress.compareAndSet(false, true)) {
            ticksSkipped.increment();
            log.warn("Skipping indicator tick: previous tick still running");
            return Optional.empty();
        }
        try {
            if (previousTickOverran) {
                previousTickOverran = false;
                ticksSkipped.increment();
                log.warn("Skipping indicator tick: previous tick overran its {} period", settings.interval());
                return Optional.empty();
            }
            long started = clock.millis();
            int processed = 0;
            int failed = 0;
            int written = 0;
            for (SeriesKey key : seriesKeys()) {
                try {
                    written += processSeries(key);
                    processed++;
                } catch (RuntimeException e) {
                    failed++;
                    seriesFailed.increment();
                    log.error("Indicator processing failed for {} in state {}", key, state(key), e);
                }
            }
            long elapsed = clock.millis() - started;
            tickTimer.record(elapsed, TimeUnit.MILLISECONDS);
            previousTickOverran = elapsed > settings.interval().toMillis();
            log.info("Indicator tick complete: {} series processed, {} failed, {} buckets written, {}ms",
                processed, failed, written, elapsed);
            return Optional.of(new TickSummary(processed, failed, written, elapsed));
        } finally {
            tickInProgress.set(false);
        }
    }

    /** Every configured instrument on every indicator timeframe, in configured order. */
    public List<SeriesKey> seriesKeys() {
        List<SeriesKey> keys = new ArrayList<>();
        for (PipelineConfig.SyncTarget target : config.syncTargets()) {
            for (Timeframe timeframe : settings.timeframes()) {
                keys.add(new SeriesKey(target.source(), target.instrument(), timeframe));
            }
        }
        return keys;
    }

    public IndicatorState state(SeriesKey key) {
        Progress p = progress.get(key);
        return p == null ? IndicatorState.COLD : p.state;
    }

    /**
     * Advances one series as far as this tick allows.
     *
     * @return number of indicator sets written
     */
    public int processSeries(SeriesKey key) {
        Progress p = progress.computeIfAbsent(key, k -> new Progress());
        if (p.state == IndicatorState.COLD && !initialize(key, p)) {
            return 0;
        }
        int written = 0;
        if (p.state == IndicatorState.CATCHING_UP) {
            written += catchUp(key, p);
        }
        if (p.state == IndicatorState.CURRENT) {
            written += refreshCurrent(key, p);
        }
        return written;
    }

    private boolean initialize(SeriesKey key, Progress p) {
        Timeframe tf = key.timeframe();
        List<Candle> window = store.latestCandles(key, settings.lookback());
        if (window.isEmpty()) {
            log.debug("No candles yet for {}", key);
            return false;
        }
        if (window.size() < settings.minCandles()) {
            log.info("Skipping {}: only {} candles stored, need {}", key, window.size(), settings.minCandles());
            return false;
        }
        long latest = window.get(window.size() - 1).bucketStart();
        Optional<Long> storedIndicator = store.latestIndicatorBucket(key);
        p.latestKnown = latest;
        p.nextBucket = storedIndicator
            .map(bucket -> Math.min(bucket, latest))
            .orElseGet(() -> tf.shift(latest, -(settings.catchUpHorizon() - 1L)));
        p.state = pendingBuckets(tf, p.nextBucket, latest) > settings.lookback()
            ? IndicatorState.CATCHING_UP
            : IndicatorState.CURRENT;
        log.info("{} initialized: resuming at {} ({} stored indicators), latest candle {}, state {}",
            key, Instant.ofEpochMilli(p.nextBucket), storedIndicator.isPresent() ? "found" : "no",
            Instant.ofEpochMilli(latest), p.state);
        return true;
    }

    private int catchUp(SeriesKey key, Progress p) {
        Timeframe tf = key.timeframe();
        int written = 0;
        while (p.state == IndicatorState.CATCHING_UP) {
            long batchEnd = tf.shift(p.nextBucket, settings.catchUpBatchSize());
            long historyStart = tf.shift(p.nextBucket, -(settings.lookback() - 1L));
            List<Candle> history = store.queryCandles(key, historyStart, batchEnd);
            PassResult result = evaluatePass(key, history, p.nextBucket, batchEnd);
            written += result.written();

            if (result.firstFailure() != null) {
                p.nextBucket = result.firstFailure();
                log.warn("{} catch-up paused at {} after a failed write; retrying next tick",
                    key, Instant.ofEpochMilli(p.nextBucket));
                return written;
            }
            if (result.lastEvaluated() != null) {
                p.latestKnown = Math.max(p.latestKnown, result.lastEvaluated());
            }
            p.nextBucket = batchEnd;
            if (p.nextBucket > p.latestKnown) {
                p.nextBucket = p.latestKnown;
                p.state = IndicatorState.CURRENT;
            } else if (pendingBuckets(tf, p.nextBucket, p.latestKnown) <= settings.lookback()) {
                p.state = IndicatorState.CURRENT;
            }
            if (log.isDebugEnabled()) {
                log.debug("{} catch-up batch done: {} sets written, next bucket {}",
                    key, result.written(), Instant.ofEpochMilli(p.nextBucket));
            }
        }
        log.info("{} caught up ({} sets written this tick)", key, written);
        return written;
    }

    private int refreshCurrent(SeriesKey key, Progress p) {
        Timeframe tf = key.timeframe();
        long now = tf.alignTimestamp(clock.millis());
        long pending = Math.max(1L, pendingBuckets(tf, p.nextBucket, now));
        if (pending > settings.lookback()) {
            // clock-based estimate, confirm against the store before switching
            p.latestKnown = store.latestBucket(key).orElse(p.latestKnown);
            if (pendingBuckets(tf, p.nextBucket, p.latestKnown) > settings.lookback()) {
                log.warn("{} fell {} buckets behind, switching to catch-up", key, pending);
                p.state = IndicatorState.CATCHING_UP;
                int written = catchUp(key, p);
                return p.state == IndicatorState.CURRENT ? written + refreshCurrent(key, p) : written;
            }
            pending = Math.max(1L, pendingBuckets(tf, p.nextBucket, p.latestKnown));
        }

        List<Candle> history = store.latestCandles(key, (int) (settings.lookback() + pending - 1));
        if (history.isEmpty()) {
            return 0;
        }
        long latest = history.get(history.size() - 1).bucketStart();
        p.latestKnown = Math.max(p.latestKnown, latest);
        PassResult result = evaluatePass(key, history, p.nextBucket, tf.windowEnd(latest));
        if (result.firstFailure() != null) {
            p.nextBucket = result.firstFailure();
        } else if (result.lastEvaluated() != null) {
            p.nextBucket = result.lastEvaluated();
        }
        return result.written();
    }

    /**
     * Evaluates every stored bucket in [fromBucket, toExclusive) of {@code history}.
     * History must be ordered oldest first and reach back far enough for the first bucket's window.
     */
    private PassResult evaluatePass(SeriesKey key, List<Candle> history, long fromBucket, long toExclusive) {
        Timeframe tf = key.timeframe();
        Set<Long> stored = new HashSet<>();
        for (Candle candle : history) {
            stored.add(candle.bucketStart());
        }

        List<Candle> series = history;
        int missing = GapFiller.countMissing(history, tf);
        if (missing > 0) {
            if (settings.gapFillingEnabled()) {
                series = GapFiller.fill(history, tf);
                log.debug("{}: forward-filled {} missing buckets", key, missing);
            } else {
                log.warn("{}: {} missing buckets in history window, evaluating without filling", key, missing);
            }
        }

        int written = 0;
        Long firstFailure = null;
        Long lastEvaluated = null;
        IndicatorSet newest = null;
        for (int i = 0; i < series.size(); i++) {
            long bucket = series.get(i).bucketStart();
            if (bucket < fromBucket || bucket >= toExclusive || !stored.contains(bucket)) {
                continue;
            }
            lastEvaluated = bucket;
            List<Candle> window = series.subList(Math.max(0, i - settings.lookback() + 1), i + 1);
            if (settings.gapFillingEnabled() && GapFiller.syntheticRatio(window) > settings.maxGapRatio()) {
                log.warn("{}: skipping bucket {}, synthetic share {} exceeds {}",
                    key, Instant.ofEpochMilli(bucket), GapFiller.syntheticRatio(window), settings.maxGapRatio());
                continue;
            }
            Map<String, Double> values = engine.evaluate(key, window);
            if (values.isEmpty()) {
                continue;
            }
            IndicatorSet set = new IndicatorSet(key, bucket, values, Instant.now(clock));
            try {
                store.insertIndicators(set);
                bucketsWritten.increment();
                written++;
                newest = set;
            } catch (RuntimeException e) {
                bucketsFailed.increment();
                log.error("Failed to write indicators for {} at {}", key, Instant.ofEpochMilli(bucket), e);
                if (firstFailure == null) {
                    firstFailure = bucket;
                }
            }
        }
        if (newest != null && lastEvaluated != null && newest.bucketStart() == lastEvaluated) {
            publish(newest);
        }
        return new PassResult(written, firstFailure, lastEvaluated);
    }

    private void publish(IndicatorSet set) {
        try {
            cache.put(set, config.cache().ttl());
        } catch (RuntimeException e) {
            log.warn("Failed to cache indicators for {} at {}: {}",
                set.series(), Instant.ofEpochMilli(set.bucketStart()), e.getMessage());
        }
    }

    /** Buckets from {@code from} to {@code to}, both inclusive. */
    private static long pendingBuckets(Timeframe tf, long from, long to) {
        return (to - from) / tf.toMillis() + 1;
    }
}
