package com.fintech.candlesync.sync;

import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.SeriesKey;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Drops fetched bars that fail basic sanity checks before they reach the store.
 *
 * Rejected: anything {@link Candle#sanityViolation()} reports, bucket starts not aligned
 * to the series timeframe, and bars starting in the future.
 * Every rejection is logged at WARN and counted; none is fatal.
 */
@Component
public class CandleValidator {

    private static final Logger log = LoggerFactory.getLogger(CandleValidator.class);

    private final Counter malformedCounter;

    public CandleValidator(MeterRegistry meterRegistry) {
        this.malformedCounter = meterRegistry.counter("pipeline.sync.candles.malformed");
    }

    /**
     * @return the valid bars ordered by bucket start
     */
    public List<Candle> validate(SeriesKey key, List<Candle> fetched, long nowMillis) {
        List<Candle> valid = new ArrayList<>(fetched.size());
        for (Candle candle : fetched) {
            Optional<String> violation = violation(key, candle, nowMillis);
            if (violation.isPresent()) {
                malformedCounter.increment();
                log.warn("Discarding malformed candle for {} at {}: {}", key, candle.bucketStart(), violation.get());
                continue;
            }
            valid.add(candle);
        }
        valid.sort(Comparator.comparingLong(Candle::bucketStart));
        return valid;
    }

    private Optional<String> violation(SeriesKey key, Candle candle, long nowMillis) {
        if (!key.timeframe().isAligned(candle.bucketStart())) {
            return Optional.of("bucket start not aligned to " + key.timeframe().code());
        }
        if (candle.bucketStart() > nowMillis) {
            return Optional.of("bucket starts in the future");
        }
        return candle.sanityViolation();
    }

    public double malformedCount() {
        return malformedCounter.count();
    }
}
