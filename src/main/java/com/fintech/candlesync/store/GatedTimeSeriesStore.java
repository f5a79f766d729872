package com.fintech.candlesync.store;

import com.fintech.candlesync.domain.BucketAggregate;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.exception.StoreUnavailableException;
import com.fintech.candlesync.gate.SequentialAccessGate;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Primary store bean: funnels every call into the backing store through the
 * {@link SequentialAccessGate} and the "store" circuit breaker.
 *
 * <p>Both schedulers inject this bean, so no two store calls are ever in flight at once.
 * While the breaker is open calls fail fast with {@link StoreUnavailableException}
 * instead of queueing behind the gate.
 */
@Repository
@Primary
public class GatedTimeSeriesStore implements TimeSeriesStore {

    /** Qualifier carried by the implementation this decorator wraps. */
    public static final String BACKING = "backingTimeSeriesStore";

    private static final Logger log = LoggerFactory.getLogger(GatedTimeSeriesStore.class);

    private final TimeSeriesStore delegate;
    private final SequentialAccessGate gate;
    private final CircuitBreaker circuitBreaker;

    public GatedTimeSeriesStore(
            @Qualifier(BACKING) TimeSeriesStore delegate,
            SequentialAccessGate gate,
            CircuitBreakerRegistry circuitBreakerRegistry) {
        this.delegate = delegate;
        this.gate = gate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("store");

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Store circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );

        log.info("Store access gated and protected by circuit breaker: backing={}",
            delegate.getClass().getSimpleName());
    }

    @Override
    public void insertCandles(SeriesKey key, List<Candle> candles) {
        if (candles.isEmpty()) {
            return;
        }
        call("insertCandles " + key, () -> {
            delegate.insertCandles(key, candles);
            return null;
        });
    }

    @Override
    public void mergeAggregates(SeriesKey key, List<BucketAggregate> aggregates) {
        if (aggregates.isEmpty()) {
            return;
        }
        call("mergeAggregates " + key, () -> {
            delegate.mergeAggregates(key, aggregates);
            return null;
        });
    }

    @Override
    public List<Candle> queryCandles(SeriesKey key, long fromInclusive, long toExclusive) {
        return call("queryCandles " + key, () -> delegate.queryCandles(key, fromInclusive, toExclusive));
    }

    @Override
    public List<Candle> latestCandles(SeriesKey key, int limit) {
        return call("latestCandles " + key, () -> delegate.latestCandles(key, limit));
    }

    @Override
    public Optional<Long> latestBucket(SeriesKey key) {
        return call("latestBucket " + key, () -> delegate.latestBucket(key));
    }

    @Override
    public void insertIndicators(IndicatorSet indicators) {
        if (indicators.isEmpty()) {
            return;
        }
        call("insertIndicators " + indicators.series(), () -> {
            delegate.insertIndicators(indicators);
            return null;
        });
    }

    @Override
    public List<IndicatorSet> queryIndicators(SeriesKey key, long fromInclusive, long toExclusive) {
        return call("queryIndicators " + key, () -> delegate.queryIndicators(key, fromInclusive, toExclusive));
    }

    @Override
    public Optional<Long> latestIndicatorBucket(SeriesKey key) {
        return call("latestIndicatorBucket " + key, () -> delegate.latestIndicatorBucket(key));
    }

    /**
     * Health probe through the gate, bypassing the breaker so an open breaker can still report recovery.
     */
    @Override
    public boolean isHealthy() {
        try {
            return gate.withExclusiveAccess(delegate::isHealthy);
        } catch (RuntimeException e) {
            log.error("Store health check failed", e);
            return false;
        }
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    private <T> T call(String operation, Supplier<T> body) {
        try {
            return circuitBreaker.executeSupplier(() -> gate.withExclusiveAccess(body));
        } catch (CallNotPermittedException e) {
            log.warn("Store circuit breaker OPEN - rejecting {}", operation);
            throw new StoreUnavailableException("Store circuit breaker is open, rejected " + operation, e);
        }
    }
}
