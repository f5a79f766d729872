package com.fintech.candlesync.gate;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every operation against a store handle that can serve one query at a time.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>At most one operation runs inside the gate at any moment</li>
 *   <li>Waiting operations are admitted in arrival order (fair lock)</li>
 *   <li>No timeout and no preemption: a slow operation holds every later one back</li>
 *   <li>Re-entrant for the owning thread, so a gated call may call another gated helper</li>
 * </ul>
 *
 * <p>Waiting is uninterruptible. An interrupt received while queued is kept on the thread
 * and observed by the caller after the operation completes.
 */
public class SequentialAccessGate {

    private static final Logger log = LoggerFactory.getLogger(SequentialAccessGate.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Timer waitTimer;

    public SequentialAccessGate(MeterRegistry meterRegistry) {
        this.waitTimer = meterRegistry.timer("pipeline.gate.wait");
        meterRegistry.gauge("pipeline.gate.queue.length", lock, ReentrantLock::getQueueLength);
    }

    /**
     * Runs {@code operation} once every previously queued operation has finished.
     *
     * @return the operation's result
     */
    public <T> T withExclusiveAccess(Supplier<T> operation) {
        Objects.requireNonNull(operation, "Operation cannot be null");
        long waitStart = System.nanoTime();
        lock.lock();
        try {
            long waited = System.nanoTime() - waitStart;
            waitTimer.record(waited, TimeUnit.NANOSECONDS);
            if (log.isTraceEnabled()) {
                log.trace("Gate acquired after {}µs (hold count {}, queued {})",
                    waited / 1_000, lock.getHoldCount(), lock.getQueueLength());
            }
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    public void runExclusive(Runnable operation) {
        Objects.requireNonNull(operation, "Operation cannot be null");
        withExclusiveAccess(() -> {
            operation.run();
            return null;
        });
    }
}
