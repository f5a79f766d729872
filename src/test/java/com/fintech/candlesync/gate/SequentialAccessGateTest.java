package com.fintech.candlesync.gate;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SequentialAccessGate Tests")
class SequentialAccessGateTest {

    private SimpleMeterRegistry meterRegistry;
    private SequentialAccessGate gate;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        gate = new SequentialAccessGate(meterRegistry);
    }

    private double queueLength() {
        return meterRegistry.get("pipeline.gate.queue.length").gauge().value();
    }

    private void awaitQueueLength(int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (queueLength() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertThat(queueLength()).isEqualTo((double) expected);
    }

    @Test
    @DisplayName("Should never run two operations at once")
    void testMutualExclusion() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        int[] unsafeCounter = {0};
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        gate.runExclusive(() -> {
                            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                            unsafeCounter[0]++;
                            inFlight.decrementAndGet();
                        });
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(unsafeCounter[0]).isEqualTo(1600);
        assertThat(meterRegistry.timer("pipeline.gate.wait").count()).isEqualTo(1600L);
    }

    @Test
    @DisplayName("Should admit waiting operations in arrival order")
    void testFifoOrder() throws Exception {
        CountDownLatch holderIn = new CountDownLatch(1);
        CountDownLatch releaseHolder = new CountDownLatch(1);
        List<Integer> order = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            executor.submit(() -> gate.runExclusive(() -> {
                holderIn.countDown();
                try {
                    releaseHolder.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(holderIn.await(5, TimeUnit.SECONDS)).isTrue();

            List<Future<?>> waiters = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                int id = i;
                waiters.add(executor.submit(() -> gate.runExclusive(() -> order.add(id))));
                awaitQueueLength(i + 1);
            }
            releaseHolder.countDown();
            for (Future<?> waiter : waiters) {
                waiter.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(order).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    @DisplayName("Nested calls from the owning thread do not deadlock")
    void testReentrant() {
        String result = gate.withExclusiveAccess(() -> gate.withExclusiveAccess(() -> "inner"));

        assertThat(result).isEqualTo("inner");
        assertThat(meterRegistry.timer("pipeline.gate.wait").count()).isEqualTo(2L);
    }

    @Test
    @DisplayName("A failing operation releases the gate and propagates its exception")
    void testExceptionReleasesGate() throws Exception {
        assertThatThrownBy(() -> gate.runExclusive(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> other = executor.submit(() -> gate.withExclusiveAccess(() -> 42));
            assertThat(other.get(5, TimeUnit.SECONDS)).isEqualTo(42);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("An interrupted waiter still runs and keeps its interrupt flag")
    void testInterruptWhileWaiting() throws Exception {
        CountDownLatch holderIn = new CountDownLatch(1);
        CountDownLatch releaseHolder = new CountDownLatch(1);
        AtomicBoolean ran = new AtomicBoolean();
        AtomicBoolean interruptedAfter = new AtomicBoolean();
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            executor.submit(() -> gate.runExclusive(() -> {
                holderIn.countDown();
                try {
                    releaseHolder.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(holderIn.await(5, TimeUnit.SECONDS)).isTrue();

            Thread waiter = new Thread(() -> {
                gate.runExclusive(() -> ran.set(true));
                interruptedAfter.set(Thread.currentThread().isInterrupted());
            });
            waiter.start();
            awaitQueueLength(1);
            waiter.interrupt();
            releaseHolder.countDown();
            waiter.join(5_000);
        } finally {
            executor.shutdownNow();
        }

        assertThat(ran).isTrue();
        assertThat(interruptedAfter).isTrue();
    }
}
