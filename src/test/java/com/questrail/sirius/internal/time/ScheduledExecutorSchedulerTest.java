package com.questrail.sirius.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Real-time checks of the production scheduler. Tolerances are generous so a
 * loaded build machine does not produce false failures.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void delayedTaskRunsNoEarlierThanItsDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long before = System.nanoTime();
        long[] ranAt = new long[1];

        scheduler.scheduleAfter(Duration.ofMillis(100), SystemMonotonicClock.INSTANCE, () -> {
            ranAt[0] = System.nanoTime();
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertTrue(ranAt[0] - before >= TimeUnit.MILLISECONDS.toNanos(95));
    }

    @Test
    void deadlineInThePastRunsPromptly() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1),
                latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelledTaskNeverRuns() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(80), SystemMonotonicClock.INSTANCE,
                () -> ran.set(true));

        assertTrue(handle.cancel());
        Thread.sleep(150);
        assertFalse(ran.get());
    }

    @Test
    void tasksRunInDeadlineOrder() throws InterruptedException {
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        long now = SystemMonotonicClock.INSTANCE.nowNanos();

        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(60), () -> {
            order.add("mode");
            latch.countDown();
        });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20), () -> {
            order.add("colour");
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(List.of("colour", "mode"), order);
    }
}
