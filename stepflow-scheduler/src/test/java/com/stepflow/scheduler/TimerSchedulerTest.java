package com.stepflow.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TimerSchedulerTest {

    private TimerScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TimerScheduler(1);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void schedule_shouldFireAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ofMillis(20), latch::countDown);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void schedule_inThePast_shouldFireImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.schedule(scheduler.now().minusSeconds(10), latch::countDown);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void cancel_shouldPreventFiring() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean();

        TimerHandle handle = scheduler.scheduleAfter(Duration.ofMillis(200), () -> fired.set(true));
        assertTrue(handle.cancel());

        Thread.sleep(400);
        assertFalse(fired.get());
    }

    @Test
    void failingCallback_shouldNotStopScheduler() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ZERO, () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.scheduleAfter(Duration.ofMillis(10), latch::countDown);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void schedule_afterStop_shouldThrow() {
        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertThrows(IllegalStateException.class,
            () -> scheduler.scheduleAfter(Duration.ofSeconds(1), () -> { }));
    }
}
