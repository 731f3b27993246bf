package com.stepflow.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock {@link TimerService} backed by a {@link ScheduledExecutorService}.
 * 
 * Responsibilities:
 * - Fire Wait state timers and Retry backoff timers
 * - Fire Task, heartbeat and execution timeouts
 * - Isolate timer callbacks: a failing callback never stops the scheduler
 */
public class TimerScheduler implements TimerService {

    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final AtomicLong timerIds = new AtomicLong();
    private volatile boolean running = true;

    public TimerScheduler() {
        this(2);
    }

    public TimerScheduler(int threads) {
        this(threads, Clock.systemUTC());
    }

    public TimerScheduler(int threads, Clock clock) {
        AtomicInteger threadCount = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "stepflow-timer-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.clock = clock;
        log.info("Timer scheduler started with {} threads", threads);
    }

    /**
     * Stop the scheduler. Pending timers are dropped.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Timer scheduler did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Timer scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    /**
     * Schedule a timer to fire at a specific time.
     * 
     * @throws IllegalStateException if the scheduler is stopped
     */
    @Override
    public TimerHandle schedule(Instant fireAt, Runnable callback) {
        long timerId = timerIds.incrementAndGet();
        long delayMillis = Math.max(0, Duration.between(now(), fireAt).toMillis());
        try {
            ScheduledFuture<?> future = scheduler.schedule(
                () -> fire(timerId, callback), delayMillis, TimeUnit.MILLISECONDS);
            log.debug("Scheduled timer {} at {} (in {} ms)", timerId, fireAt, delayMillis);
            return new ScheduledTimer(timerId, fireAt, future);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Timer scheduler is stopped", e);
        }
    }

    private void fire(long timerId, Runnable callback) {
        log.debug("Firing timer {}", timerId);
        try {
            callback.run();
        } catch (Exception e) {
            log.error("Timer {} callback failed", timerId, e);
        }
    }

    /**
     * Scheduled timer handle.
     */
    private record ScheduledTimer(long timerId, Instant fireAt, ScheduledFuture<?> future) implements TimerHandle {
        @Override
        public boolean cancel() {
            return future.cancel(false);
        }
    }
}
