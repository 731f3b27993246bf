package com.stepflow.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TimerService} on a simulated clock. Time only moves when {@link #advance(Duration)}
 * is called, which fires every timer that comes due in fire-time order. Lets tests and demos
 * drive Wait states and Retry backoff deterministically without sleeping.
 * 
 * <p>Example usage:</p>
 * <pre>{@code
 * ManualTimerService time = new ManualTimerService(Instant.parse("2026-01-01T00:00:00Z"));
 * Execution execution = engine.start(program, input);
 * time.advance(Duration.ofSeconds(5));   // fires a 5-second Wait
 * }</pre>
 */
public class ManualTimerService implements TimerService {

    private static final Logger log = LoggerFactory.getLogger(ManualTimerService.class);

    private final PriorityQueue<ManualTimer> pending = new PriorityQueue<>(
        Comparator.comparing(ManualTimer::fireAt).thenComparingLong(ManualTimer::sequence));
    private Instant currentTime;
    private long sequence;

    /**
     * Create a timer service starting at the current wall-clock time.
     */
    public ManualTimerService() {
        this(Instant.now());
    }

    public ManualTimerService(Instant startTime) {
        this.currentTime = startTime;
    }

    @Override
    public synchronized Instant now() {
        return currentTime;
    }

    @Override
    public synchronized TimerHandle schedule(Instant fireAt, Runnable callback) {
        ManualTimer timer = new ManualTimer(fireAt, sequence++, callback);
        pending.add(timer);
        return timer;
    }

    /**
     * Advance time by a duration, firing due timers in order. Timers scheduled by callbacks
     * fire too if they come due before the target time.
     */
    public void advance(Duration duration) {
        Instant target;
        synchronized (this) {
            target = currentTime.plus(duration);
        }
        while (true) {
            ManualTimer next;
            synchronized (this) {
                next = pending.peek();
                if (next == null || next.fireAt().isAfter(target)) {
                    currentTime = target;
                    return;
                }
                pending.poll();
                if (next.fireAt().isAfter(currentTime)) {
                    currentTime = next.fireAt();
                }
            }
            next.fire();
        }
    }

    /**
     * Advance time by seconds.
     */
    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    /**
     * Fire timers that are already due without moving the clock.
     */
    public void runDueTimers() {
        advance(Duration.ZERO);
    }

    /**
     * Advance to the next pending timer and fire it (and anything due at the same instant).
     * 
     * @return true if a timer was pending
     */
    public boolean advanceToNextTimer() {
        Duration gap;
        synchronized (this) {
            ManualTimer next = pending.peek();
            if (next == null) {
                return false;
            }
            gap = next.fireAt().isAfter(currentTime) ? Duration.between(currentTime, next.fireAt()) : Duration.ZERO;
        }
        advance(gap);
        return true;
    }

    public synchronized int pendingTimers() {
        return pending.size();
    }

    public synchronized Optional<Instant> nextFireTime() {
        return Optional.ofNullable(pending.peek()).map(ManualTimer::fireAt);
    }

    private synchronized boolean remove(ManualTimer timer) {
        return pending.remove(timer);
    }

    /**
     * Pending timer on the simulated clock.
     */
    private final class ManualTimer implements TimerHandle {
        private final Instant fireAt;
        private final long sequence;
        private final Runnable callback;
        private final AtomicBoolean done = new AtomicBoolean();

        ManualTimer(Instant fireAt, long sequence, Runnable callback) {
            this.fireAt = fireAt;
            this.sequence = sequence;
            this.callback = callback;
        }

        @Override
        public Instant fireAt() {
            return fireAt;
        }

        long sequence() {
            return sequence;
        }

        @Override
        public boolean cancel() {
            return done.compareAndSet(false, true) && remove(this);
        }

        void fire() {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            try {
                callback.run();
            } catch (Exception e) {
                log.error("Timer callback due at {} failed", fireAt, e);
            }
        }
    }
}
