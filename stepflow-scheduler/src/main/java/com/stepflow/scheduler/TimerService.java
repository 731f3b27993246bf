package com.stepflow.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * External timer facility. Suspended executions (Wait states, Retry backoff, timeouts) register
 * a callback here instead of holding a thread.
 */
public interface TimerService {

    /**
     * Schedule a callback. A fire time in the past fires as soon as possible.
     *
     * @param fireAt When the callback should run
     * @param callback The callback; exceptions it throws are logged, never propagated
     * @return A handle that can cancel the timer before it fires
     */
    TimerHandle schedule(Instant fireAt, Runnable callback);

    /**
     * Schedule a callback after a delay from {@link #now()}.
     */
    default TimerHandle scheduleAfter(Duration delay, Runnable callback) {
        return schedule(now().plus(delay), callback);
    }

    /**
     * Current time as seen by this timer service.
     */
    Instant now();
}
