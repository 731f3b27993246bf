package com.stepflow.scheduler;

import java.time.Instant;

/**
 * A scheduled timer.
 */
public interface TimerHandle {

    /**
     * Cancel the timer.
     *
     * @return true if the timer was pending and will not fire
     */
    boolean cancel();

    Instant fireAt();
}
