package com.stepflow.engine.wait;

import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ExecutionError;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * When a Wait state resumes: either after a delay measured from entry, or at an instant.
 */
public record WakeUp(Duration delay, Instant instant) {

    public static WakeUp after(Duration delay) {
        return new WakeUp(delay, null);
    }

    public static WakeUp at(Instant instant) {
        return new WakeUp(null, instant);
    }

    /**
     * Resolve to an absolute instant. An instant in the past means "resume immediately".
     * 
     * @throws StatesRuntimeException with {@code States.Runtime} if the delay reaches past the
     *         largest representable instant
     */
    public Instant wakeTime(Instant now) {
        Instant target;
        if (instant != null) {
            target = instant;
        } else {
            try {
                target = now.plus(delay);
            } catch (DateTimeException | ArithmeticException e) {
                throw new StatesRuntimeException(ExecutionError.runtime(String.format(
                    "Wait of %d seconds is out of range", delay.getSeconds())));
            }
        }
        return target.isBefore(now) ? now : target;
    }
}
