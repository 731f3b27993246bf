package com.stepflow.engine.recovery;

import com.stepflow.core.model.Catcher;

import java.time.Duration;

/**
 * Outcome of matching an error against a state's Retry and Catch rules.
 */
public record RecoveryDecision(
    Action action,
    Duration delay,
    int attemptNumber,
    Catcher catcher
) {
    public enum Action {
        /**
         * Re-run the state after the delay.
         */
        RETRY,

        /**
         * Continue at the Catcher's Next state with the error placed in the input.
         */
        CATCH,

        /**
         * No rule applies; the error ends the program.
         */
        PROPAGATE
    }

    private static final RecoveryDecision PROPAGATE = new RecoveryDecision(Action.PROPAGATE, null, 0, null);

    public static RecoveryDecision retry(Duration delay, int attemptNumber) {
        return new RecoveryDecision(Action.RETRY, delay, attemptNumber, null);
    }

    public static RecoveryDecision caught(Catcher catcher) {
        return new RecoveryDecision(Action.CATCH, null, 0, catcher);
    }

    public static RecoveryDecision propagate() {
        return PROPAGATE;
    }
}
