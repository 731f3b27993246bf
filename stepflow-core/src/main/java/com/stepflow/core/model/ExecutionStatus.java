package com.stepflow.core.model;

/**
 * Lifecycle statuses of an execution.
 * Transitions follow a strict state machine, see {@link #canTransitionTo(ExecutionStatus)}.
 */
public enum ExecutionStatus {
    /**
     * A state is active or the execution is waiting on a task or on branches.
     * Transitions: -> SUSPENDED, SUCCEEDED, FAILED, ABORTED
     */
    RUNNING,

    /**
     * Waiting for a timer (Wait state or Retry backoff) to resume the loop.
     * Transitions: -> RUNNING, FAILED, ABORTED
     */
    SUSPENDED,

    /**
     * Reached a terminal state. Terminal.
     */
    SUCCEEDED,

    /**
     * Ended with an unrecovered error or an execution timeout. Terminal.
     */
    FAILED,

    /**
     * Cancelled from outside. Terminal.
     */
    ABORTED;

    /**
     * Check if this status is terminal.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ABORTED;
    }

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case RUNNING -> target == SUSPENDED || target == SUCCEEDED
                || target == FAILED || target == ABORTED;
            case SUSPENDED -> target == RUNNING || target == FAILED || target == ABORTED;
            case SUCCEEDED, FAILED, ABORTED -> false;
        };
    }
}
