package com.stepflow.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;

/**
 * Structured error produced by a failed state: a classification name and a free-form cause.
 *
 * Invariants:
 * - branchFailure is true only for errors that escaped a Parallel branch or Map iteration
 * - ErrorNames.ALL is never used as the error name
 */
public record ExecutionError(
    String error,
    String cause,
    boolean branchFailure
) {
    public ExecutionError(String error, String cause) {
        this(error, cause, false);
    }

    public static ExecutionError runtime(String cause) {
        return new ExecutionError(ErrorNames.RUNTIME, cause);
    }

    public static ExecutionError noChoiceMatched(String cause) {
        return new ExecutionError(ErrorNames.NO_CHOICE_MATCHED, cause);
    }

    public static ExecutionError timeout(String cause) {
        return new ExecutionError(ErrorNames.TIMEOUT, cause);
    }

    public static ExecutionError heartbeatTimeout(String cause) {
        return new ExecutionError(ErrorNames.HEARTBEAT_TIMEOUT, cause);
    }

    public static ExecutionError taskFailed(String cause) {
        return new ExecutionError(ErrorNames.TASK_FAILED, cause);
    }

    /**
     * Copy of this error marked as having escaped a branch.
     */
    public ExecutionError asBranchFailure() {
        return branchFailure ? this : new ExecutionError(error, cause, true);
    }

    /**
     * Check if this error is matched by a Retrier or Catcher error-name set.
     * The wildcard matches everything; {@code States.BranchFailed} matches any branch failure.
     */
    public boolean matches(Collection<String> errorEquals) {
        if (errorEquals.contains(ErrorNames.ALL)) {
            return true;
        }
        if (error != null && errorEquals.contains(error)) {
            return true;
        }
        return branchFailure && errorEquals.contains(ErrorNames.BRANCH_FAILED);
    }

    /**
     * The error object written by a Catcher: {@code {"Error": ..., "Cause": ...}}.
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("Error", error);
        node.put("Cause", cause);
        return node;
    }
}
