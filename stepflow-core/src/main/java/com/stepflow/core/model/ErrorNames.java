package com.stepflow.core.model;

import java.util.Set;

/**
 * Error classifications raised by the interpreter itself.
 * Names follow the reference service so that existing definitions match them unchanged.
 */
public final class ErrorNames {

    /**
     * Wildcard used only in Retry/Catch rules. Never raised.
     */
    public static final String ALL = "States.ALL";

    public static final String RUNTIME = "States.Runtime";
    public static final String NO_CHOICE_MATCHED = "States.NoChoiceMatched";
    public static final String TIMEOUT = "States.Timeout";
    public static final String HEARTBEAT_TIMEOUT = "States.HeartbeatTimeout";
    public static final String TASK_FAILED = "States.TaskFailed";
    public static final String BRANCH_FAILED = "States.BranchFailed";

    private static final Set<String> PREDEFINED = Set.of(
        ALL, RUNTIME, NO_CHOICE_MATCHED, TIMEOUT, HEARTBEAT_TIMEOUT, TASK_FAILED, BRANCH_FAILED
    );

    private ErrorNames() {
    }

    /**
     * Check if a name belongs to the reserved {@code States.} namespace.
     */
    public static boolean isReserved(String name) {
        return name != null && name.startsWith("States.");
    }

    /**
     * Check if a name is one the interpreter knows how to raise or match.
     */
    public static boolean isPredefined(String name) {
        return PREDEFINED.contains(name);
    }
}
