package com.stepflow.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of state variants a definition may declare.
 */
public enum StateType {
    /**
     * Invokes an external resource through the injected resource invoker.
     */
    TASK("Task"),

    /**
     * Passes its input (or a literal Result) to its output.
     */
    PASS("Pass"),

    /**
     * Suspends the execution for a duration or until an instant.
     */
    WAIT("Wait"),

    /**
     * Picks the next state from ordered boolean rules.
     */
    CHOICE("Choice"),

    /**
     * Ends the execution (or branch) successfully.
     */
    SUCCEED("Succeed"),

    /**
     * Ends the execution (or branch) with a declared error.
     */
    FAIL("Fail"),

    /**
     * Runs every branch concurrently on a copy of the input.
     */
    PARALLEL("Parallel"),

    /**
     * Runs the iterator once per element of an input array.
     */
    MAP("Map");

    private final String jsonName;

    StateType(String jsonName) {
        this.jsonName = jsonName;
    }

    /**
     * Name used in the {@code Type} field of a definition.
     */
    public String jsonName() {
        return jsonName;
    }

    /**
     * Check if this type ends its program by itself and therefore takes neither Next nor End.
     */
    public boolean isTerminal() {
        return this == SUCCEED || this == FAIL;
    }

    /**
     * Check if this type must declare exactly one of Next or End.
     */
    public boolean requiresTransition() {
        return this != CHOICE && !isTerminal();
    }

    /**
     * Check if Retry and Catch may be declared on this type.
     */
    public boolean supportsRecovery() {
        return !isTerminal();
    }

    public static Optional<StateType> fromJsonName(String name) {
        return Arrays.stream(values())
            .filter(t -> t.jsonName.equals(name))
            .findFirst();
    }
}
