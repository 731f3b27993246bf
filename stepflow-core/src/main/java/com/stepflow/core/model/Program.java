package com.stepflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, validated state machine: an ordered mapping of state name to state plus a start
 * pointer. Built once per definition and shared read-only by every execution of it.
 * Parallel branches and Map iterators are Programs themselves.
 * 
 * Invariants:
 * - startAt names an existing state
 * - every Next, Default and Catch target names a state of this program
 * - states preserves declaration order
 */
public record Program(
    String startAt,
    Map<String, State> states,
    String comment,
    String version,
    Integer timeoutSeconds
) {
    public Program {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    /**
     * Get a state by name.
     * 
     * @throws IllegalArgumentException if no such state exists
     */
    public State state(String name) {
        State state = states.get(name);
        if (state == null) {
            throw new IllegalArgumentException("No state named '" + name + "'");
        }
        return state;
    }

    public boolean hasState(String name) {
        return states.containsKey(name);
    }

    public State startState() {
        return state(startAt);
    }
}
