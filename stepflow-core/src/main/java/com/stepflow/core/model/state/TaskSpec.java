package com.stepflow.core.model.state;

/**
 * Task attributes.
 * 
 * Invariants:
 * - resource is non-empty
 * - timeoutSeconds, when declared, is positive
 * - heartbeatSeconds, when declared, is positive and smaller than the effective timeout
 */
public record TaskSpec(
    String resource,
    Integer timeoutSeconds,
    Integer heartbeatSeconds
) implements StateSpec {

    /**
     * Timeout applied by the language when a Task declares none.
     */
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;
}
