package com.stepflow.core.model.state;

/**
 * Fail attributes: the error name and cause the execution (or branch) ends with.
 */
public record FailSpec(
    String error,
    String cause
) implements StateSpec {
}
