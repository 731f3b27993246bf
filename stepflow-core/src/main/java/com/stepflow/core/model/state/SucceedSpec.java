package com.stepflow.core.model.state;

/**
 * Succeed has no attributes of its own.
 */
public record SucceedSpec() implements StateSpec {
}
