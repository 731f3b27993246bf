package com.stepflow.core.model.state;

/**
 * Wait attributes.
 */
public record WaitSpec(WaitTarget target) implements StateSpec {
}
