package com.stepflow.core.model.choice;

/**
 * A top-level Choice rule: a condition and the state to go to when it holds.
 */
public record ChoiceRule(
    Condition condition,
    String next
) {
}
