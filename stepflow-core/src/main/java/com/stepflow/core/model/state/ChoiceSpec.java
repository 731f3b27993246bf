package com.stepflow.core.model.state;

import com.stepflow.core.model.choice.ChoiceRule;

import java.util.List;

/**
 * Choice attributes: ordered rules and an optional default target.
 * 
 * Invariants:
 * - choices is non-empty or defaultNext is set
 */
public record ChoiceSpec(
    List<ChoiceRule> choices,
    String defaultNext
) implements StateSpec {
    public ChoiceSpec {
        choices = List.copyOf(choices);
    }
}
