package com.stepflow.core.model.state;

/**
 * Variant-specific attributes of a state. The set of variants is closed; the interpreter
 * dispatches on {@link com.stepflow.core.model.StateType} and reads the matching spec.
 */
public sealed interface StateSpec
    permits TaskSpec, PassSpec, WaitSpec, ChoiceSpec, SucceedSpec, FailSpec, ParallelSpec, MapSpec {
}
