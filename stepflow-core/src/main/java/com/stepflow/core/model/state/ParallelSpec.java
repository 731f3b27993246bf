package com.stepflow.core.model.state;

import com.stepflow.core.model.Program;

import java.util.List;

/**
 * Parallel attributes: one sub-program per branch, in declaration order.
 */
public record ParallelSpec(List<Program> branches) implements StateSpec {
    public ParallelSpec {
        branches = List.copyOf(branches);
    }
}
