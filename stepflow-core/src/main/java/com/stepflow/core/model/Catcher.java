package com.stepflow.core.model;

import java.util.List;

/**
 * A declared Catch rule: fallback routing for an error no Retrier recovered.
 * 
 * Invariants:
 * - errorEquals is non-empty
 * - next names a state of the same program
 * - resultPath, when declared, is a reference path or discard
 */
public record Catcher(
    List<String> errorEquals,
    String next,
    DataPath resultPath
) {
    public Catcher {
        errorEquals = List.copyOf(errorEquals);
    }

    public DataPath effectiveResultPath() {
        return DataPath.orRoot(resultPath);
    }

    public boolean matches(ExecutionError error) {
        return error.matches(errorEquals);
    }
}
