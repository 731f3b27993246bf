package com.stepflow.core.exception;

import com.stepflow.core.model.ExecutionError;

/**
 * Carries a structured {@link ExecutionError} raised while a state is being evaluated.
 * The interpreter converts it back into the error value and routes it through Retry/Catch.
 */
public class StatesRuntimeException extends StepflowException {

    public static final String ERROR_CODE = "STATES_RUNTIME";

    private final transient ExecutionError error;

    public StatesRuntimeException(ExecutionError error) {
        super(ERROR_CODE, error.error() + ": " + error.cause());
        this.error = error;
    }

    public ExecutionError getError() {
        return error;
    }
}
