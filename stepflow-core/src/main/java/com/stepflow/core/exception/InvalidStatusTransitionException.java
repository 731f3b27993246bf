package com.stepflow.core.exception;

import com.stepflow.core.model.ExecutionStatus;

/**
 * Thrown when an execution is asked to move to a status its current status does not allow.
 */
public class InvalidStatusTransitionException extends StepflowException {
    
    public static final String ERROR_CODE = "INVALID_STATUS_TRANSITION";
    
    public InvalidStatusTransitionException(ExecutionStatus currentStatus, ExecutionStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }
}
