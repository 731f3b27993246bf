package com.stepflow.core.exception;

/**
 * Base exception for all Stepflow errors.
 */
public class StepflowException extends RuntimeException {
    
    private final String errorCode;
    
    public StepflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public StepflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
