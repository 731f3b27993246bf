package com.stepflow.worker;

/**
 * Failure reported by a resource. The error name is what Retry and Catch rules match;
 * a failure without a name is classified {@code States.TaskFailed} by the interpreter.
 */
public class ResourceException extends Exception {
    
    private final String errorName;
    
    public ResourceException(String errorName, String message) {
        super(message);
        this.errorName = errorName;
    }
    
    public ResourceException(String errorName, String message, Throwable cause) {
        super(message, cause);
        this.errorName = errorName;
    }
    
    /**
     * Error name, or {@code null} if the resource did not classify the failure.
     */
    public String getErrorName() {
        return errorName;
    }
}
