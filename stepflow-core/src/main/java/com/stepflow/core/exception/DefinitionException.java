package com.stepflow.core.exception;

/**
 * Thrown when a state machine definition cannot be parsed or fails validation.
 * No Program is ever produced for a definition that raised this exception.
 */
public class DefinitionException extends StepflowException {
    
    public static final String ERROR_CODE = "DEFINITION_INVALID";

    private final String location;
    private final String field;
    
    public DefinitionException(String message) {
        super(ERROR_CODE, message);
        this.location = null;
        this.field = null;
    }
    
    public DefinitionException(String location, String field, String reason) {
        super(ERROR_CODE, String.format("Invalid state machine definition at %s, field %s: %s",
            location, field, reason));
        this.location = location;
        this.field = field;
    }

    public DefinitionException(String location, String field, String reason, Throwable cause) {
        super(ERROR_CODE, String.format("Invalid state machine definition at %s, field %s: %s",
            location, field, reason), cause);
        this.location = location;
        this.field = field;
    }

    /**
     * Location of the offending node, e.g. {@code States.Fan.Branches[1].States.Charge}.
     */
    public String getLocation() {
        return location;
    }

    /**
     * Name of the offending field, e.g. {@code Next}.
     */
    public String getField() {
        return field;
    }
}
