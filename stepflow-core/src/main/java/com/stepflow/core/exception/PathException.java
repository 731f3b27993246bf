package com.stepflow.core.exception;

/**
 * Thrown when a path expression is syntactically invalid.
 */
public class PathException extends StepflowException {

    public static final String ERROR_CODE = "PATH_INVALID";

    private final String path;

    public PathException(String path, String reason) {
        super(ERROR_CODE, String.format("Invalid path '%s': %s", path, reason));
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
