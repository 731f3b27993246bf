package com.stepflow.core.model;

/**
 * A declared InputPath, OutputPath or ResultPath.
 * A {@code null} expression is the explicit JSON {@code null} of a definition, which discards
 * the value the path would have selected. An undeclared path is represented by a {@code null}
 * DataPath reference on the owning state, never by an instance of this record.
 */
public record DataPath(String expression) {

    public static final String ROOT_EXPRESSION = "$";

    private static final DataPath ROOT = new DataPath(ROOT_EXPRESSION);
    private static final DataPath DISCARD = new DataPath(null);

    public static DataPath of(String expression) {
        return new DataPath(expression);
    }

    public static DataPath root() {
        return ROOT;
    }

    public static DataPath discard() {
        return DISCARD;
    }

    public boolean isDiscard() {
        return expression == null;
    }

    public boolean isRoot() {
        return ROOT_EXPRESSION.equals(expression);
    }

    /**
     * Resolve an optional declaration to its effective value; undeclared paths mean {@code $}.
     */
    public static DataPath orRoot(DataPath declared) {
        return declared != null ? declared : ROOT;
    }
}
