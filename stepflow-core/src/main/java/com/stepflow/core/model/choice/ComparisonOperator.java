package com.stepflow.core.model.choice;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators of a Choice rule.
 * Every comparison has a {@code ...Path} twin whose operand is read from the input.
 */
public enum ComparisonOperator {
    STRING_EQUALS("StringEquals", Kind.STRING, Relation.EQ, false),
    STRING_EQUALS_PATH("StringEqualsPath", Kind.STRING, Relation.EQ, true),
    STRING_LESS_THAN("StringLessThan", Kind.STRING, Relation.LT, false),
    STRING_LESS_THAN_PATH("StringLessThanPath", Kind.STRING, Relation.LT, true),
    STRING_GREATER_THAN("StringGreaterThan", Kind.STRING, Relation.GT, false),
    STRING_GREATER_THAN_PATH("StringGreaterThanPath", Kind.STRING, Relation.GT, true),
    STRING_LESS_THAN_EQUALS("StringLessThanEquals", Kind.STRING, Relation.LTE, false),
    STRING_LESS_THAN_EQUALS_PATH("StringLessThanEqualsPath", Kind.STRING, Relation.LTE, true),
    STRING_GREATER_THAN_EQUALS("StringGreaterThanEquals", Kind.STRING, Relation.GTE, false),
    STRING_GREATER_THAN_EQUALS_PATH("StringGreaterThanEqualsPath", Kind.STRING, Relation.GTE, true),
    STRING_MATCHES("StringMatches", Kind.STRING_MATCH, Relation.EQ, false),

    NUMERIC_EQUALS("NumericEquals", Kind.NUMERIC, Relation.EQ, false),
    NUMERIC_EQUALS_PATH("NumericEqualsPath", Kind.NUMERIC, Relation.EQ, true),
    NUMERIC_LESS_THAN("NumericLessThan", Kind.NUMERIC, Relation.LT, false),
    NUMERIC_LESS_THAN_PATH("NumericLessThanPath", Kind.NUMERIC, Relation.LT, true),
    NUMERIC_GREATER_THAN("NumericGreaterThan", Kind.NUMERIC, Relation.GT, false),
    NUMERIC_GREATER_THAN_PATH("NumericGreaterThanPath", Kind.NUMERIC, Relation.GT, true),
    NUMERIC_LESS_THAN_EQUALS("NumericLessThanEquals", Kind.NUMERIC, Relation.LTE, false),
    NUMERIC_LESS_THAN_EQUALS_PATH("NumericLessThanEqualsPath", Kind.NUMERIC, Relation.LTE, true),
    NUMERIC_GREATER_THAN_EQUALS("NumericGreaterThanEquals", Kind.NUMERIC, Relation.GTE, false),
    NUMERIC_GREATER_THAN_EQUALS_PATH("NumericGreaterThanEqualsPath", Kind.NUMERIC, Relation.GTE, true),

    BOOLEAN_EQUALS("BooleanEquals", Kind.BOOLEAN, Relation.EQ, false),
    BOOLEAN_EQUALS_PATH("BooleanEqualsPath", Kind.BOOLEAN, Relation.EQ, true),

    TIMESTAMP_EQUALS("TimestampEquals", Kind.TIMESTAMP, Relation.EQ, false),
    TIMESTAMP_EQUALS_PATH("TimestampEqualsPath", Kind.TIMESTAMP, Relation.EQ, true),
    TIMESTAMP_LESS_THAN("TimestampLessThan", Kind.TIMESTAMP, Relation.LT, false),
    TIMESTAMP_LESS_THAN_PATH("TimestampLessThanPath", Kind.TIMESTAMP, Relation.LT, true),
    TIMESTAMP_GREATER_THAN("TimestampGreaterThan", Kind.TIMESTAMP, Relation.GT, false),
    TIMESTAMP_GREATER_THAN_PATH("TimestampGreaterThanPath", Kind.TIMESTAMP, Relation.GT, true),
    TIMESTAMP_LESS_THAN_EQUALS("TimestampLessThanEquals", Kind.TIMESTAMP, Relation.LTE, false),
    TIMESTAMP_LESS_THAN_EQUALS_PATH("TimestampLessThanEqualsPath", Kind.TIMESTAMP, Relation.LTE, true),
    TIMESTAMP_GREATER_THAN_EQUALS("TimestampGreaterThanEquals", Kind.TIMESTAMP, Relation.GTE, false),
    TIMESTAMP_GREATER_THAN_EQUALS_PATH("TimestampGreaterThanEqualsPath", Kind.TIMESTAMP, Relation.GTE, true),

    IS_NULL("IsNull", Kind.TYPE_TEST, Relation.EQ, false),
    IS_PRESENT("IsPresent", Kind.TYPE_TEST, Relation.EQ, false),
    IS_NUMERIC("IsNumeric", Kind.TYPE_TEST, Relation.EQ, false),
    IS_STRING("IsString", Kind.TYPE_TEST, Relation.EQ, false),
    IS_BOOLEAN("IsBoolean", Kind.TYPE_TEST, Relation.EQ, false),
    IS_TIMESTAMP("IsTimestamp", Kind.TYPE_TEST, Relation.EQ, false);

    /**
     * Type of the values an operator compares.
     */
    public enum Kind {
        STRING,
        STRING_MATCH,
        NUMERIC,
        BOOLEAN,
        TIMESTAMP,
        TYPE_TEST
    }

    /**
     * Ordering relation between the variable (left) and the operand (right).
     */
    public enum Relation {
        EQ, LT, GT, LTE, GTE;

        /**
         * Apply this relation to a {@code compareTo} result.
         */
        public boolean holds(int comparison) {
            return switch (this) {
                case EQ -> comparison == 0;
                case LT -> comparison < 0;
                case GT -> comparison > 0;
                case LTE -> comparison <= 0;
                case GTE -> comparison >= 0;
            };
        }
    }

    private final String jsonName;
    private final Kind kind;
    private final Relation relation;
    private final boolean pathOperand;

    ComparisonOperator(String jsonName, Kind kind, Relation relation, boolean pathOperand) {
        this.jsonName = jsonName;
        this.kind = kind;
        this.relation = relation;
        this.pathOperand = pathOperand;
    }

    public String jsonName() {
        return jsonName;
    }

    public Kind kind() {
        return kind;
    }

    public Relation relation() {
        return relation;
    }

    /**
     * Check if the operand is a path into the input rather than a literal.
     */
    public boolean isPathOperand() {
        return pathOperand;
    }

    public static Optional<ComparisonOperator> fromJsonName(String name) {
        return Arrays.stream(values())
            .filter(op -> op.jsonName.equals(name))
            .findFirst();
    }
}
