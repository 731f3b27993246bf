package com.stepflow.core.model.choice;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Boolean predicate evaluated against the effective input of a Choice state.
 */
public sealed interface Condition {

    /**
     * Compares the value at {@code variable} with {@code operand}. For path operators the
     * operand is a path whose first match is the right-hand side.
     */
    record Comparison(String variable, ComparisonOperator operator, JsonNode operand) implements Condition {
    }

    record And(List<Condition> conditions) implements Condition {
        public And {
            conditions = List.copyOf(conditions);
        }
    }

    record Or(List<Condition> conditions) implements Condition {
        public Or {
            conditions = List.copyOf(conditions);
        }
    }

    record Not(Condition condition) implements Condition {
    }
}
