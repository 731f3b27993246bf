package com.stepflow.engine.choice;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.model.Timestamps;
import com.stepflow.core.model.choice.ChoiceRule;
import com.stepflow.core.model.choice.ComparisonOperator;
import com.stepflow.core.model.choice.Condition;
import com.stepflow.core.model.state.ChoiceSpec;
import com.stepflow.engine.dataflow.PathQuery;
import com.stepflow.engine.interpreter.Environment;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Evaluates Choice rules in declaration order and returns the target of the first one that
 * holds, or the Default.
 * 
 * Rules:
 * - a comparison between values of the wrong type is false
 * - a missing Variable is an error, except for type tests
 * - path operands compare against the first match of their path
 */
public class ChoiceEvaluator {

    private final PathQuery paths;

    public ChoiceEvaluator(PathQuery paths) {
        this.paths = paths;
    }

    /**
     * Select the next state.
     * 
     * @throws StatesRuntimeException {@code States.NoChoiceMatched} when no rule holds and no
     *         Default is declared; {@code States.Runtime} when a Variable is missing
     */
    public String select(ChoiceSpec spec, JsonNode input, Environment env) {
        for (ChoiceRule rule : spec.choices()) {
            if (evaluate(rule.condition(), input, env)) {
                return rule.next();
            }
        }
        if (spec.defaultNext() != null) {
            return spec.defaultNext();
        }
        throw new StatesRuntimeException(ExecutionError.noChoiceMatched(
            "No Choice rule matched the input and no Default is declared"));
    }

    public boolean evaluate(Condition condition, JsonNode input, Environment env) {
        if (condition instanceof Condition.And and) {
            for (Condition c : and.conditions()) {
                if (!evaluate(c, input, env)) {
                    return false;
                }
            }
            return true;
        }
        if (condition instanceof Condition.Or or) {
            for (Condition c : or.conditions()) {
                if (evaluate(c, input, env)) {
                    return true;
                }
            }
            return false;
        }
        if (condition instanceof Condition.Not not) {
            return !evaluate(not.condition(), input, env);
        }
        return compare((Condition.Comparison) condition, input, env);
    }

    // ========== Comparisons ==========

    private boolean compare(Condition.Comparison comparison, JsonNode input, Environment env) {
        ComparisonOperator operator = comparison.operator();
        Optional<JsonNode> variable = paths.first(comparison.variable(), input, env);

        if (operator.kind() == ComparisonOperator.Kind.TYPE_TEST) {
            boolean expected = comparison.operand().asBoolean();
            return typeTest(operator, variable.orElse(null)) == expected;
        }

        JsonNode left = variable.orElseThrow(() -> missing("Variable", comparison.variable()));
        JsonNode right = comparison.operand();
        if (operator.isPathOperand()) {
            right = paths.first(right.asText(), input, env)
                .orElseThrow(() -> missing(operator.jsonName(), comparison.operand().asText()));
        }

        return switch (operator.kind()) {
            case STRING -> left.isTextual() && right.isTextual()
                && operator.relation().holds(left.asText().compareTo(right.asText()));
            case STRING_MATCH -> left.isTextual() && right.isTextual()
                && wildcard(right.asText()).matcher(left.asText()).matches();
            case NUMERIC -> left.isNumber() && right.isNumber()
                && operator.relation().holds(left.decimalValue().compareTo(right.decimalValue()));
            case BOOLEAN -> left.isBoolean() && right.isBoolean()
                && left.asBoolean() == right.asBoolean();
            case TIMESTAMP -> compareTimestamps(left, right, operator.relation());
            case TYPE_TEST -> throw new IllegalStateException("Type tests are handled above");
        };
    }

    private boolean typeTest(ComparisonOperator operator, JsonNode value) {
        if (operator == ComparisonOperator.IS_PRESENT) {
            return value != null;
        }
        if (value == null) {
            return false;
        }
        return switch (operator) {
            case IS_NULL -> value.isNull();
            case IS_NUMERIC -> value.isNumber();
            case IS_STRING -> value.isTextual();
            case IS_BOOLEAN -> value.isBoolean();
            case IS_TIMESTAMP -> value.isTextual() && Timestamps.isTimestamp(value.asText());
            default -> throw new IllegalArgumentException("Not a type test: " + operator);
        };
    }

    private boolean compareTimestamps(JsonNode left, JsonNode right, ComparisonOperator.Relation relation) {
        if (!left.isTextual() || !right.isTextual()) {
            return false;
        }
        Optional<Instant> l = Timestamps.parse(left.asText());
        Optional<Instant> r = Timestamps.parse(right.asText());
        return l.isPresent() && r.isPresent() && relation.holds(l.get().compareTo(r.get()));
    }

    /**
     * Compile a StringMatches pattern: {@code *} matches any run of characters,
     * {@code \*} a literal asterisk and {@code \\} a literal backslash.
     */
    static Pattern wildcard(String pattern) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()
                && (pattern.charAt(i + 1) == '*' || pattern.charAt(i + 1) == '\\')) {
                literal.append(pattern.charAt(++i));
            } else if (c == '*') {
                flush(regex, literal);
                regex.append(".*");
            } else {
                literal.append(c);
            }
        }
        flush(regex, literal);
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static void flush(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    private static StatesRuntimeException missing(String field, String path) {
        return new StatesRuntimeException(ExecutionError.runtime(String.format(
            "Invalid path '%s' in %s: the choice condition references a value that is not present in the input",
            path, field)));
    }
}
