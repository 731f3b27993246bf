package com.stepflow.core.definition;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.DefinitionException;
import com.stepflow.core.exception.PathException;
import com.stepflow.core.model.Catcher;
import com.stepflow.core.model.DataPath;
import com.stepflow.core.model.ErrorNames;
import com.stepflow.core.model.Program;
import com.stepflow.core.model.Retrier;
import com.stepflow.core.model.State;
import com.stepflow.core.model.choice.ChoiceRule;
import com.stepflow.core.model.choice.Condition;
import com.stepflow.core.model.state.ChoiceSpec;
import com.stepflow.core.model.state.FailSpec;
import com.stepflow.core.model.state.MapSpec;
import com.stepflow.core.model.state.ParallelSpec;
import com.stepflow.core.model.state.PassSpec;
import com.stepflow.core.model.state.StateSpec;
import com.stepflow.core.model.state.SucceedSpec;
import com.stepflow.core.model.state.TaskSpec;
import com.stepflow.core.model.state.WaitSpec;
import com.stepflow.core.model.state.WaitTarget;
import com.stepflow.core.path.CompiledPath;
import com.stepflow.core.path.ReferencePath;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Semantic checks on a constructed {@link Program}, recursing into Parallel branches and Map
 * iterators. Used by {@link DefinitionParser}, and usable directly on programs built in code.
 *
 * Rules enforced:
 * - StartAt and every Next, Default and Catch target name a state of the same program
 * - Task, Pass, Wait, Parallel and Map declare exactly one of Next or End
 * - Choice, Succeed and Fail declare neither; Succeed and Fail declare no Retry or Catch
 * - Retrier and Catcher error sets are non-empty; States.ALL appears alone in the last rule
 * - numeric attributes are in range; paths are syntactically valid; ResultPaths are
 *   reference paths
 */
public class ProgramValidator {

    /**
     * Validate a program and all of its nested programs.
     *
     * @throws DefinitionException on the first violated rule
     */
    public void validate(Program program) {
        validateProgram(program, "");
    }

    private void validateProgram(Program program, String location) {
        if (program.states().isEmpty()) {
            throw new DefinitionException(Locations.display(location), "States", "must declare at least one state");
        }
        if (!program.hasState(program.startAt())) {
            throw new DefinitionException(Locations.display(location), "StartAt",
                "names unknown state '" + program.startAt() + "'");
        }
        if (program.timeoutSeconds() != null && program.timeoutSeconds() <= 0) {
            throw new DefinitionException(Locations.display(location), "TimeoutSeconds", "must be positive");
        }
        for (State state : program.states().values()) {
            validateState(program, state, Locations.state(location, state.name()));
        }
    }

    // ========== States ==========

    private void validateState(Program program, State state, String location) {
        if (state.type() == null) {
            throw new DefinitionException(location, "Type", "is required");
        }
        validateTransition(program, state, location);

        validatePath(location, "InputPath", state.inputPath(), false);
        validatePath(location, "OutputPath", state.outputPath(), false);
        validatePath(location, "ResultPath", state.resultPath(), true);
        validateTemplate(location, "Parameters", state.parameters());

        if (!state.type().supportsRecovery()) {
            if (!state.retriers().isEmpty()) {
                throw new DefinitionException(location, "Retry", "not allowed on " + state.type().jsonName() + " states");
            }
            if (!state.catchers().isEmpty()) {
                throw new DefinitionException(location, "Catch", "not allowed on " + state.type().jsonName() + " states");
            }
        }
        validateRetriers(state.retriers(), location);
        validateCatchers(program, state.catchers(), location);

        switch (state.type()) {
            case TASK -> validateTask(expectSpec(state, TaskSpec.class, location), location);
            case PASS -> expectSpec(state, PassSpec.class, location);
            case WAIT -> validateWait(expectSpec(state, WaitSpec.class, location), location);
            case CHOICE -> validateChoice(program, expectSpec(state, ChoiceSpec.class, location), location);
            case SUCCEED -> expectSpec(state, SucceedSpec.class, location);
            case FAIL -> expectSpec(state, FailSpec.class, location);
            case PARALLEL -> validateParallel(expectSpec(state, ParallelSpec.class, location), location);
            case MAP -> validateMap(expectSpec(state, MapSpec.class, location), location);
        }
    }

    private void validateTransition(Program program, State state, String location) {
        if (state.type().requiresTransition()) {
            if (state.next() != null && state.end()) {
                throw new DefinitionException(location, "Next", "Next and End are mutually exclusive");
            }
            if (state.next() == null && !state.end()) {
                throw new DefinitionException(location, "Next", "one of Next or End is required");
            }
        } else {
            if (state.next() != null) {
                throw new DefinitionException(location, "Next", "not allowed on " + state.type().jsonName() + " states");
            }
            if (state.end()) {
                throw new DefinitionException(location, "End", "not allowed on " + state.type().jsonName() + " states");
            }
        }
        requireTarget(program, state.next(), location, "Next");
    }

    private <T extends StateSpec> T expectSpec(State state, Class<T> specType, String location) {
        if (!specType.isInstance(state.spec())) {
            throw new DefinitionException(location, "Type",
                state.type().jsonName() + " state carries " + describe(state.spec()));
        }
        return specType.cast(state.spec());
    }

    private void validateTask(TaskSpec spec, String location) {
        if (spec.resource() == null || spec.resource().isBlank()) {
            throw new DefinitionException(location, "Resource", "is required");
        }
        if (spec.timeoutSeconds() != null && spec.timeoutSeconds() <= 0) {
            throw new DefinitionException(location, "TimeoutSeconds", "must be positive");
        }
        if (spec.heartbeatSeconds() != null) {
            int timeout = spec.timeoutSeconds() != null ? spec.timeoutSeconds() : TaskSpec.DEFAULT_TIMEOUT_SECONDS;
            if (spec.heartbeatSeconds() <= 0) {
                throw new DefinitionException(location, "HeartbeatSeconds", "must be positive");
            }
            if (spec.heartbeatSeconds() >= timeout) {
                throw new DefinitionException(location, "HeartbeatSeconds",
                    "must be smaller than the timeout (" + timeout + "s)");
            }
        }
    }

    private void validateWait(WaitSpec spec, String location) {
        WaitTarget target = spec.target();
        if (target == null) {
            throw new DefinitionException(location, "Seconds",
                "one of Seconds, SecondsPath, Timestamp or TimestampPath is required");
        }
        if (target instanceof WaitTarget.Seconds seconds && seconds.seconds() < 0) {
            throw new DefinitionException(location, "Seconds", "must not be negative");
        } else if (target instanceof WaitTarget.SecondsPath secondsPath) {
            validatePath(location, "SecondsPath", secondsPath.path());
        } else if (target instanceof WaitTarget.TimestampPath timestampPath) {
            validatePath(location, "TimestampPath", timestampPath.path());
        }
    }

    private void validateChoice(Program program, ChoiceSpec spec, String location) {
        if (spec.choices().isEmpty() && spec.defaultNext() == null) {
            throw new DefinitionException(location, "Choices", "at least one rule or a Default is required");
        }
        for (int i = 0; i < spec.choices().size(); i++) {
            ChoiceRule rule = spec.choices().get(i);
            String ruleLocation = location + ".Choices[" + i + "]";
            if (rule.next() == null) {
                throw new DefinitionException(ruleLocation, "Next", "is required");
            }
            requireTarget(program, rule.next(), ruleLocation, "Next");
            validateCondition(rule.condition(), ruleLocation);
        }
        requireTarget(program, spec.defaultNext(), location, "Default");
    }

    private void validateCondition(Condition condition, String location) {
        if (condition instanceof Condition.Comparison comparison) {
            if (comparison.operator() == null) {
                throw new DefinitionException(location, "Variable", "comparison operator is required");
            }
            validatePath(location, "Variable", comparison.variable());
            if (comparison.operator().isPathOperand()) {
                JsonNode operand = comparison.operand();
                if (operand == null || !operand.isTextual()) {
                    throw new DefinitionException(location, comparison.operator().jsonName(), "must be a path string");
                }
                validatePath(location, comparison.operator().jsonName(), operand.textValue());
            }
        } else if (condition instanceof Condition.And and) {
            validateConditions(and.conditions(), location + ".And", "And");
        } else if (condition instanceof Condition.Or or) {
            validateConditions(or.conditions(), location + ".Or", "Or");
        } else if (condition instanceof Condition.Not not) {
            validateCondition(not.condition(), location + ".Not");
        } else {
            throw new DefinitionException(location, "Variable", "a condition is required");
        }
    }

    private void validateConditions(List<Condition> conditions, String location, String field) {
        if (conditions.isEmpty()) {
            throw new DefinitionException(location, field, "must not be empty");
        }
        for (int i = 0; i < conditions.size(); i++) {
            validateCondition(conditions.get(i), location + "[" + i + "]");
        }
    }

    private void validateParallel(ParallelSpec spec, String location) {
        if (spec.branches().isEmpty()) {
            throw new DefinitionException(location, "Branches", "at least one branch is required");
        }
        for (int i = 0; i < spec.branches().size(); i++) {
            validateProgram(spec.branches().get(i), location + ".Branches[" + i + "]");
        }
    }

    private void validateMap(MapSpec spec, String location) {
        if (spec.iterator() == null) {
            throw new DefinitionException(location, "Iterator", "is required");
        }
        if (spec.itemsPath() != null) {
            validatePath(location, "ItemsPath", spec.itemsPath());
        }
        if (spec.maxConcurrency() != null && spec.maxConcurrency() < 0) {
            throw new DefinitionException(location, "MaxConcurrency", "must not be negative");
        }
        validateTemplate(location, "ItemSelector", spec.itemSelector());
        validateProgram(spec.iterator(), location + ".Iterator");
    }

    // ========== Recovery ==========

    private void validateRetriers(List<Retrier> retriers, String location) {
        for (int i = 0; i < retriers.size(); i++) {
            Retrier retrier = retriers.get(i);
            String retrierLocation = location + ".Retry[" + i + "]";
            validateErrorEquals(retrier.errorEquals(), i == retriers.size() - 1, retrierLocation);
            if (retrier.intervalSeconds() != null && retrier.intervalSeconds() < 1) {
                throw new DefinitionException(retrierLocation, "IntervalSeconds", "must be at least 1");
            }
            if (retrier.maxAttempts() != null && retrier.maxAttempts() < 0) {
                throw new DefinitionException(retrierLocation, "MaxAttempts", "must not be negative");
            }
            if (retrier.backoffRate() != null && retrier.backoffRate() < 1.0) {
                throw new DefinitionException(retrierLocation, "BackoffRate", "must be at least 1.0");
            }
            if (retrier.maxDelaySeconds() != null && retrier.maxDelaySeconds() < 1) {
                throw new DefinitionException(retrierLocation, "MaxDelaySeconds", "must be at least 1");
            }
        }
    }

    private void validateCatchers(Program program, List<Catcher> catchers, String location) {
        for (int i = 0; i < catchers.size(); i++) {
            Catcher catcher = catchers.get(i);
            String catcherLocation = location + ".Catch[" + i + "]";
            validateErrorEquals(catcher.errorEquals(), i == catchers.size() - 1, catcherLocation);
            if (catcher.next() == null) {
                throw new DefinitionException(catcherLocation, "Next", "is required");
            }
            requireTarget(program, catcher.next(), catcherLocation, "Next");
            validatePath(catcherLocation, "ResultPath", catcher.resultPath(), true);
        }
    }

    private void validateErrorEquals(List<String> errorEquals, boolean last, String location) {
        if (errorEquals.isEmpty()) {
            throw new DefinitionException(location, "ErrorEquals", "must not be empty");
        }
        if (errorEquals.contains(ErrorNames.ALL) && (errorEquals.size() > 1 || !last)) {
            throw new DefinitionException(location, "ErrorEquals",
                ErrorNames.ALL + " must appear alone and in the last rule");
        }
    }

    // ========== Paths ==========

    private void requireTarget(Program program, String target, String location, String field) {
        if (target != null && !program.hasState(target)) {
            throw new DefinitionException(location, field, "names unknown state '" + target + "'");
        }
    }

    private void validatePath(String location, String field, DataPath path, boolean reference) {
        if (path == null || path.isDiscard()) {
            return;
        }
        try {
            if (reference) {
                ReferencePath.compile(path.expression());
            } else {
                CompiledPath.compile(path.expression());
            }
        } catch (PathException e) {
            throw new DefinitionException(location, field, e.getMessage(), e);
        }
    }

    private void validatePath(String location, String field, String expression) {
        try {
            CompiledPath.compile(contextRelative(expression));
        } catch (PathException e) {
            throw new DefinitionException(location, field, e.getMessage(), e);
        }
    }

    /**
     * Check every {@code "key.$"} entry of a Parameters or ItemSelector template.
     */
    private void validateTemplate(String location, String field, JsonNode template) {
        if (template == null) {
            return;
        }
        if (template.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = template.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (entry.getKey().endsWith(".$")) {
                    if (!entry.getValue().isTextual()) {
                        throw new DefinitionException(location, field,
                            "value of '" + entry.getKey() + "' must be a path string");
                    }
                    validatePath(location, field, entry.getValue().textValue());
                } else {
                    validateTemplate(location, field, entry.getValue());
                }
            }
        } else if (template.isArray()) {
            for (JsonNode element : template) {
                validateTemplate(location, field, element);
            }
        }
    }

    /**
     * {@code $$.x} paths address the context object; they are checked as {@code $.x}.
     */
    private static String contextRelative(String expression) {
        if (expression != null && expression.startsWith("$$")) {
            return expression.substring(1);
        }
        return expression;
    }

    private static String describe(StateSpec spec) {
        return spec == null ? "no attributes" : spec.getClass().getSimpleName();
    }
}
