package com.stepflow.core.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.exception.DefinitionException;
import com.stepflow.core.model.Catcher;
import com.stepflow.core.model.DataPath;
import com.stepflow.core.model.Program;
import com.stepflow.core.model.Retrier;
import com.stepflow.core.model.State;
import com.stepflow.core.model.StateType;
import com.stepflow.core.model.Timestamps;
import com.stepflow.core.model.choice.ChoiceRule;
import com.stepflow.core.model.choice.ComparisonOperator;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link Program} from a JSON state machine definition.
 *
 * Parsing checks the shape of every recognized field (presence, JSON type); the resulting
 * Program is then handed to {@link ProgramValidator} for the semantic rules. Either step
 * failing raises a {@link DefinitionException} naming the state and field, and no Program is
 * returned. Unrecognized fields are ignored.
 */
public class DefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(DefinitionParser.class);

    private static final Set<String> WAIT_FIELDS = Set.of("Seconds", "SecondsPath", "Timestamp", "TimestampPath");

    private final ObjectMapper objectMapper;
    private final ProgramValidator validator;

    public DefinitionParser() {
        this(new ObjectMapper(), new ProgramValidator());
    }

    public DefinitionParser(ObjectMapper objectMapper, ProgramValidator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * Parse and validate definition text.
     *
     * @throws DefinitionException if the text is not JSON or the definition is invalid
     */
    public Program parse(String definition) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(definition);
        } catch (JsonProcessingException e) {
            throw new DefinitionException(Locations.ROOT, "definition", "not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(tree);
    }

    /**
     * Parse and validate a definition tree. The tree is not retained.
     *
     * @throws DefinitionException if the definition is invalid
     */
    public Program parse(JsonNode definition) {
        Program program = parseProgram(definition, "");
        validator.validate(program);
        log.debug("Parsed state machine: startAt={}, states={}", program.startAt(), program.states().size());
        return program;
    }

    // ========== Program ==========

    private Program parseProgram(JsonNode node, String location) {
        requireObject(node, location, "definition");

        String startAt = requiredString(node, location, "StartAt");
        JsonNode statesNode = node.get("States");
        if (statesNode == null || !statesNode.isObject()) {
            throw new DefinitionException(Locations.display(location), "States", "must be an object");
        }
        if (statesNode.isEmpty()) {
            throw new DefinitionException(Locations.display(location), "States", "must declare at least one state");
        }

        Map<String, State> states = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = statesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String stateLocation = Locations.state(location, entry.getKey());
            states.put(entry.getKey(), parseState(entry.getKey(), entry.getValue(), stateLocation));
        }

        return new Program(
            startAt,
            states,
            optionalString(node, location, "Comment"),
            optionalString(node, location, "Version"),
            optionalInt(node, location, "TimeoutSeconds")
        );
    }

    // ========== States ==========

    private State parseState(String name, JsonNode node, String location) {
        requireObject(node, location, "state");

        String typeName = requiredString(node, location, "Type");
        StateType type = StateType.fromJsonName(typeName)
            .orElseThrow(() -> new DefinitionException(location, "Type", "unknown state type '" + typeName + "'"));

        JsonNode endNode = node.get("End");
        if (endNode != null && !endNode.isBoolean()) {
            throw new DefinitionException(location, "End", "must be a boolean");
        }

        return State.builder()
            .name(name)
            .type(type)
            .comment(optionalString(node, location, "Comment"))
            .next(optionalString(node, location, "Next"))
            .end(endNode != null && endNode.booleanValue())
            .inputPath(optionalPath(node, location, "InputPath"))
            .outputPath(optionalPath(node, location, "OutputPath"))
            .resultPath(optionalPath(node, location, "ResultPath"))
            .parameters(optionalObject(node, location, "Parameters"))
            .retriers(parseRetriers(node, location))
            .catchers(parseCatchers(node, location))
            .spec(parseSpec(type, node, location))
            .build();
    }

    private StateSpec parseSpec(StateType type, JsonNode node, String location) {
        return switch (type) {
            case TASK -> new TaskSpec(
                requiredString(node, location, "Resource"),
                optionalInt(node, location, "TimeoutSeconds"),
                optionalInt(node, location, "HeartbeatSeconds"));
            case PASS -> new PassSpec(node.has("Result") ? node.get("Result").deepCopy() : null);
            case WAIT -> new WaitSpec(parseWaitTarget(node, location));
            case CHOICE -> parseChoice(node, location);
            case SUCCEED -> new SucceedSpec();
            case FAIL -> new FailSpec(
                optionalString(node, location, "Error"),
                optionalString(node, location, "Cause"));
            case PARALLEL -> parseParallel(node, location);
            case MAP -> parseMap(node, location);
        };
    }

    private WaitTarget parseWaitTarget(JsonNode node, String location) {
        List<String> declared = new ArrayList<>();
        node.fieldNames().forEachRemaining(field -> {
            if (WAIT_FIELDS.contains(field)) {
                declared.add(field);
            }
        });
        if (declared.size() != 1) {
            throw new DefinitionException(location, "Seconds",
                "exactly one of Seconds, SecondsPath, Timestamp or TimestampPath is required, found " + declared);
        }

        String field = declared.get(0);
        return switch (field) {
            case "Seconds" -> {
                JsonNode seconds = node.get(field);
                if (!seconds.isIntegralNumber() || !seconds.canConvertToLong()) {
                    throw new DefinitionException(location, field, "must be an integer");
                }
                yield new WaitTarget.Seconds(seconds.longValue());
            }
            case "SecondsPath" -> new WaitTarget.SecondsPath(requiredString(node, location, field));
            case "Timestamp" -> {
                String text = requiredString(node, location, field);
                Instant instant = Timestamps.parse(text)
                    .orElseThrow(() -> new DefinitionException(location, field,
                        "'" + text + "' is not an ISO-8601 timestamp"));
                yield new WaitTarget.Timestamp(text, instant);
            }
            default -> new WaitTarget.TimestampPath(requiredString(node, location, field));
        };
    }

    private ChoiceSpec parseChoice(JsonNode node, String location) {
        List<ChoiceRule> rules = new ArrayList<>();
        JsonNode choices = node.get("Choices");
        if (choices != null) {
            if (!choices.isArray()) {
                throw new DefinitionException(location, "Choices", "must be an array");
            }
            for (int i = 0; i < choices.size(); i++) {
                String ruleLocation = location + ".Choices[" + i + "]";
                JsonNode rule = choices.get(i);
                requireObject(rule, ruleLocation, "choice rule");
                rules.add(new ChoiceRule(
                    parseCondition(rule, ruleLocation),
                    requiredString(rule, ruleLocation, "Next")));
            }
        }
        return new ChoiceSpec(rules, optionalString(node, location, "Default"));
    }

    private Condition parseCondition(JsonNode node, String location) {
        requireObject(node, location, "condition");

        if (node.has("And")) {
            return new Condition.And(parseConditions(node.get("And"), location + ".And", "And"));
        }
        if (node.has("Or")) {
            return new Condition.Or(parseConditions(node.get("Or"), location + ".Or", "Or"));
        }
        if (node.has("Not")) {
            return new Condition.Not(parseCondition(node.get("Not"), location + ".Not"));
        }

        ComparisonOperator operator = null;
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            Optional<ComparisonOperator> candidate = ComparisonOperator.fromJsonName(name);
            if (candidate.isPresent()) {
                if (operator != null) {
                    throw new DefinitionException(location, name,
                        "a comparison takes a single operator, " + operator.jsonName() + " is already declared");
                }
                operator = candidate.get();
            }
        }
        if (operator == null) {
            throw new DefinitionException(location, "Variable", "no comparison operator or And/Or/Not declared");
        }

        String variable = requiredString(node, location, "Variable");
        JsonNode operand = node.get(operator.jsonName());
        checkOperandType(operator, operand, location);
        return new Condition.Comparison(variable, operator, operand.deepCopy());
    }

    private List<Condition> parseConditions(JsonNode node, String location, String field) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new DefinitionException(location, field, "must be a non-empty array");
        }
        List<Condition> conditions = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            conditions.add(parseCondition(node.get(i), location + "[" + i + "]"));
        }
        return conditions;
    }

    private void checkOperandType(ComparisonOperator operator, JsonNode operand, String location) {
        String field = operator.jsonName();
        if (operator.isPathOperand()) {
            if (!operand.isTextual()) {
                throw new DefinitionException(location, field, "must be a path string");
            }
            return;
        }
        boolean valid = switch (operator.kind()) {
            case STRING, STRING_MATCH -> operand.isTextual();
            case NUMERIC -> operand.isNumber();
            case BOOLEAN, TYPE_TEST -> operand.isBoolean();
            case TIMESTAMP -> operand.isTextual() && Timestamps.isTimestamp(operand.textValue());
        };
        if (!valid) {
            throw new DefinitionException(location, field, "operand has the wrong type for " + operator.kind());
        }
    }

    private ParallelSpec parseParallel(JsonNode node, String location) {
        JsonNode branches = node.get("Branches");
        if (branches == null || !branches.isArray()) {
            throw new DefinitionException(location, "Branches", "must be an array");
        }
        List<Program> programs = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            programs.add(parseProgram(branches.get(i), location + ".Branches[" + i + "]"));
        }
        return new ParallelSpec(programs);
    }

    private MapSpec parseMap(JsonNode node, String location) {
        JsonNode iterator = node.get("Iterator");
        if (iterator == null) {
            throw new DefinitionException(location, "Iterator", "is required");
        }
        return new MapSpec(
            parseProgram(iterator, location + ".Iterator"),
            optionalString(node, location, "ItemsPath"),
            optionalInt(node, location, "MaxConcurrency"),
            optionalObject(node, location, "ItemSelector"));
    }

    // ========== Recovery ==========

    private List<Retrier> parseRetriers(JsonNode node, String location) {
        JsonNode retry = node.get("Retry");
        if (retry == null) {
            return List.of();
        }
        if (!retry.isArray()) {
            throw new DefinitionException(location, "Retry", "must be an array");
        }
        List<Retrier> retriers = new ArrayList<>();
        for (int i = 0; i < retry.size(); i++) {
            String retrierLocation = location + ".Retry[" + i + "]";
            JsonNode rule = retry.get(i);
            requireObject(rule, retrierLocation, "retrier");
            retriers.add(new Retrier(
                errorEquals(rule, retrierLocation),
                optionalInt(rule, retrierLocation, "IntervalSeconds"),
                optionalInt(rule, retrierLocation, "MaxAttempts"),
                optionalDouble(rule, retrierLocation, "BackoffRate"),
                optionalInt(rule, retrierLocation, "MaxDelaySeconds")));
        }
        return retriers;
    }

    private List<Catcher> parseCatchers(JsonNode node, String location) {
        JsonNode catchNode = node.get("Catch");
        if (catchNode == null) {
            return List.of();
        }
        if (!catchNode.isArray()) {
            throw new DefinitionException(location, "Catch", "must be an array");
        }
        List<Catcher> catchers = new ArrayList<>();
        for (int i = 0; i < catchNode.size(); i++) {
            String catcherLocation = location + ".Catch[" + i + "]";
            JsonNode rule = catchNode.get(i);
            requireObject(rule, catcherLocation, "catcher");
            catchers.add(new Catcher(
                errorEquals(rule, catcherLocation),
                requiredString(rule, catcherLocation, "Next"),
                optionalPath(rule, catcherLocation, "ResultPath")));
        }
        return catchers;
    }

    private List<String> errorEquals(JsonNode rule, String location) {
        JsonNode names = rule.get("ErrorEquals");
        if (names == null || !names.isArray() || names.isEmpty()) {
            throw new DefinitionException(location, "ErrorEquals", "must be a non-empty array");
        }
        List<String> result = new ArrayList<>();
        for (JsonNode name : names) {
            if (!name.isTextual()) {
                throw new DefinitionException(location, "ErrorEquals", "must contain only strings");
            }
            result.add(name.textValue());
        }
        return result;
    }

    // ========== Field helpers ==========

    private static void requireObject(JsonNode node, String location, String what) {
        if (node == null || !node.isObject()) {
            throw new DefinitionException(Locations.display(location), what, "must be a JSON object");
        }
    }

    private static String requiredString(JsonNode node, String location, String field) {
        String value = optionalString(node, location, field);
        if (value == null || value.isBlank()) {
            throw new DefinitionException(Locations.display(location), field, "is required");
        }
        return value;
    }

    private static String optionalString(JsonNode node, String location, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            throw new DefinitionException(Locations.display(location), field, "must be a string");
        }
        return value.textValue();
    }

    private static Integer optionalInt(JsonNode node, String location, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new DefinitionException(Locations.display(location), field, "must be an integer");
        }
        return value.intValue();
    }

    private static Double optionalDouble(JsonNode node, String location, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (!value.isNumber()) {
            throw new DefinitionException(Locations.display(location), field, "must be a number");
        }
        return value.doubleValue();
    }

    private static JsonNode optionalObject(JsonNode node, String location, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (!value.isObject()) {
            throw new DefinitionException(Locations.display(location), field, "must be a JSON object");
        }
        return value.deepCopy();
    }

    /**
     * Absent field: undeclared. JSON null: discard. String: path expression.
     */
    private static DataPath optionalPath(JsonNode node, String location, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (value.isNull()) {
            return DataPath.discard();
        }
        if (!value.isTextual()) {
            throw new DefinitionException(Locations.display(location), field, "must be a path string or null");
        }
        return DataPath.of(value.textValue());
    }
}
