package com.stepflow.core.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.exception.DefinitionException;
import com.stepflow.core.model.Catcher;
import com.stepflow.core.model.DataPath;
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
import com.stepflow.core.model.state.TaskSpec;
import com.stepflow.core.model.state.WaitSpec;
import com.stepflow.core.model.state.WaitTarget;

import java.util.List;

/**
 * Serializes a {@link Program} back to its JSON definition. Only declared fields are written,
 * so parsing the output yields an equal Program.
 */
public class DefinitionWriter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;

    public DefinitionWriter() {
        this(new ObjectMapper());
    }

    public DefinitionWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode write(Program program) {
        ObjectNode node = NODES.objectNode();
        putIfPresent(node, "Comment", program.comment());
        node.put("StartAt", program.startAt());
        ObjectNode states = node.putObject("States");
        for (State state : program.states().values()) {
            states.set(state.name(), writeState(state));
        }
        putIfPresent(node, "Version", program.version());
        if (program.timeoutSeconds() != null) {
            node.put("TimeoutSeconds", program.timeoutSeconds());
        }
        return node;
    }

    /**
     * Serialize to pretty-printed JSON text.
     */
    public String writeString(Program program) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(write(program));
        } catch (JsonProcessingException e) {
            throw new DefinitionException("Failed to serialize state machine: " + e.getOriginalMessage());
        }
    }

    // ========== States ==========

    private ObjectNode writeState(State state) {
        ObjectNode node = NODES.objectNode();
        node.put("Type", state.type().jsonName());
        putIfPresent(node, "Comment", state.comment());

        switch (state.type()) {
            case TASK -> writeTask(node, state.spec(TaskSpec.class));
            case PASS -> {
                PassSpec pass = state.spec(PassSpec.class);
                if (pass.hasResult()) {
                    node.set("Result", pass.result().deepCopy());
                }
            }
            case WAIT -> writeWait(node, state.spec(WaitSpec.class).target());
            case CHOICE -> writeChoice(node, state.spec(ChoiceSpec.class));
            case SUCCEED -> {
            }
            case FAIL -> {
                FailSpec fail = state.spec(FailSpec.class);
                putIfPresent(node, "Error", fail.error());
                putIfPresent(node, "Cause", fail.cause());
            }
            case PARALLEL -> {
                ArrayNode branches = node.putArray("Branches");
                state.spec(ParallelSpec.class).branches().forEach(branch -> branches.add(write(branch)));
            }
            case MAP -> writeMap(node, state.spec(MapSpec.class));
        }

        putPath(node, "InputPath", state.inputPath());
        if (state.parameters() != null) {
            node.set("Parameters", state.parameters().deepCopy());
        }
        putPath(node, "ResultPath", state.resultPath());
        putPath(node, "OutputPath", state.outputPath());
        writeRetriers(node, state.retriers());
        writeCatchers(node, state.catchers());

        putIfPresent(node, "Next", state.next());
        if (state.end()) {
            node.put("End", true);
        }
        return node;
    }

    private void writeTask(ObjectNode node, TaskSpec spec) {
        node.put("Resource", spec.resource());
        if (spec.timeoutSeconds() != null) {
            node.put("TimeoutSeconds", spec.timeoutSeconds());
        }
        if (spec.heartbeatSeconds() != null) {
            node.put("HeartbeatSeconds", spec.heartbeatSeconds());
        }
    }

    private void writeWait(ObjectNode node, WaitTarget target) {
        if (target instanceof WaitTarget.Seconds seconds) {
            long value = seconds.seconds();
            if (value == (int) value) {
                node.put(target.fieldName(), (int) value);
            } else {
                node.put(target.fieldName(), value);
            }
        } else if (target instanceof WaitTarget.SecondsPath secondsPath) {
            node.put(target.fieldName(), secondsPath.path());
        } else if (target instanceof WaitTarget.Timestamp timestamp) {
            node.put(target.fieldName(), timestamp.text());
        } else if (target instanceof WaitTarget.TimestampPath timestampPath) {
            node.put(target.fieldName(), timestampPath.path());
        }
    }

    private void writeChoice(ObjectNode node, ChoiceSpec spec) {
        if (!spec.choices().isEmpty()) {
            ArrayNode choices = node.putArray("Choices");
            for (ChoiceRule rule : spec.choices()) {
                ObjectNode ruleNode = writeCondition(rule.condition());
                ruleNode.put("Next", rule.next());
                choices.add(ruleNode);
            }
        }
        putIfPresent(node, "Default", spec.defaultNext());
    }

    private ObjectNode writeCondition(Condition condition) {
        ObjectNode node = NODES.objectNode();
        if (condition instanceof Condition.Comparison comparison) {
            node.put("Variable", comparison.variable());
            node.set(comparison.operator().jsonName(), comparison.operand().deepCopy());
        } else if (condition instanceof Condition.And and) {
            ArrayNode all = node.putArray("And");
            and.conditions().forEach(c -> all.add(writeCondition(c)));
        } else if (condition instanceof Condition.Or or) {
            ArrayNode any = node.putArray("Or");
            or.conditions().forEach(c -> any.add(writeCondition(c)));
        } else if (condition instanceof Condition.Not not) {
            node.set("Not", writeCondition(not.condition()));
        }
        return node;
    }

    private void writeMap(ObjectNode node, MapSpec spec) {
        node.set("Iterator", write(spec.iterator()));
        putIfPresent(node, "ItemsPath", spec.itemsPath());
        if (spec.maxConcurrency() != null) {
            node.put("MaxConcurrency", spec.maxConcurrency());
        }
        if (spec.itemSelector() != null) {
            node.set("ItemSelector", spec.itemSelector().deepCopy());
        }
    }

    // ========== Recovery ==========

    private void writeRetriers(ObjectNode node, List<Retrier> retriers) {
        if (retriers.isEmpty()) {
            return;
        }
        ArrayNode retry = node.putArray("Retry");
        for (Retrier retrier : retriers) {
            ObjectNode rule = retry.addObject();
            writeErrorEquals(rule, retrier.errorEquals());
            if (retrier.intervalSeconds() != null) {
                rule.put("IntervalSeconds", retrier.intervalSeconds());
            }
            if (retrier.maxAttempts() != null) {
                rule.put("MaxAttempts", retrier.maxAttempts());
            }
            if (retrier.backoffRate() != null) {
                rule.put("BackoffRate", retrier.backoffRate());
            }
            if (retrier.maxDelaySeconds() != null) {
                rule.put("MaxDelaySeconds", retrier.maxDelaySeconds());
            }
        }
    }

    private void writeCatchers(ObjectNode node, List<Catcher> catchers) {
        if (catchers.isEmpty()) {
            return;
        }
        ArrayNode catchNode = node.putArray("Catch");
        for (Catcher catcher : catchers) {
            ObjectNode rule = catchNode.addObject();
            writeErrorEquals(rule, catcher.errorEquals());
            putPath(rule, "ResultPath", catcher.resultPath());
            rule.put("Next", catcher.next());
        }
    }

    private void writeErrorEquals(ObjectNode rule, List<String> errorEquals) {
        ArrayNode names = rule.putArray("ErrorEquals");
        errorEquals.forEach(names::add);
    }

    // ========== Helpers ==========

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putPath(ObjectNode node, String field, DataPath path) {
        if (path == null) {
            return;
        }
        if (path.isDiscard()) {
            node.putNull(field);
        } else {
            node.put(field, path.expression());
        }
    }
}
