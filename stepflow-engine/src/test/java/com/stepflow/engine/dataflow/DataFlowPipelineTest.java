package com.stepflow.engine.dataflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.Catcher;
import com.stepflow.core.model.DataPath;
import com.stepflow.core.model.ErrorNames;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.model.State;
import com.stepflow.core.model.StateType;
import com.stepflow.core.model.state.PassSpec;
import com.stepflow.core.path.JsonPathEvaluator;
import com.stepflow.engine.interpreter.CancellationSignal;
import com.stepflow.engine.interpreter.Environment;
import com.stepflow.engine.interpreter.ExecutionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DataFlowPipelineTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private DataFlowPipeline pipeline;
    private Environment env;

    @BeforeEach
    void setUp() throws Exception {
        pipeline = new DataFlowPipeline(new PathQuery(new JsonPathEvaluator()));
        JsonNode input = json("{\"order\": {\"id\": 7}}");
        env = new Environment(
            new ExecutionContext("exec-1", "nightly", Instant.parse("2026-01-01T00:00:00Z"), input),
            new CancellationSignal(),
            input);
        env.enterState("Prepare", Instant.parse("2026-01-01T00:00:05Z"));
    }

    // ========== Input ==========

    @Test
    @DisplayName("InputPath selects part of the raw input")
    void testInputPath() throws Exception {
        State state = pass().inputPath(DataPath.of("$.order")).build();

        JsonNode effective = pipeline.prepareInput(state, json("{\"order\": {\"id\": 7}, \"other\": 1}"), env);

        assertThat(effective).isEqualTo(json("{\"id\": 7}"));
    }

    @Test
    @DisplayName("Null InputPath yields an empty object")
    void testDiscardedInputPath() throws Exception {
        State state = pass().inputPath(DataPath.discard()).build();

        assertThat(pipeline.prepareInput(state, json("{\"a\": 1}"), env)).isEqualTo(json("{}"));
    }

    @Test
    @DisplayName("InputPath that matches nothing fails with States.Runtime")
    void testInputPathNoMatch() throws Exception {
        State state = pass().inputPath(DataPath.of("$.missing")).build();

        assertThatThrownBy(() -> pipeline.prepareInput(state, json("{\"a\": 1}"), env))
            .isInstanceOf(StatesRuntimeException.class)
            .extracting(e -> ((StatesRuntimeException) e).getError().error())
            .isEqualTo(ErrorNames.RUNTIME);
    }

    @Test
    @DisplayName("Parameters template resolves .$ keys, nested objects and context paths")
    void testParametersTemplate() throws Exception {
        State state = pass()
            .parameters(json("{"
                + "\"id.$\": \"$.order.id\","
                + "\"fixed\": \"literal\","
                + "\"nested\": {\"items.$\": \"$.items[*].sku\"},"
                + "\"list\": [{\"state.$\": \"$$.State.Name\"}],"
                + "\"execution.$\": \"$$.Execution.Name\""
                + "}"))
            .build();
        JsonNode raw = json("{\"order\": {\"id\": 7}, \"items\": [{\"sku\": \"a\"}, {\"sku\": \"b\"}]}");

        JsonNode effective = pipeline.prepareInput(state, raw, env);

        assertThat(effective).isEqualTo(json("{"
            + "\"id\": 7,"
            + "\"fixed\": \"literal\","
            + "\"nested\": {\"items\": [\"a\", \"b\"]},"
            + "\"list\": [{\"state\": \"Prepare\"}],"
            + "\"execution\": \"nightly\""
            + "}"));
    }

    // ========== Output ==========

    @Test
    @DisplayName("ResultPath places the result inside a copy of the raw input")
    void testResultPath() throws Exception {
        State state = pass().resultPath(DataPath.of("$.payment.status")).build();
        JsonNode raw = json("{\"order\": 1}");

        JsonNode output = pipeline.applyOutput(state, raw, json("\"PAID\""), env);

        assertThat(output).isEqualTo(json("{\"order\": 1, \"payment\": {\"status\": \"PAID\"}}"));
        assertThat(raw).isEqualTo(json("{\"order\": 1}"));
    }

    @Test
    @DisplayName("Default ResultPath replaces the input with the result")
    void testDefaultResultPath() throws Exception {
        State state = pass().build();

        assertThat(pipeline.applyOutput(state, json("{\"a\": 1}"), json("{\"b\": 2}"), env))
            .isEqualTo(json("{\"b\": 2}"));
    }

    @Test
    @DisplayName("Null ResultPath discards the result and keeps the raw input")
    void testDiscardedResultPath() throws Exception {
        State state = pass().resultPath(DataPath.discard()).build();

        assertThat(pipeline.applyOutput(state, json("{\"a\": 1}"), json("{\"b\": 2}"), env))
            .isEqualTo(json("{\"a\": 1}"));
    }

    @Test
    @DisplayName("OutputPath selects from the combined document; null yields an empty object")
    void testOutputPath() throws Exception {
        State selecting = pass().resultPath(DataPath.of("$.r")).outputPath(DataPath.of("$.r")).build();
        State discarding = pass().outputPath(DataPath.discard()).build();

        assertThat(pipeline.applyOutput(selecting, json("{\"a\": 1}"), json("[1, 2]"), env))
            .isEqualTo(json("[1, 2]"));
        assertThat(pipeline.applyOutput(discarding, json("{\"a\": 1}"), json("[1, 2]"), env))
            .isEqualTo(json("{}"));
    }

    @Test
    @DisplayName("ResultPath through a scalar fails with States.Runtime")
    void testResultPathThroughScalar() throws Exception {
        State state = pass().resultPath(DataPath.of("$.a.b")).build();

        assertThatThrownBy(() -> pipeline.applyOutput(state, json("{\"a\": 5}"), json("1"), env))
            .isInstanceOf(StatesRuntimeException.class)
            .hasMessageContaining(ErrorNames.RUNTIME);
    }

    @Test
    @DisplayName("Catcher writes the error object at its ResultPath")
    void testApplyCatcher() throws Exception {
        Catcher catcher = new Catcher(List.of(ErrorNames.ALL), "Recover", DataPath.of("$.error"));
        ExecutionError error = new ExecutionError("Payment.Declined", "card expired");

        JsonNode output = pipeline.applyCatcher(catcher, json("{\"order\": 1}"), error);

        assertThat(output).isEqualTo(json(
            "{\"order\": 1, \"error\": {\"Error\": \"Payment.Declined\", \"Cause\": \"card expired\"}}"));
    }

    @Test
    @DisplayName("Catcher without ResultPath replaces the input with the error object")
    void testApplyCatcherDefaultPath() throws Exception {
        Catcher catcher = new Catcher(List.of(ErrorNames.ALL), "Recover", null);

        JsonNode output = pipeline.applyCatcher(catcher, json("{\"order\": 1}"), ExecutionError.taskFailed("boom"));

        assertThat(output).isEqualTo(json("{\"Error\": \"States.TaskFailed\", \"Cause\": \"boom\"}"));
    }

    private State.Builder pass() {
        return State.builder().name("Prepare").type(StateType.PASS).spec(new PassSpec(null)).end(true);
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }
}
