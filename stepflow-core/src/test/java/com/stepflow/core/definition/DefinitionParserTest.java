package com.stepflow.core.definition;

import com.stepflow.core.exception.DefinitionException;
import com.stepflow.core.model.DataPath;
import com.stepflow.core.model.ErrorNames;
import com.stepflow.core.model.Program;
import com.stepflow.core.model.State;
import com.stepflow.core.model.StateType;
import com.stepflow.core.model.choice.ComparisonOperator;
import com.stepflow.core.model.choice.Condition;
import com.stepflow.core.model.state.ChoiceSpec;
import com.stepflow.core.model.state.MapSpec;
import com.stepflow.core.model.state.ParallelSpec;
import com.stepflow.core.model.state.TaskSpec;
import com.stepflow.core.model.state.WaitSpec;
import com.stepflow.core.model.state.WaitTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionParserTest {

    private DefinitionParser parser;

    @BeforeEach
    void setUp() {
        parser = new DefinitionParser();
    }

    static String resource(String name) throws IOException {
        try (InputStream in = DefinitionParserTest.class.getResourceAsStream("/definitions/" + name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // ========== Construction ==========

    @Test
    void parse_fullDefinition_shouldBuildEveryStateVariant() throws IOException {
        Program program = parser.parse(resource("full-featured.json"));

        assertEquals("Prepare", program.startAt());
        assertEquals(3600, program.timeoutSeconds());
        assertEquals(List.of("Prepare", "Charge", "Route", "Hold", "Until", "Fan", "Each", "Finished", "Declined"),
            List.copyOf(program.states().keySet()));

        State charge = program.state("Charge");
        assertEquals(StateType.TASK, charge.type());
        assertEquals("payments:charge", charge.spec(TaskSpec.class).resource());
        assertEquals(10, charge.spec(TaskSpec.class).heartbeatSeconds());
        assertEquals(DataPath.of("$.order"), charge.inputPath());
        assertEquals(2, charge.retriers().size());
        assertEquals(1.5, charge.retriers().get(0).backoffRate());
        assertTrue(charge.catchers().get(1).resultPath().isDiscard());
        assertEquals("Route", charge.next());

        ChoiceSpec route = program.state("Route").spec(ChoiceSpec.class);
        assertEquals(3, route.choices().size());
        assertEquals("Declined", route.defaultNext());
        Condition.Comparison first = (Condition.Comparison) route.choices().get(0).condition();
        assertEquals(ComparisonOperator.STRING_EQUALS, first.operator());
        assertInstanceOf(Condition.And.class, route.choices().get(1).condition());

        WaitTarget until = program.state("Until").spec(WaitSpec.class).target();
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), ((WaitTarget.Timestamp) until).instant());
        assertTrue(program.state("Until").inputPath().isDiscard());

        ParallelSpec fan = program.state("Fan").spec(ParallelSpec.class);
        assertEquals(2, fan.branches().size());
        assertEquals("Notify", fan.branches().get(1).startAt());

        MapSpec each = program.state("Each").spec(MapSpec.class);
        assertEquals("$.seed.items", each.effectiveItemsPath());
        assertEquals(2, each.maxConcurrency());
        assertTrue(program.state("Finished").isTerminal());
    }

    @Test
    void parse_undeclaredFields_shouldStayNull() {
        Program program = parser.parse("""
            {"StartAt": "A", "States": {"A": {"Type": "Pass", "End": true}}}
            """);

        State a = program.startState();
        assertNull(a.inputPath());
        assertNull(a.resultPath());
        assertNull(a.parameters());
        assertNull(program.version());
        assertEquals(DataPath.root(), a.effectiveOutputPath());
    }

    @Test
    void parse_invalidJson_shouldThrow() {
        DefinitionException e = assertThrows(DefinitionException.class, () -> parser.parse("{not json"));
        assertEquals(DefinitionException.ERROR_CODE, e.getErrorCode());
    }

    // ========== Validation ==========

    @Nested
    @DisplayName("Rejected definitions")
    class Rejections {

        private DefinitionException reject(String definition) {
            return assertThrows(DefinitionException.class, () -> parser.parse(definition));
        }

        @Test
        void unknownStartAt() {
            DefinitionException e = reject("""
                {"StartAt": "Missing", "States": {"A": {"Type": "Pass", "End": true}}}
                """);
            assertEquals("StartAt", e.getField());
        }

        @Test
        void nextToUnknownState() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Pass", "Next": "Nowhere"}}}
                """);
            assertEquals("States.A", e.getLocation());
            assertEquals("Next", e.getField());
        }

        @Test
        void nextAndEndTogether() {
            reject("""
                {"StartAt": "A", "States": {
                  "A": {"Type": "Pass", "Next": "B", "End": true},
                  "B": {"Type": "Succeed"}}}
                """);
        }

        @Test
        void missingTransition() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Task", "Resource": "r"}}}
                """);
            assertEquals("Next", e.getField());
        }

        @Test
        void unknownType() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Sleep", "End": true}}}
                """);
            assertEquals("Type", e.getField());
        }

        @Test
        void retryOnFailState() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Fail", "Error": "E",
                  "Retry": [{"ErrorEquals": ["States.ALL"]}]}}}
                """);
            assertEquals("Retry", e.getField());
        }

        @Test
        void emptyErrorEquals() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Task", "Resource": "r", "End": true,
                  "Retry": [{"ErrorEquals": []}]}}}
                """);
            assertEquals("ErrorEquals", e.getField());
        }

        @Test
        void wildcardNotLast() {
            reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Task", "Resource": "r", "End": true,
                  "Retry": [{"ErrorEquals": ["States.ALL"]}, {"ErrorEquals": ["Other"]}]}}}
                """);
        }

        @Test
        void backoffRateBelowOne() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Task", "Resource": "r", "End": true,
                  "Retry": [{"ErrorEquals": ["X"], "BackoffRate": 0.5}]}}}
                """);
            assertEquals("BackoffRate", e.getField());
        }

        @Test
        void waitWithTwoTargets() {
            reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Wait", "Seconds": 1, "SecondsPath": "$.s", "End": true}}}
                """);
        }

        @Test
        void negativeWaitSeconds() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Wait", "Seconds": -1, "End": true}}}
                """);
            assertEquals("Seconds", e.getField());
        }

        @Test
        void malformedTimestamp() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Wait", "Timestamp": "tomorrow", "End": true}}}
                """);
            assertEquals("Timestamp", e.getField());
        }

        @Test
        void heartbeatNotBelowTimeout() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Task", "Resource": "r",
                  "TimeoutSeconds": 10, "HeartbeatSeconds": 10, "End": true}}}
                """);
            assertEquals("HeartbeatSeconds", e.getField());
        }

        @Test
        void nonReferenceResultPath() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Pass", "ResultPath": "$.items[*]", "End": true}}}
                """);
            assertEquals("ResultPath", e.getField());
        }

        @Test
        void malformedInputPath() {
            reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Pass", "InputPath": "order", "End": true}}}
                """);
        }

        @Test
        void choiceWithoutRulesOrDefault() {
            reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Choice", "Choices": []}}}
                """);
        }

        @Test
        void choiceWithNext() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {
                  "A": {"Type": "Choice", "Default": "B", "Next": "B"},
                  "B": {"Type": "Succeed"}}}
                """);
            assertEquals("Next", e.getField());
        }

        @Test
        void operandOfWrongType() {
            reject("""
                {"StartAt": "A", "States": {
                  "A": {"Type": "Choice", "Choices": [{"Variable": "$.x", "NumericEquals": "one", "Next": "B"}]},
                  "B": {"Type": "Succeed"}}}
                """);
        }

        @Test
        void parallelWithoutBranches() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Parallel", "Branches": [], "End": true}}}
                """);
            assertEquals("Branches", e.getField());
        }

        @Test
        void mapWithoutIterator() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Map", "End": true}}}
                """);
            assertEquals("Iterator", e.getField());
        }

        @Test
        void negativeMaxConcurrency() {
            DefinitionException e = reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Map", "MaxConcurrency": -1, "End": true,
                  "Iterator": {"StartAt": "I", "States": {"I": {"Type": "Pass", "End": true}}}}}}
                """);
            assertEquals("MaxConcurrency", e.getField());
        }

        @Test
        void invalidStateInsideBranch_shouldNameEnclosingPath() {
            DefinitionException e = reject("""
                {"StartAt": "Fan", "States": {"Fan": {"Type": "Parallel", "End": true, "Branches": [
                  {"StartAt": "Ok", "States": {"Ok": {"Type": "Pass", "End": true}}},
                  {"StartAt": "Bad", "States": {"Bad": {"Type": "Pass", "Next": "Elsewhere"}}}
                ]}}}
                """);
            assertEquals("States.Fan.Branches[1].States.Bad", e.getLocation());
        }

        @Test
        void catchTargetOutsideProgram() {
            reject("""
                {"StartAt": "A", "States": {"A": {"Type": "Task", "Resource": "r", "End": true,
                  "Catch": [{"ErrorEquals": ["States.ALL"], "Next": "Gone"}]}}}
                """);
        }
    }

    @Test
    void validator_shouldAcceptWildcardAloneInLastRule() {
        Program program = parser.parse("""
            {"StartAt": "A", "States": {
              "A": {"Type": "Task", "Resource": "r", "End": true,
                "Retry": [{"ErrorEquals": ["Flaky"]}, {"ErrorEquals": ["States.ALL"], "MaxAttempts": 0}],
                "Catch": [{"ErrorEquals": ["States.ALL"], "Next": "B"}]},
              "B": {"Type": "Succeed"}}}
            """);

        assertEquals(List.of(ErrorNames.ALL), program.startState().retriers().get(1).errorEquals());
    }
}
