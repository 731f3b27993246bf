package com.stepflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionErrorTest {

    @Test
    void matches_wildcard_shouldMatchEveryError() {
        assertTrue(ExecutionError.runtime("boom").matches(List.of(ErrorNames.ALL)));
        assertTrue(new ExecutionError("Custom", null).matches(List.of(ErrorNames.ALL)));
    }

    @Test
    void matches_byName_shouldRequireExactName() {
        ExecutionError error = ExecutionError.taskFailed("worker crashed");

        assertTrue(error.matches(List.of("Other", ErrorNames.TASK_FAILED)));
        assertFalse(error.matches(List.of("States.Task")));
    }

    @Test
    void matches_branchFailure_shouldMatchBranchFailedAndOriginalName() {
        ExecutionError error = new ExecutionError("PaymentDeclined", "card expired").asBranchFailure();

        assertTrue(error.branchFailure());
        assertTrue(error.matches(List.of(ErrorNames.BRANCH_FAILED)));
        assertTrue(error.matches(List.of("PaymentDeclined")));
        assertFalse(new ExecutionError("PaymentDeclined", "x").matches(List.of(ErrorNames.BRANCH_FAILED)));
    }

    @Test
    void toJson_shouldProduceErrorAndCause() {
        JsonNode json = new ExecutionError("Flaky", "try again").toJson();

        assertEquals("Flaky", json.get("Error").asText());
        assertEquals("try again", json.get("Cause").asText());
    }

    @Test
    void factories_shouldUsePredefinedNames() {
        assertEquals(ErrorNames.RUNTIME, ExecutionError.runtime("x").error());
        assertEquals(ErrorNames.NO_CHOICE_MATCHED, ExecutionError.noChoiceMatched("x").error());
        assertEquals(ErrorNames.TIMEOUT, ExecutionError.timeout("x").error());
        assertEquals(ErrorNames.HEARTBEAT_TIMEOUT, ExecutionError.heartbeatTimeout("x").error());
        assertTrue(ErrorNames.isPredefined(ErrorNames.BRANCH_FAILED));
        assertTrue(ErrorNames.isReserved("States.Anything"));
        assertFalse(ErrorNames.isReserved("MyError"));
    }
}
