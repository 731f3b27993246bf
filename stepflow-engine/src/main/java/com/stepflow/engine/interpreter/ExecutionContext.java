package com.stepflow.engine.interpreter;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Execution-wide facts exposed to paths through {@code $$.Execution}.
 */
public record ExecutionContext(
    String id,
    String name,
    Instant startTime,
    JsonNode input
) {
}
