package com.stepflow.core.model.state;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pass attributes. A declared Result replaces the effective input as the state's result.
 */
public record PassSpec(JsonNode result) implements StateSpec {

    public boolean hasResult() {
        return result != null;
    }
}
