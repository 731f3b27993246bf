package com.stepflow.core.model.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.model.Program;

/**
 * Map attributes.
 * 
 * Invariants:
 * - iterator is a valid program
 * - maxConcurrency, when declared, is >= 0; 0 means the engine default bound
 */
public record MapSpec(
    Program iterator,
    String itemsPath,
    Integer maxConcurrency,
    JsonNode itemSelector
) implements StateSpec {

    public String effectiveItemsPath() {
        return itemsPath != null ? itemsPath : "$";
    }
}
