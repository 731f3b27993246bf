package com.stepflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Immutable record of something that happened during an execution.
 * 
 * Invariants:
 * - sequenceNumber is contiguous within an execution, starting at 1
 * - Events are never modified once appended
 */
public record HistoryEvent(
    long sequenceNumber,
    HistoryEventType type,
    Instant timestamp,
    
    // Null for execution-level events
    String stateName,
    
    // Input/output snapshot, error, delay... depending on the type
    JsonNode details
) {
    /**
     * Check if this event is an execution lifecycle event.
     */
    public boolean isExecutionEvent() {
        return type.name().startsWith("EXECUTION_");
    }

    /**
     * Check if this event belongs to a Map iteration.
     */
    public boolean isMapEvent() {
        return type.name().startsWith("MAP_");
    }
}
