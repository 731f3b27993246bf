package com.stepflow.engine.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.model.HistoryEvent;
import com.stepflow.core.model.HistoryEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Append-only event log of one execution, shared by all of its branches.
 * 
 * Invariants:
 * - sequence numbers start at 1 and increase by one per event
 * - events are never modified or removed
 * - reads return point-in-time snapshots
 */
public class ExecutionHistory {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHistory.class);

    private final String executionId;
    private final Supplier<Instant> clock;
    private final List<HistoryListener> listeners;
    private final List<HistoryEvent> events = new ArrayList<>();

    public ExecutionHistory(String executionId, Supplier<Instant> clock, List<HistoryListener> listeners) {
        this.executionId = executionId;
        this.clock = clock;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Append an event and notify listeners.
     * 
     * @param stateName State the event belongs to, or null for execution-level events
     */
    public HistoryEvent record(HistoryEventType type, String stateName, JsonNode details) {
        HistoryEvent event;
        synchronized (events) {
            event = new HistoryEvent(events.size() + 1L, type, clock.get(), stateName, details);
            events.add(event);
        }
        for (HistoryListener listener : listeners) {
            try {
                listener.onEvent(executionId, event);
            } catch (RuntimeException e) {
                log.warn("History listener failed on event {} of execution {}", event.sequenceNumber(), executionId, e);
            }
        }
        return event;
    }

    /**
     * Get all events recorded so far.
     */
    public List<HistoryEvent> snapshot() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public List<HistoryEvent> eventsOfType(HistoryEventType type) {
        return snapshot().stream()
            .filter(e -> e.type() == type)
            .toList();
    }

    public Optional<HistoryEvent> lastEvent() {
        synchronized (events) {
            return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
        }
    }

    public int size() {
        synchronized (events) {
            return events.size();
        }
    }

    public String executionId() {
        return executionId;
    }
}
