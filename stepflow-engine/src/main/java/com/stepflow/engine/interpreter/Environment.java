package com.stepflow.engine.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.model.Timestamps;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Mutable per-program evaluation context. Each Parallel branch and Map iteration works on its
 * own Environment forked from the parent, so siblings never share a document.
 * 
 * Invariants:
 * - the document is replaced wholesale by each stage, never mutated in place
 * - retry counters are reset whenever a state is entered
 * - only the thread currently driving the program touches the Environment
 */
public class Environment {

    private final ExecutionContext execution;
    private final CancellationSignal cancellation;
    private final Integer mapItemIndex;
    private final JsonNode mapItemValue;

    private JsonNode document;
    private String stateName;
    private Instant enteredTime;
    private final Map<Integer, Integer> retryCounters = new HashMap<>();

    public Environment(ExecutionContext execution, CancellationSignal cancellation, JsonNode document) {
        this(execution, cancellation, document, null, null);
    }

    private Environment(
        ExecutionContext execution,
        CancellationSignal cancellation,
        JsonNode document,
        Integer mapItemIndex,
        JsonNode mapItemValue
    ) {
        this.execution = execution;
        this.cancellation = cancellation;
        this.document = document;
        this.mapItemIndex = mapItemIndex;
        this.mapItemValue = mapItemValue;
    }

    // ========== Forking ==========

    /**
     * Environment for a Parallel branch: a deep copy of the input and a child signal.
     */
    public Environment fork(JsonNode input) {
        return new Environment(execution, cancellation.child(), copy(input), mapItemIndex, mapItemValue);
    }

    /**
     * Environment for one Map iteration. The input is set once the item selector is resolved.
     */
    public Environment forkIteration(int index, JsonNode item) {
        return new Environment(execution, cancellation.child(), copy(item), index, item);
    }

    // ========== State tracking ==========

    public void enterState(String name, Instant now) {
        this.stateName = name;
        this.enteredTime = now;
        retryCounters.clear();
    }

    /**
     * Retries already made by the Retrier at the given position of the current state.
     */
    public int retriesMade(int retrierIndex) {
        return retryCounters.getOrDefault(retrierIndex, 0);
    }

    /**
     * Record one more retry by the Retrier at the given position.
     * 
     * @return The 1-indexed retry number
     */
    public int incrementRetry(int retrierIndex) {
        return retryCounters.merge(retrierIndex, 1, Integer::sum);
    }

    /**
     * Total retries made in the current state, across all of its Retriers.
     */
    public int retryCount() {
        return retryCounters.values().stream().mapToInt(Integer::intValue).sum();
    }

    // ========== Context object ==========

    /**
     * Build the read-only document addressed by {@code $$} paths.
     */
    public JsonNode contextObject() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();

        ObjectNode executionNode = root.putObject("Execution");
        executionNode.put("Id", execution.id());
        executionNode.put("Name", execution.name());
        executionNode.set("Input", execution.input());
        executionNode.put("StartTime", Timestamps.format(execution.startTime()));

        ObjectNode state = root.putObject("State");
        state.put("Name", stateName);
        if (enteredTime != null) {
            state.put("EnteredTime", Timestamps.format(enteredTime));
        }
        state.put("RetryCount", retryCount());

        if (mapItemIndex != null) {
            ObjectNode item = root.putObject("Map").putObject("Item");
            item.put("Index", mapItemIndex);
            item.set("Value", mapItemValue);
        }
        return root;
    }

    // ========== Accessors ==========

    public JsonNode document() {
        return document;
    }

    public void setDocument(JsonNode document) {
        this.document = document;
    }

    public String stateName() {
        return stateName;
    }

    public Instant enteredTime() {
        return enteredTime;
    }

    public ExecutionContext execution() {
        return execution;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    public Integer mapItemIndex() {
        return mapItemIndex;
    }

    private static JsonNode copy(JsonNode node) {
        return node != null ? node.deepCopy() : JsonNodeFactory.instance.objectNode();
    }
}
