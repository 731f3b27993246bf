package com.stepflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;

/**
 * Context of one resource invocation made by a Task state.
 */
public class InvocationContext {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();
    
    private final String resource;
    private final JsonNode input;
    private final String executionId;
    private final String stateName;
    private final int attemptNumber;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final HeartbeatCallback heartbeatCallback;
    
    private InvocationContext(Builder builder) {
        this.resource = builder.resource;
        this.input = builder.input;
        this.executionId = builder.executionId;
        this.stateName = builder.stateName;
        this.attemptNumber = builder.attemptNumber;
        this.timeout = builder.timeout;
        this.objectMapper = builder.objectMapper;
        this.heartbeatCallback = builder.heartbeatCallback;
    }
    
    /**
     * Get the resource identifier declared by the Task.
     */
    public String getResource() {
        return resource;
    }
    
    /**
     * Get the effective input of the Task (after InputPath and Parameters).
     */
    public JsonNode getInput() {
        return input;
    }
    
    /**
     * Get the input as a specific type.
     */
    public <T> T getInput(Class<T> type) {
        return objectMapper.convertValue(input, type);
    }
    
    public String getExecutionId() {
        return executionId;
    }
    
    public String getStateName() {
        return stateName;
    }
    
    /**
     * Get the attempt number, 1 for the first invocation and incremented by each retry.
     */
    public int getAttemptNumber() {
        return attemptNumber;
    }
    
    /**
     * Get the time the interpreter waits for a result before failing with {@code States.Timeout}.
     */
    public Duration getTimeout() {
        return timeout;
    }
    
    /**
     * Get a key identifying this invocation across retries of the same state visit.
     * Use this when making external calls that must not be applied twice.
     */
    public String getIdempotencyKey() {
        return executionId + ":" + stateName + ":" + attemptNumber;
    }
    
    /**
     * Report progress. Tasks declaring HeartbeatSeconds fail with
     * {@code States.HeartbeatTimeout} if no heartbeat arrives in time.
     * 
     * @return true if the result is still awaited, false if the invocation timed out or was cancelled
     */
    public boolean heartbeat() {
        return heartbeatCallback.sendHeartbeat();
    }
    
    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
    
    /**
     * Callback for heartbeats.
     */
    @FunctionalInterface
    public interface HeartbeatCallback {
        boolean sendHeartbeat();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String resource;
        private JsonNode input;
        private String executionId;
        private String stateName;
        private int attemptNumber = 1;
        private Duration timeout;
        private ObjectMapper objectMapper = DEFAULT_MAPPER;
        private HeartbeatCallback heartbeatCallback = () -> true;

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder input(JsonNode input) {
            this.input = input;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder stateName(String stateName) {
            this.stateName = stateName;
            return this;
        }

        public Builder attemptNumber(int attemptNumber) {
            this.attemptNumber = attemptNumber;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder heartbeatCallback(HeartbeatCallback heartbeatCallback) {
            this.heartbeatCallback = heartbeatCallback;
            return this;
        }

        public InvocationContext build() {
            return new InvocationContext(this);
        }
    }
}
