package com.stepflow.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures interpreter logs carry the execution and state they belong to, even though an
 * execution hops between worker and timer threads.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forExecution(executionId, executionName)) {
 *     LoggingContext.setState("Charge", 1);
 *     log.info("Invoking resource"); // Automatically includes executionId, stateName
 * }
 * </pre>
 *
 * Closing a context restores the values the keys had when it was opened.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String EXECUTION_NAME = "executionName";
    public static final String STATE_NAME = "stateName";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private static final String[] KEYS = {EXECUTION_ID, EXECUTION_NAME, STATE_NAME, ATTEMPT};

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LoggingContext() {
        for (String key : KEYS) {
            previous.put(key, MDC.get(key));
        }
    }

    /**
     * Create a logging context for execution-level operations.
     */
    public static LoggingContext forExecution(String executionId, String executionName) {
        LoggingContext ctx = new LoggingContext();
        if (executionId != null) {
            MDC.put(EXECUTION_ID, executionId);
        }
        if (executionName != null && !executionName.equals(executionId)) {
            MDC.put(EXECUTION_NAME, executionName);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one state of an execution.
     */
    public static LoggingContext forState(String executionId, String stateName, int attempt) {
        LoggingContext ctx = forExecution(executionId, null);
        setState(stateName, attempt);
        return ctx;
    }

    /**
     * Set the current state in the active context.
     */
    public static void setState(String stateName, int attempt) {
        if (stateName != null) {
            MDC.put(STATE_NAME, stateName);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    /**
     * Get current execution ID from context.
     */
    public static String getExecutionId() {
        return MDC.get(EXECUTION_ID);
    }

    public static String getStateName() {
        return MDC.get(STATE_NAME);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
