package com.stepflow.engine.metrics;

import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.StateType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the interpreter.
 * 
 * Metrics exposed:
 * - Execution counts by outcome and duration
 * - Executions in flight
 * - State transitions by state type
 * - Retry and catch counts by error name
 * - Task latency by resource
 */
public class ExecutionMetrics implements MeterBinder {

    // Metric names
    public static final String EXECUTIONS_STARTED = "stepflow.executions.started";
    public static final String EXECUTIONS_FINISHED = "stepflow.executions.finished";
    public static final String EXECUTIONS_ACTIVE = "stepflow.executions.active";
    public static final String EXECUTION_DURATION = "stepflow.execution.duration";

    public static final String STATE_TRANSITIONS = "stepflow.state.transitions";
    public static final String RETRIES = "stepflow.retries";
    public static final String ERRORS_CAUGHT = "stepflow.errors.caught";
    public static final String TASK_DURATION = "stepflow.task.duration";

    private MeterRegistry registry;
    private final AtomicInteger activeExecutions = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(EXECUTIONS_ACTIVE, activeExecutions, AtomicInteger::get)
            .description("Executions started and not yet finished")
            .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Execution Metrics ==========

    public void executionStarted() {
        Counter.builder(EXECUTIONS_STARTED)
            .description("Total executions started")
            .register(registry)
            .increment();

        activeExecutions.incrementAndGet();
    }

    public void executionFinished(ExecutionStatus status, Duration duration) {
        String outcome = status.name().toLowerCase();
        Counter.builder(EXECUTIONS_FINISHED)
            .tag("status", outcome)
            .description("Total executions finished")
            .register(registry)
            .increment();

        Timer.builder(EXECUTION_DURATION)
            .tag("status", outcome)
            .description("Execution duration")
            .register(registry)
            .record(duration);

        activeExecutions.updateAndGet(v -> Math.max(0, v - 1));
    }

    public int activeExecutions() {
        return activeExecutions.get();
    }

    // ========== State Metrics ==========

    public void stateEntered(StateType type) {
        Counter.builder(STATE_TRANSITIONS)
            .tag("type", type.jsonName())
            .description("Total states entered")
            .register(registry)
            .increment();
    }

    public void retryScheduled(String errorName, int attemptNumber) {
        Counter.builder(RETRIES)
            .tag("error", sanitize(errorName))
            .tag("attempt", String.valueOf(attemptNumber))
            .description("Total retries scheduled")
            .register(registry)
            .increment();
    }

    public void errorCaught(String errorName) {
        Counter.builder(ERRORS_CAUGHT)
            .tag("error", sanitize(errorName))
            .description("Total errors routed by a Catch rule")
            .register(registry)
            .increment();
    }

    // ========== Task Metrics ==========

    public void taskCompleted(String resource, Duration duration, boolean success) {
        Timer.builder(TASK_DURATION)
            .tag("resource", resource)
            .tag("outcome", success ? "success" : "failure")
            .description("Task invocation duration")
            .register(registry)
            .record(duration);
    }

    /**
     * Error names are user-defined; keep them usable as tag values.
     */
    private String sanitize(String errorName) {
        if (errorName == null || errorName.isBlank()) {
            return "unspecified";
        }
        return errorName.length() > 50 ? errorName.substring(0, 50) : errorName;
    }
}
