package com.stepflow.engine.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.InvalidStatusTransitionException;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.HistoryEvent;
import com.stepflow.core.model.Program;
import com.stepflow.engine.history.ExecutionHistory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One run of a program. Status, output and error are updated by the interpreter and read by
 * callers as point-in-time values.
 * 
 * Invariants:
 * - status follows {@link ExecutionStatus#canTransitionTo(ExecutionStatus)}
 * - output is set only when SUCCEEDED, error only when FAILED
 * - completion() completes exactly once, when the status becomes terminal
 */
public class Execution {

    private final ExecutionContext context;
    private final Program program;
    private final ExecutionHistory history;
    private final CancellationSignal cancellation;
    private final CompletableFuture<Execution> completion = new CompletableFuture<>();

    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private JsonNode output;
    private ExecutionError error;
    private Instant stopTime;

    Execution(ExecutionContext context, Program program, ExecutionHistory history, CancellationSignal cancellation) {
        this.context = context;
        this.program = program;
        this.history = history;
        this.cancellation = cancellation;
    }

    // ========== Queries ==========

    public String id() {
        return context.id();
    }

    public String name() {
        return context.name();
    }

    public Instant startTime() {
        return context.startTime();
    }

    public JsonNode input() {
        return context.input();
    }

    public Program program() {
        return program;
    }

    public synchronized ExecutionStatus status() {
        return status;
    }

    /**
     * @return The final output, or null unless SUCCEEDED
     */
    public synchronized JsonNode output() {
        return output;
    }

    /**
     * @return The terminal error, or null unless FAILED
     */
    public synchronized ExecutionError error() {
        return error;
    }

    public synchronized Instant stopTime() {
        return stopTime;
    }

    public synchronized boolean isFinished() {
        return status.isTerminal();
    }

    public List<HistoryEvent> history() {
        return history.snapshot();
    }

    /**
     * Future completed with this execution once it reaches a terminal status.
     * The returned future is a copy; completing it does not affect the execution.
     */
    public CompletableFuture<Execution> completion() {
        return completion.copy();
    }

    /**
     * Consistent view of status, output, error and history.
     */
    public synchronized Snapshot snapshot() {
        return new Snapshot(id(), name(), status, output, error, startTime(), stopTime, history.snapshot());
    }

    // ========== Control ==========

    /**
     * Request cancellation. The execution ends ABORTED once the interpreter observes it.
     * 
     * @return false if the execution had already finished or been cancelled
     */
    public boolean cancel() {
        if (isFinished()) {
            return false;
        }
        return cancellation.cancel(CancellationSignal.Reason.ABORTED);
    }

    // ========== Interpreter updates ==========

    ExecutionHistory historyLog() {
        return history;
    }

    CancellationSignal cancellation() {
        return cancellation;
    }

    ExecutionContext context() {
        return context;
    }

    /**
     * Move between RUNNING and SUSPENDED. Ignored once terminal, since a timer may race with
     * completion.
     */
    synchronized boolean markSuspended(boolean suspended) {
        ExecutionStatus target = suspended ? ExecutionStatus.SUSPENDED : ExecutionStatus.RUNNING;
        if (status.isTerminal() || status == target) {
            return false;
        }
        transitionTo(target);
        return true;
    }

    boolean succeed(JsonNode output, Instant now) {
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            transitionTo(ExecutionStatus.SUCCEEDED);
            this.output = output;
            this.stopTime = now;
        }
        completion.complete(this);
        return true;
    }

    boolean fail(ExecutionError error, Instant now) {
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            transitionTo(ExecutionStatus.FAILED);
            this.error = error;
            this.stopTime = now;
        }
        completion.complete(this);
        return true;
    }

    boolean abort(Instant now) {
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            transitionTo(ExecutionStatus.ABORTED);
            this.stopTime = now;
        }
        completion.complete(this);
        return true;
    }

    private void transitionTo(ExecutionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(status, target);
        }
        status = target;
    }

    @Override
    public String toString() {
        return "Execution{id=" + id() + ", name=" + name() + ", status=" + status() + "}";
    }

    /**
     * Point-in-time view of an execution.
     */
    public record Snapshot(
        String id,
        String name,
        ExecutionStatus status,
        JsonNode output,
        ExecutionError error,
        Instant startTime,
        Instant stopTime,
        List<HistoryEvent> history
    ) {
    }
}
