package com.stepflow.engine.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.model.HistoryEventType;
import com.stepflow.core.model.Program;
import com.stepflow.core.model.State;
import com.stepflow.core.model.state.MapSpec;
import com.stepflow.core.model.state.ParallelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs the sub-programs of Parallel and Map states.
 * 
 * Invariants:
 * - outputs are collected in branch / item order, whatever the completion order
 * - the first failing child fails the whole state and cancels its siblings
 * - every child works on its own Environment with a child cancellation signal
 */
final class BranchRunner {

    private static final Logger log = LoggerFactory.getLogger(BranchRunner.class);

    private final InterpreterServices services;
    private final Execution execution;

    BranchRunner(InterpreterServices services, Execution execution) {
        this.services = services;
        this.execution = execution;
    }

    // ========== Parallel ==========

    CompletableFuture<JsonNode> runParallel(State state, JsonNode input, Environment parent) {
        List<Program> branches = state.spec(ParallelSpec.class).branches();
        CompletableFuture<JsonNode> aggregate = new CompletableFuture<>();
        AtomicReferenceArray<JsonNode> outputs = new AtomicReferenceArray<>(branches.size());
        AtomicInteger remaining = new AtomicInteger(branches.size());

        List<Environment> children = new ArrayList<>(branches.size());
        for (int i = 0; i < branches.size(); i++) {
            children.add(parent.fork(input));
        }
        record(state, HistoryEventType.PARALLEL_STARTED, details().put("branches", branches.size()));
        aggregate.whenComplete((value, failure) -> {
            children.forEach(child -> child.cancellation().detach());
            record(state, failure == null ? HistoryEventType.PARALLEL_SUCCEEDED : HistoryEventType.PARALLEL_FAILED, details());
        });

        for (int i = 0; i < branches.size() && !aggregate.isDone(); i++) {
            int index = i;
            new ProgramRunner(services, branches.get(i), children.get(i), execution, false).run()
                .whenComplete((output, failure) -> {
                    if (failure == null) {
                        outputs.set(index, output);
                        if (remaining.decrementAndGet() == 0) {
                            aggregate.complete(toArray(outputs));
                        }
                    } else {
                        settleFailure(state, aggregate, failure, children);
                    }
                });
        }
        return aggregate;
    }

    // ========== Map ==========

    CompletableFuture<JsonNode> runMap(State state, JsonNode input, Environment parent) {
        MapSpec spec = state.spec(MapSpec.class);
        String itemsPath = spec.effectiveItemsPath();
        JsonNode items = services.pipeline().paths().first(itemsPath, input, parent)
            .filter(JsonNode::isArray)
            .orElseThrow(() -> new StatesRuntimeException(ExecutionError.runtime(String.format(
                "Invalid path '%s' in ItemsPath: the path must select an array", itemsPath))));

        int bound = spec.maxConcurrency() != null && spec.maxConcurrency() > 0
            ? spec.maxConcurrency()
            : services.defaultMapConcurrency();
        record(state, HistoryEventType.MAP_STARTED, details()
            .put("items", items.size())
            .put("maxConcurrency", bound));

        if (items.isEmpty()) {
            record(state, HistoryEventType.MAP_SUCCEEDED, details());
            return CompletableFuture.completedFuture(services.objectMapper().createArrayNode());
        }

        MapRun run = new MapRun(state, spec, items, input, parent, bound);
        run.pump();
        return run.aggregate;
    }

    /**
     * Launches iterations while fewer than {@code bound} are in flight.
     * Pumping is serialized by a work counter, so completions that arrive while launching
     * loop here instead of recursing.
     */
    private final class MapRun {

        private final State state;
        private final MapSpec spec;
        private final JsonNode items;
        private final JsonNode input;
        private final Environment parent;
        private final int bound;

        private final CompletableFuture<JsonNode> aggregate = new CompletableFuture<>();
        private final AtomicReferenceArray<JsonNode> outputs;
        private final AtomicInteger remaining;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger pumping = new AtomicInteger();
        private final List<Environment> children = new ArrayList<>();

        // Only touched by the thread holding the pump
        private int nextIndex;

        MapRun(State state, MapSpec spec, JsonNode items, JsonNode input, Environment parent, int bound) {
            this.state = state;
            this.spec = spec;
            this.items = items;
            this.input = input;
            this.parent = parent;
            this.bound = bound;
            this.outputs = new AtomicReferenceArray<>(items.size());
            this.remaining = new AtomicInteger(items.size());
            aggregate.whenComplete((value, failure) -> {
                synchronized (children) {
                    children.forEach(child -> child.cancellation().detach());
                }
                record(state, failure == null ? HistoryEventType.MAP_SUCCEEDED : HistoryEventType.MAP_FAILED, details());
            });
        }

        void pump() {
            if (pumping.getAndIncrement() > 0) {
                return;
            }
            do {
                while (!aggregate.isDone() && nextIndex < items.size() && inFlight.get() < bound) {
                    inFlight.incrementAndGet();
                    launch(nextIndex++);
                }
            } while (pumping.decrementAndGet() > 0);
        }

        private void launch(int index) {
            JsonNode item = items.get(index);
            Environment child = parent.forkIteration(index, item);
            synchronized (children) {
                children.add(child);
            }
            if (spec.itemSelector() != null) {
                try {
                    child.setDocument(services.pipeline().resolveTemplate(spec.itemSelector(), input, child));
                } catch (StatesRuntimeException e) {
                    iterationFailed(index, e);
                    return;
                }
            }

            record(state, HistoryEventType.MAP_ITERATION_STARTED, details().put("index", index));
            new ProgramRunner(services, spec.iterator(), child, execution, false).run()
                .whenComplete((output, failure) -> {
                    if (failure != null) {
                        iterationFailed(index, failure);
                        return;
                    }
                    outputs.set(index, output);
                    record(state, HistoryEventType.MAP_ITERATION_SUCCEEDED, details().put("index", index));
                    if (remaining.decrementAndGet() == 0) {
                        aggregate.complete(toArray(outputs));
                    } else {
                        inFlight.decrementAndGet();
                        pump();
                    }
                });
        }

        private void iterationFailed(int index, Throwable failure) {
            if (ProgramRunner.unwrap(failure) instanceof StatesRuntimeException sre) {
                ObjectNode details = details().put("index", index)
                    .put("error", sre.getError().error())
                    .put("cause", sre.getError().cause());
                record(state, HistoryEventType.MAP_ITERATION_FAILED, details);
            }
            List<Environment> snapshot;
            synchronized (children) {
                snapshot = new ArrayList<>(children);
            }
            settleFailure(state, aggregate, failure, snapshot);
        }
    }

    // ========== Helpers ==========

    /**
     * Fail the aggregate with the first child error and cancel the remaining children.
     * Cancellations of children only reach the aggregate when the parent itself was
     * cancelled; otherwise the aggregate is already complete and they are ignored.
     */
    private void settleFailure(
        State state,
        CompletableFuture<JsonNode> aggregate,
        Throwable failure,
        List<Environment> children
    ) {
        Throwable cause = ProgramRunner.unwrap(failure);
        if (cause instanceof CancellationException) {
            aggregate.completeExceptionally(cause);
            return;
        }
        ExecutionError error = cause instanceof StatesRuntimeException sre
            ? sre.getError()
            : ExecutionError.runtime(String.valueOf(cause));
        if (aggregate.completeExceptionally(new StatesRuntimeException(error.asBranchFailure()))) {
            log.info("{} state {} failed with {}, cancelling remaining branches",
                state.type().jsonName(), state.name(), error.error());
            children.forEach(child -> child.cancellation().cancel(CancellationSignal.Reason.ABORTED));
        }
    }

    private ArrayNode toArray(AtomicReferenceArray<JsonNode> outputs) {
        ArrayNode array = services.objectMapper().createArrayNode();
        for (int i = 0; i < outputs.length(); i++) {
            array.add(outputs.get(i));
        }
        return array;
    }

    private void record(State state, HistoryEventType type, JsonNode details) {
        execution.historyLog().record(type, state.name(), details);
    }

    private ObjectNode details() {
        return services.objectMapper().createObjectNode();
    }
}
