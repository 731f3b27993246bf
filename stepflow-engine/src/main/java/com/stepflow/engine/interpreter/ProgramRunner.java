package com.stepflow.engine.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ErrorNames;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.model.HistoryEventType;
import com.stepflow.core.model.Program;
import com.stepflow.core.model.State;
import com.stepflow.core.model.Timestamps;
import com.stepflow.core.model.state.ChoiceSpec;
import com.stepflow.core.model.state.FailSpec;
import com.stepflow.core.model.state.PassSpec;
import com.stepflow.core.model.state.TaskSpec;
import com.stepflow.core.model.state.WaitSpec;
import com.stepflow.engine.logging.LoggingContext;
import com.stepflow.engine.recovery.RecoveryDecision;
import com.stepflow.engine.wait.WakeUp;
import com.stepflow.scheduler.TimerHandle;
import com.stepflow.worker.InvocationContext;
import com.stepflow.worker.ResourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Drives one program (the top level of an execution, a Parallel branch or a Map iteration)
 * from its StartAt state to a terminal state.
 * 
 * Synchronous states are processed in a loop on the current thread. At every asynchronous
 * boundary (Task, Wait, Retry backoff, Parallel, Map) the runner registers a continuation and
 * returns; the continuation resumes the loop on the worker executor.
 * 
 * The result future completes:
 * - normally with the program output
 * - exceptionally with {@link StatesRuntimeException} carrying the unrecovered error
 * - exceptionally with {@link CancellationException} when the Environment's signal is cancelled
 */
final class ProgramRunner {

    private static final Logger log = LoggerFactory.getLogger(ProgramRunner.class);

    private final InterpreterServices services;
    private final Program program;
    private final Environment env;
    private final Execution execution;
    private final boolean topLevel;
    private final CompletableFuture<JsonNode> result = new CompletableFuture<>();

    ProgramRunner(InterpreterServices services, Program program, Environment env, Execution execution, boolean topLevel) {
        this.services = services;
        this.program = program;
        this.env = env;
        this.execution = execution;
        this.topLevel = topLevel;
    }

    CompletableFuture<JsonNode> run() {
        dispatch(program::startAt);
        return result;
    }

    // ========== Loop ==========

    /**
     * Run one step, then keep entering states until the program ends or hits an
     * asynchronous boundary. A step returns the next state to enter, or null to stop.
     */
    private void drive(Supplier<String> step) {
        try (LoggingContext ignored = LoggingContext.forExecution(execution.id(), execution.name())) {
            String current = step.get();
            while (current != null && !result.isDone()) {
                if (env.cancellation().isCancelled()) {
                    abort();
                    return;
                }
                current = enter(program.state(current));
            }
        } catch (RuntimeException e) {
            log.error("Unexpected interpreter failure in state {}", env.stateName(), e);
            result.completeExceptionally(new StatesRuntimeException(
                ExecutionError.runtime("Unexpected interpreter failure: " + e)));
        }
    }

    private void dispatch(Supplier<String> step) {
        try {
            services.executor().execute(() -> drive(step));
        } catch (RejectedExecutionException e) {
            if (env.cancellation().isCancelled()) {
                abort();
            } else {
                log.warn("Worker executor rejected execution {}", execution.id());
                result.completeExceptionally(new StatesRuntimeException(
                    ExecutionError.runtime("Worker executor rejected the continuation: " + e.getMessage())));
            }
        }
    }

    private String enter(State state) {
        env.enterState(state.name(), now());
        LoggingContext.setState(state.name(), 1);
        services.metrics().stateEntered(state.type());
        ObjectNode details = details();
        details.set("input", env.document());
        record(HistoryEventType.STATE_ENTERED, details);
        log.debug("Entering {} state {}", state.type().jsonName(), state.name());
        return attempt(state);
    }

    /**
     * Evaluate the state against its (unchanged) raw input. Re-run on every retry.
     */
    private String attempt(State state) {
        JsonNode raw = env.document();
        try {
            JsonNode input = services.pipeline().prepareInput(state, raw, env);
            return execute(state, raw, input);
        } catch (StatesRuntimeException e) {
            return recover(state, e.getError());
        }
    }

    private String execute(State state, JsonNode raw, JsonNode input) {
        return switch (state.type()) {
            case PASS -> {
                PassSpec pass = state.spec(PassSpec.class);
                yield complete(state, raw, pass.hasResult() ? pass.result().deepCopy() : input, state.next());
            }
            case TASK -> await(state, raw, invokeTask(state, input), state.next());
            case WAIT -> {
                WakeUp wakeUp = services.waits().resolve(state.spec(WaitSpec.class), input, env);
                Instant wakeAt = wakeUp.wakeTime(now());
                record(HistoryEventType.WAIT_SCHEDULED, details().put("wakeTime", Timestamps.format(wakeAt)));
                yield suspend(wakeAt, () -> complete(state, raw, input, state.next()));
            }
            case CHOICE -> {
                String target = services.choices().select(state.spec(ChoiceSpec.class), input, env);
                record(HistoryEventType.CHOICE_SELECTED, details().put("next", target));
                yield complete(state, raw, input, target);
            }
            case SUCCEED -> complete(state, raw, input, null);
            case FAIL -> {
                FailSpec fail = state.spec(FailSpec.class);
                ExecutionError error = new ExecutionError(fail.error(), fail.cause());
                record(HistoryEventType.STATE_FAILED, errorDetails(error));
                yield failProgram(error);
            }
            case PARALLEL -> await(state, raw, branches().runParallel(state, input, env), state.next());
            case MAP -> await(state, raw, branches().runMap(state, input, env), state.next());
        };
    }

    /**
     * Apply ResultPath and OutputPath, then either end the program or name the next state.
     */
    private String complete(State state, JsonNode raw, JsonNode stateResult, String next) {
        JsonNode output;
        try {
            output = services.pipeline().applyOutput(state, raw, stateResult, env);
        } catch (StatesRuntimeException e) {
            return recover(state, e.getError());
        }
        env.setDocument(output);
        ObjectNode details = details();
        details.set("output", output);
        record(HistoryEventType.STATE_EXITED, details);

        if (state.isTerminal()) {
            result.complete(output);
            return null;
        }
        return next;
    }

    // ========== Recovery ==========

    private String recover(State state, ExecutionError error) {
        record(HistoryEventType.STATE_FAILED, errorDetails(error));
        if (!state.type().supportsRecovery()) {
            return failProgram(error);
        }

        RecoveryDecision decision = services.recovery().resolve(state, error, env);
        return switch (decision.action()) {
            case RETRY -> {
                services.metrics().retryScheduled(error.error(), decision.attemptNumber());
                record(HistoryEventType.RETRY_SCHEDULED, errorDetails(error)
                    .put("attempt", decision.attemptNumber())
                    .put("delayMillis", decision.delay().toMillis()));
                log.warn("State {} failed with {}, retry {} in {} ms",
                    state.name(), error.error(), decision.attemptNumber(), decision.delay().toMillis());
                yield suspend(now().plus(decision.delay()), () -> {
                    LoggingContext.setState(state.name(), env.retryCount() + 1);
                    return attempt(state);
                });
            }
            case CATCH -> {
                String target = decision.catcher().next();
                JsonNode caught;
                try {
                    caught = services.pipeline().applyCatcher(decision.catcher(), env.document(), error);
                } catch (StatesRuntimeException e) {
                    yield failProgram(e.getError());
                }
                services.metrics().errorCaught(error.error());
                env.setDocument(caught);
                record(HistoryEventType.ERROR_CAUGHT, errorDetails(error).put("next", target));
                log.warn("State {} failed with {}, continuing at {}", state.name(), error.error(), target);
                yield target;
            }
            case PROPAGATE -> failProgram(error);
        };
    }

    private String failProgram(ExecutionError error) {
        log.debug("Program ends with error {}: {}", error.error(), error.cause());
        result.completeExceptionally(new StatesRuntimeException(error));
        return null;
    }

    private void abort() {
        result.completeExceptionally(new CancellationException(
            "Execution " + execution.id() + " cancelled: " + env.cancellation().reason()));
    }

    // ========== Asynchronous boundaries ==========

    /**
     * Continue with the outcome of a pending future. Already-completed futures are handled
     * inline, so synchronous resources do not leave the loop.
     */
    private String await(State state, JsonNode raw, CompletableFuture<JsonNode> pending, String next) {
        if (pending.isDone()) {
            return resume(state, raw, pending, next);
        }
        CancellationSignal.Registration registration = env.cancellation().onCancel(
            () -> pending.completeExceptionally(new CancellationException("Execution cancelled")));
        pending.whenComplete((value, failure) -> {
            registration.remove();
            dispatch(() -> resume(state, raw, pending, next));
        });
        return null;
    }

    private String resume(State state, JsonNode raw, CompletableFuture<JsonNode> done, String next) {
        if (env.cancellation().isCancelled()) {
            abort();
            return null;
        }
        JsonNode value;
        try {
            value = done.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof StatesRuntimeException sre) {
                return recover(state, sre.getError());
            }
            if (cause instanceof CancellationException) {
                abort();
                return null;
            }
            log.error("State {} failed unexpectedly", state.name(), cause);
            return recover(state, ExecutionError.runtime(String.valueOf(cause)));
        }
        return complete(state, raw, value, next);
    }

    /**
     * Resume the loop at the given instant through the timer service. Cancellation wakes the
     * runner early so it can abort.
     */
    private String suspend(Instant wakeAt, Supplier<String> continuation) {
        if (!wakeAt.isAfter(now())) {
            return continuation.get();
        }
        if (topLevel) {
            execution.markSuspended(true);
        }

        AtomicBoolean resumed = new AtomicBoolean();
        AtomicReference<CancellationSignal.Registration> registration = new AtomicReference<>();
        Runnable wake = () -> {
            if (!resumed.compareAndSet(false, true)) {
                return;
            }
            CancellationSignal.Registration r = registration.getAndSet(null);
            if (r != null) {
                r.remove();
            }
            dispatch(() -> {
                if (env.cancellation().isCancelled()) {
                    abort();
                    return null;
                }
                if (topLevel) {
                    execution.markSuspended(false);
                }
                record(HistoryEventType.TIMER_FIRED, details());
                return continuation.get();
            });
        };

        TimerHandle timer = services.timers().schedule(wakeAt, wake);
        registration.set(env.cancellation().onCancel(() -> {
            timer.cancel();
            wake.run();
        }));
        if (resumed.get()) {
            CancellationSignal.Registration r = registration.getAndSet(null);
            if (r != null) {
                r.remove();
            }
        }
        return null;
    }

    // ========== Task ==========

    private CompletableFuture<JsonNode> invokeTask(State state, JsonNode input) {
        TaskSpec spec = state.spec(TaskSpec.class);
        String resource = spec.resource();
        int timeoutSeconds = spec.timeoutSeconds() != null ? spec.timeoutSeconds() : services.defaultTaskTimeoutSeconds();
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        int attemptNumber = env.retryCount() + 1;
        Instant started = now();

        CompletableFuture<JsonNode> outcome = new CompletableFuture<>();
        TimerHandle timeoutTimer = services.timers().scheduleAfter(timeout, () -> outcome.completeExceptionally(
            new StatesRuntimeException(ExecutionError.timeout(String.format(
                "Task '%s' did not complete within %d seconds", state.name(), timeoutSeconds)))));
        HeartbeatMonitor heartbeats = spec.heartbeatSeconds() != null
            ? new HeartbeatMonitor(state.name(), Duration.ofSeconds(spec.heartbeatSeconds()), outcome)
            : null;
        if (heartbeats != null) {
            heartbeats.arm();
        }
        CancellationSignal.Registration cancellation = env.cancellation().onCancel(
            () -> outcome.completeExceptionally(new CancellationException("Execution cancelled")));

        InvocationContext context = InvocationContext.builder()
            .resource(resource)
            .input(input)
            .executionId(execution.id())
            .stateName(state.name())
            .attemptNumber(attemptNumber)
            .timeout(timeout)
            .objectMapper(services.objectMapper())
            .heartbeatCallback(() -> {
                if (outcome.isDone()) {
                    return false;
                }
                if (heartbeats != null) {
                    heartbeats.arm();
                }
                return true;
            })
            .build();

        ObjectNode scheduled = details()
            .put("resource", resource)
            .put("attempt", attemptNumber);
        scheduled.set("input", input);
        record(HistoryEventType.TASK_SCHEDULED, scheduled);
        log.debug("Invoking resource {} (attempt {})", resource, attemptNumber);

        try {
            services.invoker().invoke(context).whenComplete((value, failure) -> {
                if (failure == null) {
                    outcome.complete(value != null ? value : NullNode.getInstance());
                } else {
                    outcome.completeExceptionally(new StatesRuntimeException(toError(resource, failure)));
                }
            });
        } catch (RuntimeException e) {
            outcome.completeExceptionally(new StatesRuntimeException(toError(resource, e)));
        }

        // The returned stage completes only after the bookkeeping below has run
        return outcome.whenComplete((value, failure) -> {
            timeoutTimer.cancel();
            cancellation.remove();
            if (heartbeats != null) {
                heartbeats.disarm();
            }
            services.metrics().taskCompleted(resource, Duration.between(started, now()), failure == null);
            recordTaskOutcome(state, value, failure);
        });
    }

    private void recordTaskOutcome(State state, JsonNode value, Throwable failure) {
        if (failure == null) {
            ObjectNode details = details();
            details.set("output", value);
            record(HistoryEventType.TASK_SUCCEEDED, details);
            return;
        }
        Throwable cause = unwrap(failure);
        if (cause instanceof StatesRuntimeException sre) {
            ExecutionError error = sre.getError();
            HistoryEventType type = ErrorNames.TIMEOUT.equals(error.error())
                || ErrorNames.HEARTBEAT_TIMEOUT.equals(error.error())
                ? HistoryEventType.TASK_TIMED_OUT
                : HistoryEventType.TASK_FAILED;
            record(type, errorDetails(error));
        }
    }

    /**
     * Classify an invoker failure. Named resource errors keep their name; anything else is
     * {@code States.TaskFailed}.
     */
    private ExecutionError toError(String resource, Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof ResourceException re) {
            String name = re.getErrorName() != null ? re.getErrorName() : ErrorNames.TASK_FAILED;
            return new ExecutionError(name, re.getMessage());
        }
        if (cause instanceof StatesRuntimeException sre) {
            return sre.getError();
        }
        log.error("Resource {} failed unexpectedly", resource, cause);
        return ExecutionError.taskFailed(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName());
    }

    /**
     * Re-armed on every heartbeat; fires States.HeartbeatTimeout when the resource goes quiet.
     */
    private final class HeartbeatMonitor {

        private final String stateName;
        private final Duration interval;
        private final CompletableFuture<JsonNode> outcome;
        private TimerHandle timer;

        HeartbeatMonitor(String stateName, Duration interval, CompletableFuture<JsonNode> outcome) {
            this.stateName = stateName;
            this.interval = interval;
            this.outcome = outcome;
        }

        synchronized void arm() {
            if (outcome.isDone()) {
                return;
            }
            if (timer != null) {
                timer.cancel();
            }
            timer = services.timers().scheduleAfter(interval, () -> outcome.completeExceptionally(
                new StatesRuntimeException(ExecutionError.heartbeatTimeout(String.format(
                    "Task '%s' sent no heartbeat within %d seconds", stateName, interval.toSeconds())))));
        }

        synchronized void disarm() {
            if (timer != null) {
                timer.cancel();
                timer = null;
            }
        }
    }

    // ========== Helpers ==========

    private BranchRunner branches() {
        return new BranchRunner(services, execution);
    }

    private Instant now() {
        return services.timers().now();
    }

    private void record(HistoryEventType type, JsonNode details) {
        execution.historyLog().record(type, env.stateName(), details);
    }

    private ObjectNode details() {
        return services.objectMapper().createObjectNode();
    }

    private ObjectNode errorDetails(ExecutionError error) {
        return details()
            .put("error", error.error())
            .put("cause", error.cause());
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
