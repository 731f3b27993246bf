package com.stepflow.engine.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.HistoryEventType;
import com.stepflow.core.model.Program;
import com.stepflow.core.path.JsonPathEvaluator;
import com.stepflow.core.path.PathEvaluator;
import com.stepflow.engine.choice.ChoiceEvaluator;
import com.stepflow.engine.config.EngineProperties;
import com.stepflow.engine.dataflow.DataFlowPipeline;
import com.stepflow.engine.dataflow.PathQuery;
import com.stepflow.engine.history.ExecutionHistory;
import com.stepflow.engine.history.HistoryListener;
import com.stepflow.engine.logging.LoggingContext;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.engine.recovery.RetryCatchResolver;
import com.stepflow.engine.wait.WaitResolver;
import com.stepflow.scheduler.TimerHandle;
import com.stepflow.scheduler.TimerScheduler;
import com.stepflow.scheduler.TimerService;
import com.stepflow.worker.ResourceInvoker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the interpreter: starts executions of validated programs, looks them up and
 * cancels them.
 * 
 * Usage:
 * <pre>
 * ExecutionEngine engine = ExecutionEngine.builder()
 *     .resourceInvoker(registry)
 *     .build();
 * Execution execution = engine.start(program, input);
 * execution.completion().join();
 * </pre>
 * 
 * Executions are kept in memory for the lifetime of the engine.
 */
public class ExecutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final InterpreterServices services;
    private final List<HistoryListener> historyListeners;
    private final List<Runnable> ownedResources;
    private final Map<String, Execution> executions = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private ExecutionEngine(InterpreterServices services, List<HistoryListener> historyListeners, List<Runnable> ownedResources) {
        this.services = services;
        this.historyListeners = List.copyOf(historyListeners);
        this.ownedResources = List.copyOf(ownedResources);
    }

    // ========== Executions ==========

    public Execution start(Program program, JsonNode input) {
        return start(program, input, null);
    }

    /**
     * Start an execution. Returns immediately; the program runs on the worker executor.
     * 
     * @param name Optional caller-chosen name exposed as {@code $$.Execution.Name}; defaults to the id
     * @throws IllegalStateException if the engine is shutting down
     */
    public Execution start(Program program, JsonNode input, String name) {
        if (shuttingDown.get()) {
            throw new IllegalStateException("Engine is shutting down, cannot start new executions");
        }

        String id = UUID.randomUUID().toString();
        JsonNode document = input != null ? input.deepCopy() : services.objectMapper().createObjectNode();
        ExecutionContext context = new ExecutionContext(id, name != null ? name : id, services.timers().now(), document);
        CancellationSignal cancellation = new CancellationSignal();
        ExecutionHistory history = new ExecutionHistory(id, services.timers()::now, historyListeners);
        Execution execution = new Execution(context, program, history, cancellation);
        executions.put(id, execution);

        try (LoggingContext ignored = LoggingContext.forExecution(id, context.name())) {
            log.info("Starting execution {} at state {}", context.name(), program.startAt());
            ObjectNode details = services.objectMapper().createObjectNode();
            details.set("input", document);
            history.record(HistoryEventType.EXECUTION_STARTED, null, details);
            services.metrics().executionStarted();

            TimerHandle timeout = program.timeoutSeconds() != null
                ? services.timers().scheduleAfter(Duration.ofSeconds(program.timeoutSeconds()),
                    () -> cancellation.cancel(CancellationSignal.Reason.TIMEOUT))
                : null;

            Environment env = new Environment(context, cancellation, document);
            new ProgramRunner(services, program, env, execution, true).run()
                .whenComplete((output, failure) -> {
                    if (timeout != null) {
                        timeout.cancel();
                    }
                    finish(execution, output, failure);
                });
        }
        return execution;
    }

    public Optional<Execution> find(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    /**
     * Cancel an execution by id.
     * 
     * @return false if no such execution exists or it already finished
     */
    public boolean cancel(String executionId) {
        return find(executionId).map(Execution::cancel).orElse(false);
    }

    public List<Execution> executions() {
        return new ArrayList<>(executions.values());
    }

    /**
     * Forget a finished execution. Running executions are kept so they can still be
     * cancelled.
     * 
     * @return false if no such execution exists or it is still running
     */
    public boolean remove(String executionId) {
        Execution execution = executions.get(executionId);
        if (execution == null || !execution.isFinished()) {
            return false;
        }
        return executions.remove(executionId, execution);
    }

    /**
     * Forget every finished execution.
     * 
     * @return the number of executions removed
     */
    public int removeFinished() {
        int removed = 0;
        for (Execution execution : executions.values()) {
            if (execution.isFinished() && executions.remove(execution.id(), execution)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Removed {} finished executions", removed);
        }
        return removed;
    }

    private void finish(Execution execution, JsonNode output, Throwable failure) {
        Instant now = services.timers().now();
        ExecutionHistory history = execution.historyLog();
        Duration duration = Duration.between(execution.startTime(), now);

        try (LoggingContext ignored = LoggingContext.forExecution(execution.id(), execution.name())) {
            if (failure == null) {
                ObjectNode details = services.objectMapper().createObjectNode();
                details.set("output", output);
                history.record(HistoryEventType.EXECUTION_SUCCEEDED, null, details);
                services.metrics().executionFinished(ExecutionStatus.SUCCEEDED, duration);
                execution.succeed(output, now);
                log.info("Execution {} succeeded in {} ms", execution.name(), duration.toMillis());
                return;
            }

            Throwable cause = ProgramRunner.unwrap(failure);
            if (cause instanceof CancellationException
                && execution.cancellation().reason() == CancellationSignal.Reason.TIMEOUT) {
                ExecutionError error = ExecutionError.timeout(String.format(
                    "Execution did not complete within %d seconds", execution.program().timeoutSeconds()));
                history.record(HistoryEventType.EXECUTION_TIMED_OUT, null, errorDetails(error));
                services.metrics().executionFinished(ExecutionStatus.FAILED, duration);
                execution.fail(error, now);
                log.warn("Execution {} timed out after {} ms", execution.name(), duration.toMillis());
            } else if (cause instanceof CancellationException) {
                history.record(HistoryEventType.EXECUTION_ABORTED, null, services.objectMapper().createObjectNode());
                services.metrics().executionFinished(ExecutionStatus.ABORTED, duration);
                execution.abort(now);
                log.info("Execution {} aborted", execution.name());
            } else {
                ExecutionError error = cause instanceof StatesRuntimeException sre
                    ? sre.getError()
                    : ExecutionError.runtime(String.valueOf(cause));
                history.record(HistoryEventType.EXECUTION_FAILED, null, errorDetails(error));
                services.metrics().executionFinished(ExecutionStatus.FAILED, duration);
                execution.fail(error, now);
                log.warn("Execution {} failed with {}: {}", execution.name(), error.error(), error.cause());
            }
        }
    }

    private ObjectNode errorDetails(ExecutionError error) {
        return services.objectMapper().createObjectNode()
            .put("error", error.error())
            .put("cause", error.cause());
    }

    // ========== Lifecycle ==========

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Stop accepting executions, abort the running ones and release the threads the engine
     * created itself. Injected executors and timer services are left to their owners.
     */
    @Override
    public void close() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        long running = executions.values().stream().filter(e -> !e.isFinished()).count();
        log.info("Shutting down execution engine, aborting {} running executions", running);
        executions.values().forEach(Execution::cancel);

        for (Runnable release : ownedResources) {
            try {
                release.run();
            } catch (RuntimeException e) {
                log.error("Failed to release engine resource", e);
            }
        }
        log.info("Execution engine shut down");
    }

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResourceInvoker resourceInvoker;
        private TimerService timerService;
        private Executor executor;
        private PathEvaluator pathEvaluator;
        private ExecutionMetrics metrics;
        private ObjectMapper objectMapper;
        private EngineProperties properties = new EngineProperties();
        private final List<HistoryListener> historyListeners = new ArrayList<>();

        public Builder resourceInvoker(ResourceInvoker resourceInvoker) {
            this.resourceInvoker = resourceInvoker;
            return this;
        }

        public Builder timerService(TimerService timerService) {
            this.timerService = timerService;
            return this;
        }

        /**
         * Executor running interpreter loops. {@code Runnable::run} runs them on the calling
         * thread, which together with a manual timer service makes executions deterministic.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder pathEvaluator(PathEvaluator pathEvaluator) {
            this.pathEvaluator = pathEvaluator;
            return this;
        }

        public Builder metrics(ExecutionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder properties(EngineProperties properties) {
            this.properties = properties;
            return this;
        }

        public Builder historyListener(HistoryListener listener) {
            this.historyListeners.add(listener);
            return this;
        }

        public ExecutionEngine build() {
            if (resourceInvoker == null) {
                throw new IllegalStateException("A resource invoker is required");
            }
            List<Runnable> owned = new ArrayList<>();

            TimerService timers = timerService;
            if (timers == null) {
                TimerScheduler scheduler = new TimerScheduler(properties.getTimerThreads());
                owned.add(scheduler::stop);
                timers = scheduler;
            }
            Executor workers = executor;
            if (workers == null) {
                ExecutorService pool = Executors.newFixedThreadPool(properties.getWorkerThreads(), workerThreadFactory());
                owned.add(pool::shutdown);
                workers = pool;
            }
            ExecutionMetrics executionMetrics = metrics;
            if (executionMetrics == null) {
                executionMetrics = new ExecutionMetrics();
                executionMetrics.bindTo(new SimpleMeterRegistry());
            }
            ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();

            PathQuery paths = new PathQuery(pathEvaluator != null ? pathEvaluator : new JsonPathEvaluator());
            InterpreterServices services = new InterpreterServices(
                new DataFlowPipeline(paths),
                new WaitResolver(paths),
                new ChoiceEvaluator(paths),
                new RetryCatchResolver(),
                resourceInvoker,
                timers,
                workers,
                executionMetrics,
                mapper,
                properties.getDefaultTaskTimeoutSeconds(),
                properties.getDefaultMapConcurrency()
            );
            return new ExecutionEngine(services, historyListeners, owned);
        }

        private static ThreadFactory workerThreadFactory() {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, "stepflow-worker-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
