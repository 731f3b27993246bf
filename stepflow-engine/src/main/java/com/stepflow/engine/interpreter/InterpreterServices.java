package com.stepflow.engine.interpreter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.engine.choice.ChoiceEvaluator;
import com.stepflow.engine.dataflow.DataFlowPipeline;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.engine.recovery.RetryCatchResolver;
import com.stepflow.engine.wait.WaitResolver;
import com.stepflow.scheduler.TimerService;
import com.stepflow.worker.ResourceInvoker;

import java.util.concurrent.Executor;

/**
 * Collaborators shared by every runner of an engine.
 */
record InterpreterServices(
    DataFlowPipeline pipeline,
    WaitResolver waits,
    ChoiceEvaluator choices,
    RetryCatchResolver recovery,
    ResourceInvoker invoker,
    TimerService timers,
    Executor executor,
    ExecutionMetrics metrics,
    ObjectMapper objectMapper,
    int defaultTaskTimeoutSeconds,
    int defaultMapConcurrency
) {
}
