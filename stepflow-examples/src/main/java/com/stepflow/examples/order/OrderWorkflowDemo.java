package com.stepflow.examples.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.definition.DefinitionParser;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.HistoryEvent;
import com.stepflow.core.model.Program;
import com.stepflow.engine.interpreter.Execution;
import com.stepflow.engine.interpreter.ExecutionEngine;
import com.stepflow.scheduler.TimerScheduler;
import com.stepflow.worker.ResourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Demonstration runner for the Order Processing state machine.
 * 
 * Shows:
 * 1. Normal successful execution
 * 2. Retry on transient inventory failures
 * 3. Declined payment caught and compensated
 * 4. High-value order waiting for review
 * 5. Cancellation of a suspended execution
 */
public class OrderWorkflowDemo implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrderWorkflowDemo.class);

    private final OrderResourceHandlers handlers = new OrderResourceHandlers();
    private final ResourceRegistry registry = handlers.registerWith(new ResourceRegistry(4));
    private final TimerScheduler timers = new TimerScheduler(1);
    private final ExecutionEngine engine = ExecutionEngine.builder()
        .resourceInvoker(registry)
        .timerService(timers)
        .historyListener((executionId, event) -> log.debug("[{}] #{} {} {}",
            executionId, event.sequenceNumber(), event.type(), event.stateName() != null ? event.stateName() : ""))
        .build();
    private final Program program = OrderProcessingWorkflow.load(new DefinitionParser());

    public static void main(String[] args) throws Exception {
        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║        STEPFLOW - ORDER PROCESSING STATE MACHINE DEMONSTRATION       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");

        try (OrderWorkflowDemo demo = new OrderWorkflowDemo()) {
            log.info("Resources: {}", demo.registry.resources());
            demo.runScenario1_NormalExecution();
            demo.runScenario2_RetryOnFailure();
            demo.runScenario3_PaymentDeclined();
            demo.runScenario4_HighValueReview();
            demo.runScenario5_Cancellation();
        }

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    ALL DEMONSTRATIONS COMPLETE                       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
    }

    /**
     * SCENARIO 1: Normal successful execution.
     */
    public Execution runScenario1_NormalExecution() throws Exception {
        banner("SCENARIO 1: Normal Successful Execution");
        handlers.reset();

        Execution execution = runToCompletion(new BigDecimal("499.99"));
        log.info("✓ SCENARIO 1 COMPLETE: {} with output {}", execution.status(), execution.output());
        return execution;
    }

    /**
     * SCENARIO 2: Two reservation attempts fail; the Retrier backs off and succeeds.
     */
    public Execution runScenario2_RetryOnFailure() throws Exception {
        banner("SCENARIO 2: Automatic Retry on Transient Failure");
        handlers.reset();
        handlers.failInventory(2);

        Execution execution = runToCompletion(new BigDecimal("299.99"));
        log.info("✓ SCENARIO 2 COMPLETE: {} after {} reservation calls",
            execution.status(), handlers.invocationCount(OrderProcessingWorkflow.RESOURCE_RESERVE_INVENTORY));
        return execution;
    }

    /**
     * SCENARIO 3: Payment.Declined is caught, stock is released and the order fails.
     */
    public Execution runScenario3_PaymentDeclined() throws Exception {
        banner("SCENARIO 3: Declined Payment with Compensation");
        handlers.reset();
        handlers.declinePayments(true);

        Execution execution = runToCompletion(new BigDecimal("149.99"));
        log.info("✓ SCENARIO 3 COMPLETE: {} with {} ({} release calls)", execution.status(),
            execution.error(), handlers.invocationCount(OrderProcessingWorkflow.RESOURCE_RELEASE_INVENTORY));
        return execution;
    }

    /**
     * SCENARIO 4: Orders above 1000 wait for review before payment.
     */
    public Execution runScenario4_HighValueReview() throws Exception {
        banner("SCENARIO 4: High-Value Order Review");
        handlers.reset();

        Execution execution = runToCompletion(new BigDecimal("2499.00"));
        log.info("✓ SCENARIO 4 COMPLETE: {} in {} ms", execution.status(),
            execution.stopTime().toEpochMilli() - execution.startTime().toEpochMilli());
        return execution;
    }

    /**
     * SCENARIO 5: Cancel an execution while it waits for review.
     */
    public Execution runScenario5_Cancellation() throws Exception {
        banner("SCENARIO 5: Cancellation While Suspended");
        handlers.reset();

        Execution execution = start(new BigDecimal("5000.00"));
        while (execution.status() != ExecutionStatus.SUSPENDED && !execution.isFinished()) {
            Thread.sleep(10);
        }
        log.info("Execution {} is {}, cancelling", execution.name(), execution.status());
        engine.cancel(execution.id());
        execution.completion().get(10, TimeUnit.SECONDS);

        log.info("✓ SCENARIO 5 COMPLETE: {}", execution.status());
        return execution;
    }

    private Execution start(BigDecimal amount) {
        String orderId = "ORD-" + UUID.randomUUID().toString().substring(0, 8);
        JsonNode input = OrderProcessingWorkflow.createSampleOrderInput(orderId, amount);
        log.info("Starting order {} for {}", orderId, amount);
        return engine.start(program, input, orderId);
    }

    private Execution runToCompletion(BigDecimal amount) throws Exception {
        Execution execution = start(amount);
        execution.completion().get(60, TimeUnit.SECONDS);
        for (HistoryEvent event : execution.history()) {
            log.info("  {} {}", event.type(), event.stateName() != null ? event.stateName() : "");
        }
        return execution;
    }

    private static void banner(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════════════");
    }

    @Override
    public void close() {
        engine.close();
        registry.stop();
        timers.stop();
    }
}
