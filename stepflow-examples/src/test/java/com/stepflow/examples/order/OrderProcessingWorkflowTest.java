package com.stepflow.examples.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.definition.DefinitionParser;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.HistoryEvent;
import com.stepflow.core.model.HistoryEventType;
import com.stepflow.core.model.Program;
import com.stepflow.engine.interpreter.Execution;
import com.stepflow.engine.interpreter.ExecutionEngine;
import com.stepflow.scheduler.ManualTimerService;
import com.stepflow.worker.ResourceException;
import com.stepflow.worker.ResourceHandler;
import com.stepflow.worker.ResourceInvoker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the order processing definition against the simulated resources, synchronously and
 * on a manual clock.
 */
class OrderProcessingWorkflowTest {

    private final OrderResourceHandlers handlers = new OrderResourceHandlers();
    private final Program program = OrderProcessingWorkflow.load(new DefinitionParser());

    private ManualTimerService timers;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        timers = new ManualTimerService();
        Map<String, ResourceHandler> byResource = handlers.handlers();
        ResourceInvoker invoker = context -> {
            try {
                return CompletableFuture.completedFuture(byResource.get(context.getResource()).handle(context));
            } catch (ResourceException e) {
                return CompletableFuture.failedFuture(e);
            }
        };
        engine = ExecutionEngine.builder()
            .resourceInvoker(invoker)
            .timerService(timers)
            .executor(Runnable::run)
            .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Order completes with transaction and tracking number")
    void testNormalExecution() {
        Execution execution = start("ORD-1", "499.99");

        assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        JsonNode output = execution.output();
        assertThat(output.get("orderId").asText()).isEqualTo("ORD-1");
        assertThat(output.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(output.get("transactionId").asText()).isEqualTo("TXN-ORD-1");
        assertThat(output.get("trackingNumber").asText()).isEqualTo("TRK-ORD-1");
        assertThat(handlers.invocationCount(OrderProcessingWorkflow.RESOURCE_RESERVE_INVENTORY)).isEqualTo(2);
    }

    @Test
    @DisplayName("Transient inventory failures are retried with backoff")
    void testInventoryRetry() {
        handlers.failInventory(2);

        Execution execution = start("ORD-2", "299.99");
        assertThat(execution.isFinished()).isFalse();

        timers.advanceSeconds(1);
        timers.advanceSeconds(2);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(handlers.invocationCount(OrderProcessingWorkflow.RESOURCE_RESERVE_INVENTORY)).isEqualTo(4);
        assertThat(execution.history())
            .filteredOn(event -> event.type() == HistoryEventType.RETRY_SCHEDULED)
            .hasSize(2);
    }

    @Test
    @DisplayName("Declined payment releases stock and fails the order")
    void testPaymentDeclined() {
        handlers.declinePayments(true);

        Execution execution = start("ORD-3", "149.99");

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.error().error()).isEqualTo(OrderProcessingWorkflow.ERROR_PAYMENT_FAILED);
        assertThat(handlers.invocationCount(OrderProcessingWorkflow.RESOURCE_RELEASE_INVENTORY)).isEqualTo(1);
        assertThat(handlers.invocationCount(OrderProcessingWorkflow.RESOURCE_SHIP_ORDER)).isZero();
    }

    @Test
    @DisplayName("High-value order waits for review before payment")
    void testHighValueReview() {
        Execution execution = start("ORD-4", "2499.00");

        assertThat(execution.status()).isEqualTo(ExecutionStatus.SUSPENDED);
        assertThat(handlers.invocationCount(OrderProcessingWorkflow.RESOURCE_CHARGE_PAYMENT)).isZero();

        timers.advanceSeconds(2);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(execution.history())
            .extracting(HistoryEvent::stateName)
            .contains("AwaitReview");
    }

    @Test
    @DisplayName("Order without items is rejected")
    void testRejectedOrder() {
        JsonNode input = OrderProcessingWorkflow.createSampleOrderInput("ORD-5", new BigDecimal("10.00"));
        ((ObjectNode) input).putArray("items");

        Execution execution = engine.start(program, input, "ORD-5");

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.error().error()).isEqualTo(OrderProcessingWorkflow.ERROR_REJECTED);
    }

    private Execution start(String orderId, String amount) {
        JsonNode input = OrderProcessingWorkflow.createSampleOrderInput(orderId, new BigDecimal(amount));
        return engine.start(program, input, orderId);
    }
}
