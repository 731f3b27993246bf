package com.stepflow.examples.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.worker.InvocationContext;
import com.stepflow.worker.ResourceException;
import com.stepflow.worker.ResourceHandler;
import com.stepflow.worker.ResourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated resources for the Order Processing state machine.
 * 
 * These handlers demonstrate:
 * - Transient failures that succeed on retry
 * - Business errors routed by Catch (declined payment, invalid order)
 * - Heartbeats from a long-running resource
 * 
 * Every handler derives its output from its input only, so retries are safe.
 */
public class OrderResourceHandlers {

    private static final Logger log = LoggerFactory.getLogger(OrderResourceHandlers.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String ERROR_INVALID = "Order.Invalid";
    public static final String ERROR_INVENTORY_UNAVAILABLE = "Inventory.Unavailable";
    public static final String ERROR_PAYMENT_DECLINED = "Payment.Declined";
    public static final String ERROR_GATEWAY_TIMEOUT = "Payment.GatewayTimeout";

    // Failure simulation
    private final AtomicInteger inventoryFailuresRemaining = new AtomicInteger(0);
    private final AtomicInteger gatewayTimeoutsRemaining = new AtomicInteger(0);
    private final AtomicBoolean declinePayments = new AtomicBoolean(false);

    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();

    /**
     * The next {@code count} reservation attempts fail with Inventory.Unavailable.
     */
    public OrderResourceHandlers failInventory(int count) {
        inventoryFailuresRemaining.set(count);
        return this;
    }

    public OrderResourceHandlers timeoutGateway(int count) {
        gatewayTimeoutsRemaining.set(count);
        return this;
    }

    public OrderResourceHandlers declinePayments(boolean decline) {
        declinePayments.set(decline);
        return this;
    }

    public void reset() {
        inventoryFailuresRemaining.set(0);
        gatewayTimeoutsRemaining.set(0);
        declinePayments.set(false);
        invocations.clear();
    }

    public int invocationCount(String resource) {
        AtomicInteger count = invocations.get(resource);
        return count != null ? count.get() : 0;
    }

    /**
     * Handlers keyed by resource identifier, in the order the state machine uses them.
     */
    public Map<String, ResourceHandler> handlers() {
        Map<String, ResourceHandler> handlers = new LinkedHashMap<>();
        handlers.put(OrderProcessingWorkflow.RESOURCE_VALIDATE_ORDER, counted(this::validateOrder));
        handlers.put(OrderProcessingWorkflow.RESOURCE_RESERVE_INVENTORY, counted(this::reserveInventory));
        handlers.put(OrderProcessingWorkflow.RESOURCE_RELEASE_INVENTORY, counted(this::releaseInventory));
        handlers.put(OrderProcessingWorkflow.RESOURCE_CHARGE_PAYMENT, counted(this::chargePayment));
        handlers.put(OrderProcessingWorkflow.RESOURCE_SHIP_ORDER, counted(this::shipOrder));
        handlers.put(OrderProcessingWorkflow.RESOURCE_SEND_CONFIRMATION, counted(this::sendConfirmation));
        return handlers;
    }

    public ResourceRegistry registerWith(ResourceRegistry registry) {
        handlers().forEach(registry::register);
        return registry;
    }

    private ResourceHandler counted(ResourceHandler handler) {
        return context -> {
            invocations.computeIfAbsent(context.getResource(), k -> new AtomicInteger()).incrementAndGet();
            return handler.handle(context);
        };
    }

    /**
     * Validate Order.
     * 
     * Fails with Order.Invalid when the order has no id or no items.
     */
    JsonNode validateOrder(InvocationContext context) throws ResourceException {
        JsonNode input = context.getInput();
        String orderId = input.path("orderId").asText("");
        JsonNode items = input.path("items");
        log.info("[{}] Validating order {}", context.getExecutionId(), orderId);

        if (orderId.isEmpty()) {
            throw new ResourceException(ERROR_INVALID, "Invalid order: missing orderId");
        }
        if (!items.isArray() || items.isEmpty()) {
            throw new ResourceException(ERROR_INVALID, "Invalid order: no items");
        }

        ObjectNode result = mapper.createObjectNode();
        result.put("valid", true);
        result.put("itemCount", items.size());
        return result;
    }

    /**
     * Reserve Inventory for one line item (simulated external API call).
     * 
     * DEMONSTRATES: transient failures that succeed on retry.
     */
    JsonNode reserveInventory(InvocationContext context) throws ResourceException {
        LineItem item = context.getInput(LineItem.class);
        log.info("[{}] Reserving {} x {} (attempt {})",
            context.getExecutionId(), item.quantity(), item.sku(), context.getAttemptNumber());

        if (inventoryFailuresRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            log.warn("[{}] Inventory service unavailable for {}", context.getExecutionId(), item.sku());
            throw new ResourceException(ERROR_INVENTORY_UNAVAILABLE, "Inventory service temporarily unavailable");
        }

        ObjectNode result = mapper.createObjectNode();
        result.put("sku", item.sku());
        result.put("quantity", item.quantity());
        result.put("reservationId", "RES-" + item.orderId() + "-" + item.line());
        return result;
    }

    /**
     * One line item as selected by the ReserveItems ItemSelector.
     */
    public record LineItem(String orderId, int line, String sku, int quantity) {}

    /**
     * Release Inventory. Compensation for ReserveItems.
     */
    JsonNode releaseInventory(InvocationContext context) {
        JsonNode reservations = context.getInput().path("reservations");
        log.info("[{}] Releasing {} reservations", context.getExecutionId(), reservations.size());
        ObjectNode result = mapper.createObjectNode();
        result.put("released", reservations.size());
        return result;
    }

    /**
     * Charge Payment (simulated payment gateway).
     */
    JsonNode chargePayment(InvocationContext context) throws ResourceException {
        JsonNode input = context.getInput();
        String orderId = input.path("orderId").asText();
        log.info("[{}] Charging {} for order {} (attempt {})",
            context.getExecutionId(), input.path("amount").decimalValue(), orderId, context.getAttemptNumber());

        if (gatewayTimeoutsRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new ResourceException(ERROR_GATEWAY_TIMEOUT, "Payment gateway did not respond");
        }
        if (declinePayments.get()) {
            throw new ResourceException(ERROR_PAYMENT_DECLINED, "Card declined for customer " + input.path("customer").asText());
        }

        ObjectNode result = mapper.createObjectNode();
        result.put("transactionId", "TXN-" + orderId);
        result.put("amount", input.path("amount").decimalValue());
        result.put("status", "CHARGED");
        return result;
    }

    /**
     * Ship Order. Reports progress through heartbeats while the label is printed.
     */
    JsonNode shipOrder(InvocationContext context) {
        String orderId = context.getInput().path("orderId").asText();
        log.info("[{}] Creating shipment for {}", context.getExecutionId(), orderId);
        context.heartbeat();

        ObjectNode result = mapper.createObjectNode();
        result.put("trackingNumber", "TRK-" + orderId);
        result.put("carrier", "UPS");
        return result;
    }

    JsonNode sendConfirmation(InvocationContext context) {
        String orderId = context.getInput().path("orderId").asText();
        log.info("[{}] Sending confirmation for {}", context.getExecutionId(), orderId);

        ObjectNode result = mapper.createObjectNode();
        result.put("channel", "email");
        result.put("sent", true);
        return result;
    }
}
