package com.stepflow.examples.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.definition.DefinitionParser;
import com.stepflow.core.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

/**
 * Order Processing state machine.
 * 
 * Demonstrates:
 * 1. Task states calling external resources (inventory, payment, shipping)
 * 2. Retry with exponential backoff on transient failures
 * 3. Catch routing to compensation (release stock when payment is declined)
 * 4. Choice routing high-value orders through a review Wait
 * 5. Map over line items and Parallel fulfilment
 * 
 * States:
 * 1. ValidateOrder - reject malformed orders
 * 2. ReserveItems - reserve stock per line item (Map, at most 2 at a time)
 * 3. RouteByAmount - orders above 1000 wait for review
 * 4. ProcessPayment - charge the customer
 * 5. Fulfil - ship and send the confirmation in parallel
 * 6. OrderComplete - summarise the order
 * 
 * Compensation:
 * - Payment.Declined -> ReleaseInventory -> PaymentFailed
 */
public final class OrderProcessingWorkflow {

    private static final Logger log = LoggerFactory.getLogger(OrderProcessingWorkflow.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String DEFINITION_RESOURCE = "/workflows/order-processing.json";

    // Resource identifiers
    public static final String RESOURCE_VALIDATE_ORDER = "order:validate";
    public static final String RESOURCE_RESERVE_INVENTORY = "inventory:reserve";
    public static final String RESOURCE_RELEASE_INVENTORY = "inventory:release";
    public static final String RESOURCE_CHARGE_PAYMENT = "payment:charge";
    public static final String RESOURCE_SHIP_ORDER = "shipping:create";
    public static final String RESOURCE_SEND_CONFIRMATION = "notification:send";

    // Errors raised by the state machine itself
    public static final String ERROR_REJECTED = "Order.Rejected";
    public static final String ERROR_PAYMENT_FAILED = "Order.PaymentFailed";

    private OrderProcessingWorkflow() {
    }

    /**
     * Load and validate the order processing definition from the classpath.
     */
    public static Program load(DefinitionParser parser) {
        String definition = readDefinition();
        Program program = parser.parse(definition);
        log.info("Loaded order processing definition with {} states", program.states().size());
        return program;
    }

    static String readDefinition() {
        try (InputStream in = OrderProcessingWorkflow.class.getResourceAsStream(DEFINITION_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Definition not found on classpath: " + DEFINITION_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFINITION_RESOURCE, e);
        }
    }

    /**
     * Create a sample order with two line items.
     */
    public static JsonNode createSampleOrderInput(String orderId, BigDecimal totalAmount) {
        ObjectNode input = mapper.createObjectNode();
        input.put("orderId", orderId);
        input.put("customerId", "CUST-001");
        input.put("totalAmount", totalAmount);
        input.put("reviewDelaySeconds", 2);

        ArrayNode items = input.putArray("items");
        items.addObject().put("sku", "SKU-BOOK-01").put("quantity", 2);
        items.addObject().put("sku", "SKU-LAMP-07").put("quantity", 1);

        ObjectNode address = input.putObject("shippingAddress");
        address.put("street", "123 Main St");
        address.put("city", "San Francisco");
        address.put("zip", "94102");
        return input;
    }
}
