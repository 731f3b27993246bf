package com.stepflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletionStage;

/**
 * Capability used by Task states to call external resources.
 * Implementations must not block the calling thread; the returned stage completes with the
 * resource's JSON result, or exceptionally (ideally with a {@link ResourceException}).
 */
@FunctionalInterface
public interface ResourceInvoker {

    CompletionStage<JsonNode> invoke(InvocationContext context);
}
