package com.stepflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Synchronous implementation of one resource.
 * Handlers are registered in a {@link ResourceRegistry} under a resource identifier and run on
 * its worker pool.
 */
@FunctionalInterface
public interface ResourceHandler {
    
    /**
     * Handle an invocation.
     * 
     * @param context Invocation context providing input and heartbeats
     * @return The resource result
     * @throws ResourceException if the resource fails; the error name is matched by Retry/Catch
     */
    JsonNode handle(InvocationContext context) throws ResourceException;
}
