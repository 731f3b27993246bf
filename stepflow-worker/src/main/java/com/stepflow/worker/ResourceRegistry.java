package com.stepflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ResourceInvoker} that dispatches to handlers registered by resource identifier and
 * runs them on a bounded worker pool.
 * 
 * Usage:
 * <pre>
 * ResourceRegistry registry = new ResourceRegistry(10);
 * registry.register("email:send", context -> {
 *     // Handle the resource
 *     return context.toJsonNode(Map.of("sent", true));
 * });
 * </pre>
 */
public class ResourceRegistry implements ResourceInvoker {
    
    private static final Logger log = LoggerFactory.getLogger(ResourceRegistry.class);
    
    private final Map<String, ResourceHandler> handlers = new ConcurrentHashMap<>();
    private final ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(true);
    
    public ResourceRegistry() {
        this(10);
    }
    
    public ResourceRegistry(int maxConcurrentInvocations) {
        this.executorService = Executors.newFixedThreadPool(maxConcurrentInvocations, runnable -> {
            Thread thread = new Thread(runnable, "stepflow-resource");
            thread.setDaemon(true);
            return thread;
        });
    }
    
    /**
     * Register a resource handler, replacing any previous handler for the same identifier.
     */
    public ResourceRegistry register(String resource, ResourceHandler handler) {
        handlers.put(resource, handler);
        log.info("Registered resource handler: {}", resource);
        return this;
    }

    public boolean hasHandler(String resource) {
        return handlers.containsKey(resource);
    }

    public Set<String> resources() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public CompletionStage<JsonNode> invoke(InvocationContext context) {
        ResourceHandler handler = handlers.get(context.getResource());
        if (handler == null) {
            log.error("No handler registered for resource: {}", context.getResource());
            return CompletableFuture.failedFuture(new ResourceException(null,
                "No handler registered for resource '" + context.getResource() + "'"));
        }

        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        try {
            executorService.execute(() -> run(handler, context, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new ResourceException(null,
                "Resource registry is stopped, cannot invoke '" + context.getResource() + "'", e));
        }
        return result;
    }
    
    /**
     * Stop the worker pool gracefully.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping resource registry with {} handlers", handlers.size());
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
    
    private void run(ResourceHandler handler, InvocationContext context, CompletableFuture<JsonNode> result) {
        log.debug("Invoking {} for state {} (attempt {})",
            context.getResource(), context.getStateName(), context.getAttemptNumber());
        try {
            JsonNode output = handler.handle(context);
            result.complete(output != null ? output : NullNode.getInstance());
            
        } catch (ResourceException e) {
            log.warn("Resource {} failed: {} - {}", context.getResource(), e.getErrorName(), e.getMessage());
            result.completeExceptionally(e);
            
        } catch (Exception e) {
            log.error("Resource {} failed with unexpected error", context.getResource(), e);
            result.completeExceptionally(e);
        }
    }
}
