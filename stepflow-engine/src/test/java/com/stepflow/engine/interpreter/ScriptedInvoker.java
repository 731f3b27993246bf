package com.stepflow.engine.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.worker.InvocationContext;
import com.stepflow.worker.ResourceException;
import com.stepflow.worker.ResourceInvoker;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Test invoker answering each resource with a scripted future and recording every call.
 */
class ScriptedInvoker implements ResourceInvoker {

    private final Map<String, Function<InvocationContext, CompletionStage<JsonNode>>> scripts = new ConcurrentHashMap<>();
    private final List<InvocationContext> invocations = new CopyOnWriteArrayList<>();

    ScriptedInvoker on(String resource, Function<InvocationContext, CompletionStage<JsonNode>> script) {
        scripts.put(resource, script);
        return this;
    }

    ScriptedInvoker returning(String resource, Function<JsonNode, JsonNode> result) {
        return on(resource, ctx -> CompletableFuture.completedFuture(result.apply(ctx.getInput())));
    }

    ScriptedInvoker failing(String resource, String errorName, String message) {
        return on(resource, ctx -> CompletableFuture.failedFuture(new ResourceException(errorName, message)));
    }

    ScriptedInvoker hanging(String resource) {
        return on(resource, ctx -> new CompletableFuture<>());
    }

    @Override
    public CompletionStage<JsonNode> invoke(InvocationContext context) {
        invocations.add(context);
        Function<InvocationContext, CompletionStage<JsonNode>> script = scripts.get(context.getResource());
        if (script == null) {
            return CompletableFuture.failedFuture(
                new ResourceException(null, "No script for resource: " + context.getResource()));
        }
        return script.apply(context);
    }

    List<InvocationContext> invocations() {
        return invocations;
    }

    long invocationsOf(String resource) {
        return invocations.stream().filter(c -> c.getResource().equals(resource)).count();
    }
}
