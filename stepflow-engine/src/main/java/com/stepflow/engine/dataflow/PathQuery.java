package com.stepflow.engine.dataflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.path.PathEvaluator;
import com.stepflow.engine.interpreter.Environment;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates paths for the interpreter. Paths starting with {@code $$} address the context
 * object of the Environment; every other path addresses the given document.
 */
public class PathQuery {

    public static final String CONTEXT_PREFIX = "$$";

    private final PathEvaluator evaluator;

    public PathQuery(PathEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public static boolean isContextPath(String path) {
        return path.startsWith(CONTEXT_PREFIX);
    }

    /**
     * All matches of a path, in document order.
     */
    public List<JsonNode> matches(String path, JsonNode document, Environment env) {
        if (isContextPath(path)) {
            return evaluator.evaluate(toDocumentPath(path), env.contextObject());
        }
        return evaluator.evaluate(path, document);
    }

    /**
     * The first match of a path. Used where a single value is required and several matches
     * may occur (Wait, Choice, ItemsPath).
     */
    public Optional<JsonNode> first(String path, JsonNode document, Environment env) {
        List<JsonNode> found = matches(path, document, env);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Select the value of a path: the single match of a definite path, or an array of all
     * matches of an indefinite one.
     * 
     * @param field Field the path was declared in, for the error message
     * @throws StatesRuntimeException with {@code States.Runtime} if nothing matches
     */
    public JsonNode select(String path, JsonNode document, Environment env, String field) {
        List<JsonNode> found = matches(path, document, env);
        if (found.isEmpty()) {
            throw new StatesRuntimeException(ExecutionError.runtime(String.format(
                "Invalid path '%s' in %s: the path did not match any value in the input", path, field)));
        }
        String documentPath = isContextPath(path) ? toDocumentPath(path) : path;
        if (evaluator.isDefinite(documentPath)) {
            return found.get(0);
        }
        ArrayNode all = JsonNodeFactory.instance.arrayNode();
        found.forEach(all::add);
        return all;
    }

    private static String toDocumentPath(String contextPath) {
        return "$" + contextPath.substring(CONTEXT_PREFIX.length());
    }
}
