package com.stepflow.engine.dataflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.model.Catcher;
import com.stepflow.core.model.DataPath;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.model.State;
import com.stepflow.core.path.ReferencePath;
import com.stepflow.engine.interpreter.Environment;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies the data-flow transforms of a state around its core behavior:
 * 
 * <pre>
 * raw input -> InputPath -> Parameters -> [state behavior] -> ResultPath -> OutputPath
 * </pre>
 * 
 * Each stage returns a new document; the inputs are never mutated.
 * Failures are raised as {@link com.stepflow.core.exception.StatesRuntimeException} with
 * {@code States.Runtime} so the interpreter can route them through Retry/Catch.
 */
public class DataFlowPipeline {

    private static final String PATH_KEY_SUFFIX = ".$";

    private final PathQuery paths;
    private final Map<String, ReferencePath> referencePaths = new ConcurrentHashMap<>();

    public DataFlowPipeline(PathQuery paths) {
        this.paths = paths;
    }

    public PathQuery paths() {
        return paths;
    }

    // ========== Input ==========

    /**
     * Compute the effective input: InputPath selection, then the Parameters template.
     */
    public JsonNode prepareInput(State state, JsonNode raw, Environment env) {
        JsonNode selected = selectPath(state.effectiveInputPath(), raw, env, "InputPath");
        if (state.parameters() == null) {
            return selected;
        }
        return resolveTemplate(state.parameters(), selected, env);
    }

    // ========== Output ==========

    /**
     * Combine the raw input with the state's result and apply OutputPath.
     */
    public JsonNode applyOutput(State state, JsonNode raw, JsonNode result, Environment env) {
        JsonNode combined = applyResultPath(state.effectiveResultPath(), raw, result);
        return selectPath(state.effectiveOutputPath(), combined, env, "OutputPath");
    }

    /**
     * Place the error object of a caught error into the raw input, as the Catcher's
     * ResultPath directs. The result becomes the input of the Catcher's Next state.
     */
    public JsonNode applyCatcher(Catcher catcher, JsonNode raw, ExecutionError error) {
        return applyResultPath(catcher.effectiveResultPath(), raw, error.toJson());
    }

    private JsonNode applyResultPath(DataPath resultPath, JsonNode raw, JsonNode result) {
        if (resultPath.isDiscard()) {
            return raw;
        }
        if (resultPath.isRoot()) {
            return result;
        }
        return referencePaths
            .computeIfAbsent(resultPath.expression(), ReferencePath::compile)
            .write(raw, result);
    }

    private JsonNode selectPath(DataPath path, JsonNode document, Environment env, String field) {
        if (path.isDiscard()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (path.isRoot()) {
            return document;
        }
        return paths.select(path.expression(), document, env, field);
    }

    // ========== Templates ==========

    /**
     * Resolve a Parameters or ItemSelector template. Keys ending in {@code .$} take the value
     * their path selects, under the key without the suffix; other values are copied,
     * recursing into nested objects and arrays.
     */
    public JsonNode resolveTemplate(JsonNode template, JsonNode input, Environment env) {
        if (template.isObject()) {
            ObjectNode resolved = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = template.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey();
                if (key.endsWith(PATH_KEY_SUFFIX) && field.getValue().isTextual()) {
                    String name = key.substring(0, key.length() - PATH_KEY_SUFFIX.length());
                    resolved.set(name, paths.select(field.getValue().asText(), input, env, "Parameters"));
                } else {
                    resolved.set(key, resolveTemplate(field.getValue(), input, env));
                }
            }
            return resolved;
        }
        if (template.isArray()) {
            ArrayNode resolved = JsonNodeFactory.instance.arrayNode();
            template.forEach(element -> resolved.add(resolveTemplate(element, input, env)));
            return resolved;
        }
        return template.deepCopy();
    }
}
