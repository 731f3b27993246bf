package com.stepflow.core.path;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link PathEvaluator} over Jackson trees. Compiled paths are cached because the same
 * expressions are evaluated on every visit of a state.
 */
public class JsonPathEvaluator implements PathEvaluator {

    private final Map<String, CompiledPath> cache = new ConcurrentHashMap<>();

    @Override
    public List<JsonNode> evaluate(String path, JsonNode document) {
        return compiled(path).evaluate(document);
    }

    @Override
    public boolean isDefinite(String path) {
        return compiled(path).isDefinite();
    }

    private CompiledPath compiled(String path) {
        CompiledPath compiled = cache.get(path);
        if (compiled == null) {
            compiled = CompiledPath.compile(path);
            cache.put(path, compiled);
        }
        return compiled;
    }
}
