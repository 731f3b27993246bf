package com.stepflow.core.path;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Query capability used by every data-flow stage: evaluates a path expression against a JSON
 * document and returns the ordered matches.
 */
public interface PathEvaluator {

    /**
     * Evaluate a path.
     * 
     * @param path Path expression starting with {@code $}
     * @param document Document to query
     * @return Matches in document order; empty when nothing matches
     * @throws com.stepflow.core.exception.PathException if the path is malformed
     */
    List<JsonNode> evaluate(String path, JsonNode document);

    /**
     * Check if a path can match at most one node (no wildcard, slice, union or descent).
     */
    boolean isDefinite(String path);
}
