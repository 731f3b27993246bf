package com.stepflow.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.exception.PathException;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ExecutionError;

import java.util.List;

/**
 * A path used as a write location (ResultPath). Writing never mutates the given document:
 * the result is a copy with the value placed at the path, intermediate objects created.
 */
public final class ReferencePath {

    private final CompiledPath path;

    private ReferencePath(CompiledPath path) {
        this.path = path;
    }

    /**
     * Parse a reference path.
     * 
     * @throws PathException if the expression is malformed or not a reference path
     */
    public static ReferencePath compile(String expression) {
        CompiledPath compiled = CompiledPath.compile(expression);
        if (!compiled.isReference()) {
            throw new PathException(expression, "only '.field', ['field'] and [index] steps are allowed here");
        }
        return new ReferencePath(compiled);
    }

    /**
     * Place a value at this path in a copy of the document.
     * 
     * @throws StatesRuntimeException if the path crosses a value that is neither an object
     *         nor an array holding the index
     */
    public JsonNode write(JsonNode document, JsonNode value) {
        List<PathSegment> segments = path.segments();
        if (segments.isEmpty()) {
            return value;
        }
        JsonNode root = document == null || document.isMissingNode() || document.isNull()
            ? JsonNodeFactory.instance.objectNode()
            : document.deepCopy();
        JsonNode current = root;
        for (int i = 0; i < segments.size(); i++) {
            PathSegment segment = segments.get(i);
            boolean last = i == segments.size() - 1;
            if (segment instanceof PathSegment.Field field) {
                if (!current.isObject()) {
                    throw unwritable(field.name(), current);
                }
                ObjectNode object = (ObjectNode) current;
                if (last) {
                    object.set(field.name(), value);
                } else {
                    JsonNode child = object.get(field.name());
                    if (child == null || child.isNull()) {
                        child = object.putObject(field.name());
                    }
                    current = child;
                }
            } else {
                int index = ((PathSegment.Index) segment).indexes().get(0);
                if (!current.isArray() || index >= current.size()) {
                    throw unwritable("[" + index + "]", current);
                }
                ArrayNode array = (ArrayNode) current;
                if (last) {
                    array.set(index, value);
                } else {
                    current = array.get(index);
                }
            }
        }
        return root;
    }

    public String expression() {
        return path.expression();
    }

    private StatesRuntimeException unwritable(String step, JsonNode target) {
        return new StatesRuntimeException(ExecutionError.runtime(String.format(
            "Unable to apply ResultPath '%s': cannot write '%s' into a %s value",
            path.expression(), step, target.getNodeType().name().toLowerCase())));
    }
}
