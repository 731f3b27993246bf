package com.stepflow.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.stepflow.core.exception.PathException;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ErrorNames;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReferencePathTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void write_atRoot_shouldReplaceDocument() throws Exception {
        JsonNode input = objectMapper.readTree("{\"a\": 1}");

        JsonNode result = ReferencePath.compile("$").write(input, TextNode.valueOf("x"));

        assertEquals(TextNode.valueOf("x"), result);
    }

    @Test
    void write_shouldCreateIntermediateObjectsWithoutMutatingInput() throws Exception {
        JsonNode input = objectMapper.readTree("{\"a\": 1}");

        JsonNode result = ReferencePath.compile("$.result.payment").write(input, TextNode.valueOf("ok"));

        assertEquals(objectMapper.readTree("{\"a\": 1, \"result\": {\"payment\": \"ok\"}}"), result);
        assertEquals(objectMapper.readTree("{\"a\": 1}"), input);
    }

    @Test
    void write_intoArrayIndex_shouldReplaceElement() throws Exception {
        JsonNode input = objectMapper.readTree("{\"list\": [1, 2, 3]}");

        JsonNode result = ReferencePath.compile("$.list[1]").write(input, TextNode.valueOf("two"));

        assertEquals(objectMapper.readTree("{\"list\": [1, \"two\", 3]}"), result);
    }

    @Test
    void write_throughScalar_shouldFailWithRuntimeError() throws Exception {
        JsonNode input = objectMapper.readTree("{\"a\": 1}");

        StatesRuntimeException e = assertThrows(StatesRuntimeException.class,
            () -> ReferencePath.compile("$.a.b").write(input, TextNode.valueOf("x")));
        assertEquals(ErrorNames.RUNTIME, e.getError().error());
    }

    @Test
    void compile_shouldRejectNonReferencePaths() {
        assertThrows(PathException.class, () -> ReferencePath.compile("$.items[*]"));
        assertThrows(PathException.class, () -> ReferencePath.compile("$..x"));
        assertThrows(PathException.class, () -> ReferencePath.compile("$.items[-1]"));
    }
}
