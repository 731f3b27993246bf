package com.stepflow.core.definition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.model.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionWriterTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private DefinitionParser parser;
    private DefinitionWriter writer;

    @BeforeEach
    void setUp() {
        parser = new DefinitionParser();
        writer = new DefinitionWriter();
    }

    @Test
    @DisplayName("Writing a parsed definition reproduces every recognized field")
    void write_shouldReproduceDefinition() throws Exception {
        JsonNode definition = objectMapper.readTree(DefinitionParserTest.resource("full-featured.json"));

        JsonNode written = writer.write(parser.parse(definition));

        assertEquals(definition, written);
    }

    @Test
    @DisplayName("Parsing written output yields an equal program")
    void parse_ofWrittenProgram_shouldEqualOriginal() throws Exception {
        Program original = parser.parse(DefinitionParserTest.resource("full-featured.json"));

        Program reparsed = parser.parse(writer.writeString(original));

        assertEquals(original, reparsed);
    }

    @Test
    void write_shouldOmitUndeclaredFields() {
        Program program = parser.parse("""
            {"StartAt": "A", "States": {"A": {"Type": "Pass", "End": true}}}
            """);

        JsonNode state = writer.write(program).get("States").get("A");

        assertEquals(2, state.size());
        assertFalse(state.has("ResultPath"));
        assertFalse(state.has("Retry"));
    }

    @Test
    void write_shouldKeepExplicitNullPaths() {
        Program program = parser.parse("""
            {"StartAt": "A", "States": {"A": {"Type": "Pass", "ResultPath": null, "OutputPath": null, "End": true}}}
            """);

        JsonNode state = writer.write(program).get("States").get("A");

        assertTrue(state.get("ResultPath").isNull());
        assertTrue(state.get("OutputPath").isNull());
    }
}
