package com.openforge.mcpchat.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpchat.llm.model.Tool;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolSchemaTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void convertsToFunctionToolKeepingPropertiesAndRequired() throws Exception {
        JsonNode schema = objectMapper.readTree("""
                {"type":"object","properties":{"q":{"type":"string"}},"required":["q"],"additionalProperties":false}
                """);

        Tool tool = new ToolSchema("search", "Search things", schema).toProviderTool();

        assertEquals("function", tool.type());
        assertEquals("search", tool.function().name());
        assertEquals("Search things", tool.function().description());
        JsonNode parameters = tool.function().parameters();
        assertEquals("object", parameters.get("type").asText());
        assertEquals("string", parameters.at("/properties/q/type").asText());
        assertEquals("q", parameters.get("required").get(0).asText());
        assertFalse(parameters.has("additionalProperties"));
    }

    @Test
    void fillsDefaultsForMissingDescriptionAndSchema() {
        Tool tool = new ToolSchema("ping", " ", null).toProviderTool();

        assertEquals("Call the ping tool", tool.function().description());
        assertTrue(tool.function().parameters().get("properties").isEmpty());
        assertTrue(tool.function().parameters().get("required").isEmpty());
    }
}
