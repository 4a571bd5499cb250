package com.openforge.mcpchat.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mcpchat.llm.model.Tool;

/**
 * One tool as advertised by a remote tool server.
 *
 * "inputSchema" is the JSON-Schema-like object the server published; it is
 * kept as a JsonNode so it can be forwarded to the LLM without a POJO mapping.
 * Instances belong to the catalog and are never mutated by the chat loop.
 *
 * Serialized in camelCase ("inputSchema") to match the tool server wire format,
 * overriding the application-wide snake_case strategy.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ToolSchema(
        String name,
        String description,
        JsonNode inputSchema
) {

    /**
     * Converts to the OpenAI "function" tool shape.
     *
     * Only "properties" and "required" are carried over; the model does not
     * need the rest of the schema to produce arguments.
     */
    public Tool toProviderTool() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode parameters = nodes.objectNode();
        parameters.put("type", "object");

        JsonNode properties = inputSchema != null ? inputSchema.get("properties") : null;
        JsonNode required   = inputSchema != null ? inputSchema.get("required") : null;
        parameters.set("properties", properties != null && properties.isObject()
                ? properties.deepCopy() : nodes.objectNode());
        parameters.set("required", required != null && required.isArray()
                ? required.deepCopy() : nodes.arrayNode());

        String effectiveDescription = description == null || description.isBlank()
                ? "Call the %s tool".formatted(name)
                : description;
        return Tool.function(name, effectiveDescription, parameters);
    }
}
