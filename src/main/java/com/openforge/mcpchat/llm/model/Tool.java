package com.openforge.mcpchat.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Entry of the request's "tools" array. Only the "function" type exists.
 *
 *   {"type":"function","function":{"name":..,"description":..,"parameters":{..}}}
 */
public record Tool(
        String type,
        Function function
) {

    public static Tool function(String name, String description, JsonNode parameters) {
        return new Tool("function", new Function(name, description, parameters));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Function(
            String name,
            String description,
            JsonNode parameters
    ) {}
}
