package com.openforge.mcpchat.llm.model;

/**
 * A complete tool call echoed back in an assistant message of the provider
 * transcript, so the following tool message can refer to it by id.
 *
 * function.arguments stays the raw JSON text the model produced.
 */
public record ToolCall(
        String id,
        String type,
        Function function
) {

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", new Function(name, arguments));
    }

    public record Function(
            String name,
            String arguments
    ) {}
}
