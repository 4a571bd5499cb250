package com.openforge.mcpchat.conversation;

import com.openforge.mcpchat.llm.model.ToolCall;

/**
 * A tool call reconstructed from the stream.
 *
 * argumentsJson is exactly what the model produced; it is only checked for
 * well-formedness when the call is dispatched.
 */
public record PendingToolCall(
        String id,
        String name,
        String argumentsJson
) {

    /** Echo form for the provider transcript. */
    public ToolCall toProviderToolCall() {
        return ToolCall.function(id, name, argumentsJson);
    }
}
