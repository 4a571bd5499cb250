package com.openforge.mcpchat.dispatch;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of one tool call, correlated to the request by toolCallId.
 * Exactly one of payloadJson / errorMessage is set.
 *
 * @param serverId        null when the tool could not be routed
 * @param executionTimeMs null when no remote call was made
 */
public record ToolResult(
        String toolCallId,
        String toolName,
        String serverId,
        String payloadJson,
        String errorMessage,
        Long executionTimeMs
) {

    public ToolResult {
        if ((payloadJson == null) == (errorMessage == null)) {
            throw new IllegalArgumentException("Exactly one of payloadJson / errorMessage must be set");
        }
    }

    public static ToolResult success(String toolCallId, String toolName, String serverId,
                                     String payloadJson, long executionTimeMs) {
        return new ToolResult(toolCallId, toolName, serverId, payloadJson, null, executionTimeMs);
    }

    public static ToolResult failure(String toolCallId, String toolName, String serverId,
                                     String errorMessage, Long executionTimeMs) {
        return new ToolResult(toolCallId, toolName, serverId, null, errorMessage, executionTimeMs);
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }

    /** What the model sees: the payload, or {"error": "..."}. */
    public String toProviderContent() {
        if (isSuccess()) return payloadJson;
        ObjectNode error = JsonNodeFactory.instance.objectNode();
        error.put("error", errorMessage);
        return error.toString();
    }
}
