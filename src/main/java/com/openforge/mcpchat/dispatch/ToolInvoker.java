package com.openforge.mcpchat.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Backend that actually runs a tool on a remote server.
 *
 * May block, may throw; {@link ToolDispatcher} bounds and catches both.
 */
public interface ToolInvoker {

    /**
     * @param arguments always a JSON object
     * @return the tool's result document
     * @throws ToolInvocationException when the server reports a failure
     */
    JsonNode invoke(String serverId, String toolName, JsonNode arguments);

    class ToolInvocationException extends RuntimeException {
        public ToolInvocationException(String message) { super(message); }
        public ToolInvocationException(String message, Throwable cause) { super(message, cause); }
    }
}
