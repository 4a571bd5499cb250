package com.openforge.mcpchat.conversation.event;

/**
 * Classifies every event a run emits over WebSocket.
 *
 * Typical run: STATE_CHANGE(SELECTING) → ITERATION_START → TOOLS_SELECTED →
 * MESSAGE_APPENDED → MESSAGE_DELTA* → MESSAGE_UPDATED → TOOL_CALL / TOOL_RESULT
 * pairs → ... → FINAL_ANSWER → STATE_CHANGE(IDLE).
 */
public enum EventType {

    /** Orchestrator moved to another state. content = state name. */
    STATE_CHANGE,

    /** A new iteration begins. */
    ITERATION_START,

    /** Tools chosen for the next model call. payload = ToolsSelectedPayload. */
    TOOLS_SELECTED,

    /** A message was added to the visible history. payload = ConversationMessage. */
    MESSAGE_APPENDED,

    /** A text fragment of the streaming message. content = fragment. */
    MESSAGE_DELTA,

    /** The streaming message reached its final form. payload = ConversationMessage. */
    MESSAGE_UPDATED,

    /** A tool is about to be invoked. payload = PendingToolCall. */
    TOOL_CALL,

    /** A tool call finished, successfully or not. payload = ToolResult. */
    TOOL_RESULT,

    /** The model answered without requesting tools; the run is done. */
    FINAL_ANSWER,

    /** The run stopped at the iteration bound. content = notice. */
    ITERATION_LIMIT,

    /** The run was aborted. content = message. */
    ERROR
}
