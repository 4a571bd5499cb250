package com.openforge.mcpchat.conversation.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.mcpchat.conversation.ConversationMessage;
import com.openforge.mcpchat.conversation.OrchestratorState;
import com.openforge.mcpchat.conversation.PendingToolCall;
import com.openforge.mcpchat.dispatch.ToolResult;
import com.openforge.mcpchat.selection.SelectionMode;
import com.openforge.mcpchat.selection.ToolAttribution;
import com.openforge.mcpchat.selection.ToolSelection;

import java.util.List;

/**
 * The single event envelope pushed to a conversation's STOMP topic.
 *
 * content carries text (a fragment, an answer, an error); payload carries
 * structured data for rich events and is null for text-only ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatEvent(
        String    conversationId,
        EventType type,
        String    content,
        Object    payload,
        int       iteration,
        long      timestamp
) {

    public static ChatEvent stateChange(String conversationId, OrchestratorState state, int iteration) {
        return new ChatEvent(conversationId, EventType.STATE_CHANGE, state.name(), null, iteration, now());
    }

    public static ChatEvent iterationStart(String conversationId, int iteration) {
        return new ChatEvent(conversationId, EventType.ITERATION_START, null, null, iteration, now());
    }

    public static ChatEvent toolsSelected(String conversationId, ToolSelection selection, int totalTools, int iteration) {
        List<ToolAttribution> tools = selection.tools().stream()
                .map(st -> new ToolAttribution(st.tool().name(), st.serverId()))
                .toList();
        ToolsSelectedPayload payload = new ToolsSelectedPayload(
                selection.mode(), selection.size(), totalTools, selection.truncated(), tools);
        return new ChatEvent(conversationId, EventType.TOOLS_SELECTED, null, payload, iteration, now());
    }

    public static ChatEvent messageAppended(String conversationId, ConversationMessage message, int iteration) {
        return new ChatEvent(conversationId, EventType.MESSAGE_APPENDED, null, message, iteration, now());
    }

    public static ChatEvent messageDelta(String conversationId, String fragment, int iteration) {
        return new ChatEvent(conversationId, EventType.MESSAGE_DELTA, fragment, null, iteration, now());
    }

    public static ChatEvent messageUpdated(String conversationId, ConversationMessage message, int iteration) {
        return new ChatEvent(conversationId, EventType.MESSAGE_UPDATED, null, message, iteration, now());
    }

    public static ChatEvent toolCall(String conversationId, PendingToolCall call, int iteration) {
        return new ChatEvent(conversationId, EventType.TOOL_CALL, null, call, iteration, now());
    }

    public static ChatEvent toolResult(String conversationId, ToolResult result, int iteration) {
        return new ChatEvent(conversationId, EventType.TOOL_RESULT, result.toProviderContent(), result, iteration, now());
    }

    public static ChatEvent finalAnswer(String conversationId, String answer, int iteration) {
        return new ChatEvent(conversationId, EventType.FINAL_ANSWER, answer, null, iteration, now());
    }

    public static ChatEvent iterationLimit(String conversationId, String notice, int iteration) {
        return new ChatEvent(conversationId, EventType.ITERATION_LIMIT, notice, null, iteration, now());
    }

    public static ChatEvent error(String conversationId, String message, int iteration) {
        return new ChatEvent(conversationId, EventType.ERROR, message, null, iteration, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    public record ToolsSelectedPayload(
            SelectionMode mode,
            int toolsUsed,
            int toolsTotal,
            boolean truncated,
            List<ToolAttribution> tools
    ) {}
}
