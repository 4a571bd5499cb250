package com.openforge.mcpchat.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.mcpchat.dispatch.ToolResult;
import com.openforge.mcpchat.selection.FilterMetrics;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the user-facing conversation history.
 *
 * Which optional part is set depends on the role:
 *   ASSISTANT — content, and toolCalls when the model requested tools
 *   TOOL      — toolResult, always exactly one
 *   SYSTEM    — filterMetrics for selection reports, or an error text
 *
 * synthetic marks entries the application wrote itself (selection reports,
 * notices, errors); they are shown to the user but never replayed to the model.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationMessage(
        MessageRole role,
        String content,
        List<PendingToolCall> toolCalls,
        ToolResult toolResult,
        FilterMetrics filterMetrics,
        boolean synthetic,
        boolean error,
        Instant createdAt
) {

    public ConversationMessage {
        toolCalls = toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls);
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(MessageRole.USER, content, null, null, null, false, false, null);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(MessageRole.ASSISTANT, content, null, null, null, false, false, null);
    }

    public static ConversationMessage assistantWithToolCalls(String content, List<PendingToolCall> toolCalls) {
        return new ConversationMessage(MessageRole.ASSISTANT, content, toolCalls, null, null, false, false, null);
    }

    public static ConversationMessage tool(ToolResult result) {
        return new ConversationMessage(MessageRole.TOOL, null, null, result, null, false, false, null);
    }

    public static ConversationMessage filterMetrics(FilterMetrics metrics) {
        String summary = "Using %d/%d tools (%dms)"
                .formatted(metrics.toolsUsed(), metrics.toolsTotal(), metrics.filterTimeMs());
        return new ConversationMessage(MessageRole.SYSTEM, summary, null, null, metrics, true, false, null);
    }

    /** An assistant-side message written by the application, e.g. the truncation notice. */
    public static ConversationMessage notice(String content) {
        return new ConversationMessage(MessageRole.ASSISTANT, content, null, null, null, true, false, null);
    }

    public static ConversationMessage error(String content) {
        return new ConversationMessage(MessageRole.SYSTEM, content, null, null, null, true, true, null);
    }

    /** Same message with new text; used while the response is still streaming. */
    public ConversationMessage withContent(String newContent) {
        return new ConversationMessage(role, newContent, toolCalls, toolResult, filterMetrics,
                synthetic, error, createdAt);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
