package com.openforge.mcpchat.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * One turn of the provider transcript: "system", "user", "assistant" (text,
 * tool calls or both) or "tool" (a result, tied to its call by toolCallId).
 *
 * content is null on assistant turns that only request tools. This is
 * what the model sees. The user-visible history is kept separately
 * as {@code ConversationMessage}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId
) {

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role("assistant").content(content).build();
    }

    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder().role("assistant").content(content).toolCalls(toolCalls).build();
    }

    public static Message toolResult(String toolCallId, String result) {
        return Message.builder().role("tool").toolCallId(toolCallId).content(result).build();
    }

    public boolean isSystem() {
        return "system".equals(role);
    }
}
