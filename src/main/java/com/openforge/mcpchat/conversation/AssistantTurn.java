package com.openforge.mcpchat.conversation;

import java.util.List;

/**
 * What one streamed response amounted to once the stream ended.
 *
 * @param content   concatenated text, "" when the model produced none
 * @param toolCalls reconstructed calls ordered by stream index
 */
public record AssistantTurn(
        String content,
        List<PendingToolCall> toolCalls
) {

    public AssistantTurn {
        content   = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public boolean hasContent() {
        return !content.isEmpty();
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    /** Neither text nor tool calls: the provider gave us nothing to show. */
    public boolean isEmpty() {
        return !hasContent() && !hasToolCalls();
    }
}
