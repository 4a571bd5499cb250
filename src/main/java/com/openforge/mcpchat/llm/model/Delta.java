package com.openforge.mcpchat.llm.model;

import java.util.List;

/**
 * One incremental chunk of a streamed model response: a text fragment,
 * tool-call fragments, both, or neither (role-only / finish frames).
 */
public record Delta(
        String contentFragment,
        List<ToolCallFragment> toolCallFragments
) {

    public Delta {
        toolCallFragments = toolCallFragments == null ? List.of() : List.copyOf(toolCallFragments);
    }

    public static Delta content(String fragment) {
        return new Delta(fragment, List.of());
    }

    public static Delta toolCalls(ToolCallFragment... fragments) {
        return new Delta(null, List.of(fragments));
    }

    public boolean hasContent() {
        return contentFragment != null && !contentFragment.isEmpty();
    }

    public boolean hasToolCallFragments() {
        return !toolCallFragments.isEmpty();
    }
}
