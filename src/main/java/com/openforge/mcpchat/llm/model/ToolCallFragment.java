package com.openforge.mcpchat.llm.model;

/**
 * Partial tool-call data from one streamed delta.
 *
 * {@code index} identifies the call within a single response; every other
 * field is optional and may be null.
 */
public record ToolCallFragment(
        int index,
        String id,
        String name,
        String argumentsFragment
) {}
