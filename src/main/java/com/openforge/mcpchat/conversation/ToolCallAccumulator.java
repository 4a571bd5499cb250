package com.openforge.mcpchat.conversation;

import com.openforge.mcpchat.llm.model.Delta;
import com.openforge.mcpchat.llm.model.ToolCallFragment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reassembles a streamed response from its deltas.
 *
 * Text fragments concatenate in arrival order. Tool-call fragments are keyed
 * by their stream index: the first fragment for an index opens a call, later
 * ones overwrite id/name when present and append to the arguments. Indices
 * need not be contiguous or arrive in order; {@link #finish()} sorts by index.
 *
 * One instance per streamed response, used from a single thread.
 */
public final class ToolCallAccumulator {

    /** How a delta changed the running text. */
    public enum ContentChange {
        NONE,
        /** First text of the response; the caller materializes a message. */
        STARTED,
        /** More text for the message already materialized. */
        EXTENDED
    }

    private final StringBuilder             content = new StringBuilder();
    private final Map<Integer, PartialCall> calls   = new TreeMap<>();

    public ContentChange accept(Delta delta) {
        for (ToolCallFragment fragment : delta.toolCallFragments()) {
            calls.computeIfAbsent(fragment.index(), i -> new PartialCall()).merge(fragment);
        }

        if (!delta.hasContent()) return ContentChange.NONE;
        boolean first = content.length() == 0;
        content.append(delta.contentFragment());
        return first ? ContentChange.STARTED : ContentChange.EXTENDED;
    }

    /** Text accumulated so far. */
    public String content() {
        return content.toString();
    }

    public AssistantTurn finish() {
        List<PendingToolCall> toolCalls = new ArrayList<>(calls.size());
        calls.forEach((index, partial) -> toolCalls.add(partial.toPendingCall(index)));
        return new AssistantTurn(content.toString(), toolCalls);
    }

    private static final class PartialCall {

        private String              id        = "";
        private String              name      = "";
        private final StringBuilder arguments = new StringBuilder();

        void merge(ToolCallFragment fragment) {
            if (isPresent(fragment.id()))   id   = fragment.id();
            if (isPresent(fragment.name())) name = fragment.name();
            if (fragment.argumentsFragment() != null) arguments.append(fragment.argumentsFragment());
        }

        // a call whose id never arrived still needs one to correlate its result
        PendingToolCall toPendingCall(int index) {
            String callId = id.isEmpty() ? "call_" + index : id;
            return new PendingToolCall(callId, name, arguments.toString());
        }

        private static boolean isPresent(String value) {
            return value != null && !value.isEmpty();
        }
    }
}
