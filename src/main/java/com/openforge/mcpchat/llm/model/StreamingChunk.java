package com.openforge.mcpchat.llm.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One parsed "data:" frame of a streamed chat completion. Only the members
 * the loop reads are mapped:
 *
 *   {"choices":[{"delta":{"content":"Hel"}}]}
 *   {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_1",
 *                 "function":{"name":"search","arguments":"{\"q\""}}]}}]}
 */
public record StreamingChunk(List<Choice> choices) {

    /**
     * First choice as a {@link Delta}; null for frames without one (usage-only
     * trailers, keep-alives). Call indices come from {@code slots}, which
     * spans the whole response.
     */
    public Delta toDelta(ToolCallSlots slots) {
        if (choices == null || choices.isEmpty() || choices.get(0).delta() == null) {
            return null;
        }
        Choice.Payload payload = choices.get(0).delta();

        List<ToolCallFragment> fragments = new ArrayList<>();
        if (payload.toolCalls() != null) {
            for (Choice.ToolCallPiece piece : payload.toolCalls()) {
                Choice.FunctionPiece fn = piece.function();
                fragments.add(new ToolCallFragment(
                        slots.resolve(piece.index(), piece.id()),
                        piece.id(),
                        fn != null ? fn.name() : null,
                        fn != null ? fn.arguments() : null));
            }
        }
        return new Delta(payload.content(), fragments);
    }

    public record Choice(Payload delta, String finishReason) {

        /** Only the members that changed in this frame are present. */
        public record Payload(String content, List<ToolCallPiece> toolCalls) {}

        /** Some providers omit index and tell calls apart by id alone. */
        public record ToolCallPiece(Integer index, String id, FunctionPiece function) {}

        public record FunctionPiece(String name, String arguments) {}
    }
}
