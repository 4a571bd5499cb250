package com.openforge.mcpchat.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpchat.config.AppConfig;
import com.openforge.mcpchat.conversation.PendingToolCall;
import com.openforge.mcpchat.conversation.ToolCallAccumulator;
import com.openforge.mcpchat.llm.model.Delta;
import com.openforge.mcpchat.llm.model.ToolCallFragment;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SseCompletionStreamTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();

    @Test
    void yieldsContentFragmentsUntilDone() {
        SseCompletionStream stream = open(
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"role\":\"assistant\"}}]}",
                "",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Hel\"}}]}",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"lo\"}}]}",
                "data: [DONE]",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"ignored\"}}]}");

        List<Delta> deltas = drain(stream);

        assertEquals(2, deltas.size());
        assertEquals("Hel", deltas.get(0).contentFragment());
        assertEquals("lo", deltas.get(1).contentFragment());
    }

    @Test
    void mapsToolCallFragments() {
        SseCompletionStream stream = open(
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":1,\"id\":\"call_1\","
                        + "\"type\":\"function\",\"function\":{\"name\":\"search\",\"arguments\":\"\"}}]}}]}",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":1,"
                        + "\"function\":{\"arguments\":\"{\\\"q\\\":1}\"}}]}}]}",
                "data: [DONE]");

        List<Delta> deltas = drain(stream);

        assertEquals(2, deltas.size());
        ToolCallFragment first = deltas.get(0).toolCallFragments().get(0);
        assertEquals(1, first.index());
        assertEquals("call_1", first.id());
        assertEquals("search", first.name());
        ToolCallFragment second = deltas.get(1).toolCallFragments().get(0);
        assertNull(second.id());
        assertEquals("{\"q\":1}", second.argumentsFragment());
    }

    @Test
    void callsStreamedWithoutIndexStaySeparate() {
        SseCompletionStream stream = open(
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"id\":\"call_a\","
                        + "\"function\":{\"name\":\"search\",\"arguments\":\"{\\\"q\\\"\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{"
                        + "\"function\":{\"arguments\":\":1}\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"id\":\"call_b\","
                        + "\"function\":{\"name\":\"fetch\",\"arguments\":\"{}\"}}]}}]}",
                "data: [DONE]");

        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        drain(stream).forEach(accumulator::accept);
        List<PendingToolCall> calls = accumulator.finish().toolCalls();

        assertEquals(2, calls.size());
        assertEquals(new PendingToolCall("call_a", "search", "{\"q\":1}"), calls.get(0));
        assertEquals(new PendingToolCall("call_b", "fetch", "{}"), calls.get(1));
    }

    @Test
    void skipsUnparsableFramesAndComments() {
        SseCompletionStream stream = open(
                ": keep-alive",
                "data: {not json",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"ok\"}}]}");

        List<Delta> deltas = drain(stream);

        assertEquals(1, deltas.size());
        assertEquals("ok", deltas.get(0).contentFragment());
    }

    @Test
    void brokenConnectionSurfacesAsLlmException() {
        Stream<String> lines = Stream.of("data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"a\"}}]}", "boom")
                .map(line -> {
                    if (line.equals("boom")) throw new UncheckedIOException(new IOException("reset"));
                    return line;
                });
        SseCompletionStream stream = new SseCompletionStream(lines, objectMapper, "test");

        assertEquals("a", stream.next().contentFragment());
        assertThrows(LlmClient.LlmException.class, stream::hasNext);
    }

    @Test
    void closeReleasesUnderlyingLinesAndEndsStream() {
        AtomicBoolean released = new AtomicBoolean();
        Stream<String> lines = Stream.of("data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"a\"}}]}")
                .onClose(() -> released.set(true));
        SseCompletionStream stream = new SseCompletionStream(lines, objectMapper, "test");

        stream.close();

        assertTrue(released.get());
        assertFalse(stream.hasNext());
    }

    private SseCompletionStream open(String... lines) {
        return new SseCompletionStream(Stream.of(lines), objectMapper, "test");
    }

    private static List<Delta> drain(SseCompletionStream stream) {
        List<Delta> deltas = new ArrayList<>();
        while (stream.hasNext()) {
            deltas.add(stream.next());
        }
        return deltas;
    }
}
