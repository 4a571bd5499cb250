package com.openforge.mcpchat.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpchat.llm.model.Delta;
import com.openforge.mcpchat.llm.model.StreamingChunk;
import com.openforge.mcpchat.llm.model.ToolCallSlots;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * Pulls deltas out of an OpenAI-style SSE line stream.
 *
 * Parsing rules:
 *   1. Skip empty lines and lines that are not "data:" frames
 *   2. "data: [DONE]" ends the stream
 *   3. Unparsable frames are logged and skipped
 *   4. Frames without content or tool-call data (role-only, finish) are skipped
 */
@Slf4j
class SseCompletionStream implements CompletionStream {

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE        = "[DONE]";

    // identity sentinel, never handed out
    private static final Delta DONE_MARKER = new Delta(null, null);

    private final Stream<String>   lines;
    private final Iterator<String> iterator;
    private final ObjectMapper     objectMapper;
    private final String           providerName;
    private final ToolCallSlots    slots = new ToolCallSlots();

    private Delta            pending;
    private boolean          finished;
    private volatile boolean closed;

    SseCompletionStream(Stream<String> lines, ObjectMapper objectMapper, String providerName) {
        this.lines        = lines;
        this.iterator     = lines.iterator();
        this.objectMapper = objectMapper;
        this.providerName = providerName;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) return true;
        if (finished || closed) return false;

        try {
            while (!closed && iterator.hasNext()) {
                Delta delta = parse(iterator.next());
                if (delta == DONE_MARKER) break;
                if (delta != null) {
                    pending = delta;
                    return true;
                }
            }
        } catch (UncheckedIOException e) {
            if (closed) return false;
            throw new LlmClient.LlmException(
                    "Stream from provider [%s] broke mid-response".formatted(providerName), e);
        }

        finished = true;
        close();
        return false;
    }

    @Override
    public Delta next() {
        if (!hasNext()) throw new NoSuchElementException("Stream exhausted");
        Delta delta = pending;
        pending = null;
        return delta;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        lines.close();
    }

    private Delta parse(String line) {
        if (line == null || line.isEmpty() || !line.startsWith(SSE_DATA_PREFIX)) return null;

        String json = line.substring(SSE_DATA_PREFIX.length()).trim();
        if (SSE_DONE.equals(json)) return DONE_MARKER;

        StreamingChunk chunk;
        try {
            chunk = objectMapper.readValue(json, StreamingChunk.class);
        } catch (JsonProcessingException e) {
            log.warn("[LlmClient:{}] Failed to parse SSE chunk: {}", providerName, json);
            return null;
        }

        Delta delta = chunk.toDelta(slots);
        if (delta == null || (!delta.hasContent() && !delta.hasToolCallFragments())) return null;
        return delta;
    }
}
