package com.openforge.mcpchat.conversation;

import com.openforge.mcpchat.conversation.event.ChatEvent;
import com.openforge.mcpchat.websocket.ChatEventPublisher;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The visible history of one conversation during a run.
 *
 * Single writer: only the run that loaded it appends. Every append is
 * persisted and announced; persistence failures are logged and the in-memory
 * history stays authoritative for the rest of the run.
 *
 * The newest message may be "streaming": it is materialized when the first
 * text fragment arrives, updated in place while fragments keep coming, and
 * persisted once when {@link #finishStreaming} fixes its final form.
 */
@Slf4j
public class ConversationHistory {

    private final String                    conversationId;
    private final ConversationStore         store;
    private final ChatEventPublisher        events;
    private final List<ConversationMessage> messages;

    private boolean streaming;

    public ConversationHistory(String conversationId, ConversationStore store, ChatEventPublisher events) {
        this.conversationId = conversationId;
        this.store          = store;
        this.events         = events;
        this.messages       = new ArrayList<>(loadQuietly());
    }

    public List<ConversationMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public void append(ConversationMessage message, int iteration) {
        if (streaming) {
            throw new IllegalStateException("Cannot append while a message is streaming");
        }
        messages.add(message);
        persist(message);
        events.publish(ChatEvent.messageAppended(conversationId, message, iteration));
    }

    // ── Streaming message ────────────────────────────────────────────────────

    public boolean isStreaming() {
        return streaming;
    }

    public void beginStreaming(ConversationMessage message, int iteration) {
        if (streaming) {
            throw new IllegalStateException("A message is already streaming");
        }
        messages.add(message);
        streaming = true;
        events.publish(ChatEvent.messageAppended(conversationId, message, iteration));
    }

    /** Replaces the streaming message's text with the full text so far. */
    public void updateStreaming(String content) {
        requireStreaming();
        int last = messages.size() - 1;
        messages.set(last, messages.get(last).withContent(content));
    }

    public void finishStreaming(ConversationMessage finalMessage, int iteration) {
        requireStreaming();
        messages.set(messages.size() - 1, finalMessage);
        streaming = false;
        persist(finalMessage);
        events.publish(ChatEvent.messageUpdated(conversationId, finalMessage, iteration));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void requireStreaming() {
        if (!streaming) {
            throw new IllegalStateException("No message is streaming");
        }
    }

    private List<ConversationMessage> loadQuietly() {
        try {
            return store.load(conversationId);
        } catch (RuntimeException e) {
            log.warn("[History:{}] Could not load stored history, starting empty: {}",
                    conversationId, e.getMessage());
            return List.of();
        }
    }

    private void persist(ConversationMessage message) {
        try {
            store.append(conversationId, message);
        } catch (RuntimeException e) {
            log.warn("[History:{}] Failed to persist {} message, continuing: {}",
                    conversationId, message.role(), e.getMessage());
        }
    }
}
