package com.openforge.mcpchat.conversation;

import java.util.List;

/**
 * Append-only sink for the visible history of a conversation.
 *
 * Callers treat failures as non-fatal: a run keeps going even when a write
 * is lost.
 */
public interface ConversationStore {

    /** Stored history, oldest first. Empty for an unknown conversation. */
    List<ConversationMessage> load(String conversationId);

    void append(String conversationId, ConversationMessage message);

    void clear(String conversationId);
}
