package com.openforge.mcpchat.conversation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** ConversationStore kept in a map; can be told to fail every write. */
class InMemoryConversationStore implements ConversationStore {

    private final Map<String, List<ConversationMessage>> data = new ConcurrentHashMap<>();
    private volatile boolean failWrites;

    void failWrites() {
        this.failWrites = true;
    }

    @Override
    public List<ConversationMessage> load(String conversationId) {
        return List.copyOf(data.getOrDefault(conversationId, List.of()));
    }

    @Override
    public void append(String conversationId, ConversationMessage message) {
        if (failWrites) {
            throw new IllegalStateException("database unavailable");
        }
        data.computeIfAbsent(conversationId, id -> new ArrayList<>()).add(message);
    }

    @Override
    public void clear(String conversationId) {
        data.remove(conversationId);
    }
}
