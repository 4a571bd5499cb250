package com.openforge.mcpchat.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpchat.domain.ChatMessageRecord;
import com.openforge.mcpchat.repository.ChatMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ConversationStore} on the chat_messages table, one row per message
 * with the message itself stored as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaConversationStore implements ConversationStore {

    private final ChatMessageRepository repository;
    private final ObjectMapper          objectMapper;

    @Override
    @Transactional(readOnly = true)
    public List<ConversationMessage> load(String conversationId) {
        List<ConversationMessage> messages = new ArrayList<>();
        for (ChatMessageRecord row : repository.findByConversationIdOrderBySequenceAsc(conversationId)) {
            try {
                messages.add(objectMapper.readValue(row.getPayload(), ConversationMessage.class));
            } catch (JsonProcessingException e) {
                log.error("[Store:{}] Skipping unreadable message #{}: {}",
                        conversationId, row.getSequence(), e.getOriginalMessage());
            }
        }
        return messages;
    }

    @Override
    @Transactional
    public void append(String conversationId, ConversationMessage message) {
        int next = repository.findTopByConversationIdOrderBySequenceDesc(conversationId)
                .map(row -> row.getSequence() + 1)
                .orElse(0);

        repository.save(ChatMessageRecord.builder()
                .conversationId(conversationId)
                .sequence(next)
                .role(message.role().name())
                .payload(serialize(message))
                .build());
    }

    @Override
    @Transactional
    public void clear(String conversationId) {
        long removed = repository.deleteByConversationId(conversationId);
        log.info("[Store:{}] Cleared {} message(s)", conversationId, removed);
    }

    private String serialize(ConversationMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversation message", e);
        }
    }
}
