package com.openforge.mcpchat.repository;

import com.openforge.mcpchat.domain.ChatMessageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessageRecord, Long> {

    List<ChatMessageRecord> findByConversationIdOrderBySequenceAsc(String conversationId);

    Optional<ChatMessageRecord> findTopByConversationIdOrderBySequenceDesc(String conversationId);

    long deleteByConversationId(String conversationId);
}
