package com.openforge.mcpchat.repository;

import com.openforge.mcpchat.domain.ChatMention;
import com.openforge.mcpchat.mention.MentionKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MentionRepository extends JpaRepository<ChatMention, Long> {

    List<ChatMention> findByConversationIdOrderByIdAsc(String conversationId);

    Optional<ChatMention> findByConversationIdAndKindAndMentionIdAndServerId(
            String conversationId, MentionKind kind, String mentionId, String serverId);

    long deleteByConversationId(String conversationId);
}
