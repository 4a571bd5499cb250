package com.openforge.mcpchat.mention;

import com.openforge.mcpchat.domain.ChatMention;
import com.openforge.mcpchat.repository.MentionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * User pins, scoped per conversation and persisted across sessions.
 *
 * The tool selector reads a fresh {@link #snapshot} at the start of each
 * selection, so a pin added mid-run takes effect on the next iteration and a
 * selection never sees a half-applied change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MentionService {

    private final MentionRepository repository;

    /** Pins in the order they were added. Empty if the store cannot be read. */
    @Transactional(readOnly = true)
    public List<Mention> snapshot(String conversationId) {
        try {
            return repository.findByConversationIdOrderByIdAsc(conversationId).stream()
                    .map(ChatMention::toMention)
                    .toList();
        } catch (RuntimeException e) {
            log.warn("[Mentions:{}] Could not read pins, continuing without: {}", conversationId, e.getMessage());
            return List.of();
        }
    }

    /**
     * Returns false when the pin already exists.
     *
     * Must not join an outer transaction. The insert commits in the
     * repository's own transaction, so a unique-key violation rolls back only
     * that insert and can be caught here; a joined transaction would be left
     * rollback-only and fail on commit.
     */
    public boolean add(String conversationId, Mention mention) {
        if (find(conversationId, mention) != null) {
            return false;
        }
        try {
            repository.save(ChatMention.of(conversationId, mention));
        } catch (DataIntegrityViolationException e) {
            // lost a race with an identical insert
            log.debug("[Mentions:{}] Duplicate pin {} ignored", conversationId, mention);
            return false;
        }
        log.info("[Mentions:{}] Pinned {} {} (server {})",
                conversationId, mention.kind(), mention.id(), mention.serverId());
        return true;
    }

    /** Returns false when there was no such pin. */
    @Transactional
    public boolean remove(String conversationId, Mention mention) {
        ChatMention existing = find(conversationId, mention);
        if (existing == null) {
            return false;
        }
        repository.delete(existing);
        log.info("[Mentions:{}] Unpinned {} {}", conversationId, mention.kind(), mention.id());
        return true;
    }

    @Transactional
    public void clear(String conversationId) {
        long removed = repository.deleteByConversationId(conversationId);
        log.debug("[Mentions:{}] Cleared {} pin(s)", conversationId, removed);
    }

    private ChatMention find(String conversationId, Mention mention) {
        return repository.findByConversationIdAndKindAndMentionIdAndServerId(
                conversationId, mention.kind(), mention.id(), mention.serverId()).orElse(null);
    }
}
