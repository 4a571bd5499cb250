package com.openforge.mcpchat.mention;

import com.openforge.mcpchat.domain.ChatMention;
import com.openforge.mcpchat.repository.MentionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Transactional;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MentionServiceTest {

    private static final String CONVERSATION = "conv-1";

    private MentionRepository repository;
    private MentionService service;

    @BeforeEach
    void setUp() {
        repository = mock(MentionRepository.class);
        service = new MentionService(repository);
    }

    // ===== Snapshot =====

    @Test
    void snapshotPreservesInsertionOrder() {
        when(repository.findByConversationIdOrderByIdAsc(CONVERSATION)).thenReturn(List.of(
                ChatMention.of(CONVERSATION, Mention.server("github")),
                ChatMention.of(CONVERSATION, Mention.tool("post_message", "slack"))));

        List<Mention> pins = service.snapshot(CONVERSATION);

        assertEquals(List.of(Mention.server("github"), Mention.tool("post_message", "slack")), pins);
    }

    @Test
    void unreadableStoreYieldsNoPins() {
        when(repository.findByConversationIdOrderByIdAsc(CONVERSATION))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertTrue(service.snapshot(CONVERSATION).isEmpty());
    }

    // ===== Add / remove =====

    @Test
    void addPersistsNewPin() {
        Mention pin = Mention.tool("search_issues", "github");
        when(repository.findByConversationIdAndKindAndMentionIdAndServerId(
                CONVERSATION, MentionKind.TOOL, "search_issues", "github")).thenReturn(Optional.empty());

        assertTrue(service.add(CONVERSATION, pin));

        ArgumentCaptor<ChatMention> saved = ArgumentCaptor.forClass(ChatMention.class);
        verify(repository).save(saved.capture());
        assertEquals(CONVERSATION, saved.getValue().getConversationId());
        assertEquals(pin, saved.getValue().toMention());
    }

    @Test
    void addingExistingPinIsNoOp() {
        Mention pin = Mention.server("github");
        when(repository.findByConversationIdAndKindAndMentionIdAndServerId(
                CONVERSATION, MentionKind.SERVER, "github", "github"))
                .thenReturn(Optional.of(ChatMention.of(CONVERSATION, pin)));

        assertFalse(service.add(CONVERSATION, pin));
        verify(repository, never()).save(any());
    }

    @Test
    void concurrentDuplicateInsertIsNoOp() {
        when(repository.findByConversationIdAndKindAndMentionIdAndServerId(any(), any(), any(), any()))
                .thenReturn(Optional.empty());
        when(repository.save(any())).thenThrow(new DataIntegrityViolationException("uq_chat_mention"));

        assertFalse(service.add(CONVERSATION, Mention.server("github")));
    }

    @Test
    void addDoesNotOpenItsOwnTransaction() throws NoSuchMethodException {
        // a caught constraint violation inside a shared transaction would fail the commit
        Method add = MentionService.class.getMethod("add", String.class, Mention.class);

        assertFalse(add.isAnnotationPresent(Transactional.class));
        assertFalse(MentionService.class.isAnnotationPresent(Transactional.class));
    }

    @Test
    void removeDeletesExistingPin() {
        Mention pin = Mention.server("github");
        ChatMention stored = ChatMention.of(CONVERSATION, pin);
        when(repository.findByConversationIdAndKindAndMentionIdAndServerId(
                CONVERSATION, MentionKind.SERVER, "github", "github")).thenReturn(Optional.of(stored));

        assertTrue(service.remove(CONVERSATION, pin));
        verify(repository).delete(stored);
    }

    @Test
    void removingAbsentPinReportsFalse() {
        when(repository.findByConversationIdAndKindAndMentionIdAndServerId(any(), any(), any(), any()))
                .thenReturn(Optional.empty());

        assertFalse(service.remove(CONVERSATION, Mention.tool("missing", "github")));
        verify(repository, never()).delete(any());
    }

    @Test
    void clearDeletesEveryPinOfTheConversation() {
        service.clear(CONVERSATION);

        verify(repository).deleteByConversationId(CONVERSATION);
    }
}
