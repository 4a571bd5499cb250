package com.openforge.mcpchat.conversation;

import com.openforge.mcpchat.mention.MentionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConversationServiceTest {

    private static final String CONVERSATION = "conv-1";

    private ConversationOrchestrator orchestrator;
    private ConversationStore store;
    private MentionService mentionService;
    private ExecutorService executor;
    private ConversationService service;

    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch started = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        orchestrator = mock(ConversationOrchestrator.class);
        store = mock(ConversationStore.class);
        mentionService = mock(MentionService.class);
        executor = Executors.newCachedThreadPool();
        service = new ConversationService(orchestrator, store, mentionService, executor);

        when(orchestrator.run(eq(CONVERSATION), any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return RunOutcome.completed(1, 0, "done");
        });
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void rejectsSecondMessageWhileRunInFlight() throws Exception {
        service.submit(CONVERSATION, "first");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.submit(CONVERSATION, "second"));
        assertEquals(HttpStatus.CONFLICT, e.getStatusCode());
        verify(orchestrator, times(1)).run(any(), any(), any());
    }

    @Test
    void acceptsNextMessageOnceRunFinished() throws Exception {
        CompletableFuture<RunOutcome> first = service.submit(CONVERSATION, "first");
        release.countDown();
        assertEquals(RunOutcome.Status.COMPLETED, first.get(5, TimeUnit.SECONDS).status());

        assertFalse(service.isProcessing(CONVERSATION));
        CompletableFuture<RunOutcome> second = service.submit(CONVERSATION, "second");
        assertEquals("done", second.get(5, TimeUnit.SECONDS).finalAnswer());
    }

    @Test
    void cancelFlipsTheTokenOfTheActiveRun() throws Exception {
        service.submit(CONVERSATION, "first");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(service.cancel(CONVERSATION));
        assertFalse(service.cancel("other-conversation"));
    }

    @Test
    void clearIsRejectedWhileRunning() throws Exception {
        service.submit(CONVERSATION, "first");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.clear(CONVERSATION));
        assertEquals(HttpStatus.CONFLICT, e.getStatusCode());
        verifyNoInteractions(store);
    }

    @Test
    void clearRemovesHistoryAndPins() {
        service.clear(CONVERSATION);

        verify(store).clear(CONVERSATION);
        verify(mentionService).clear(CONVERSATION);
    }
}
