package com.openforge.mcpchat.conversation;

import com.openforge.mcpchat.mention.MentionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the lifecycle of runs: at most one in flight per conversation.
 *
 * A run is started on the shared agent executor so the HTTP thread returns
 * immediately; progress arrives over the conversation's event topic. The
 * in-flight map is both the re-entrancy guard and the handle used to cancel.
 */
@Slf4j
@Service
public class ConversationService {

    private final ConversationOrchestrator orchestrator;
    private final ConversationStore        store;
    private final MentionService           mentionService;
    private final ExecutorService          executor;

    private final Map<String, RunCancellation> activeRuns = new ConcurrentHashMap<>();

    public ConversationService(ConversationOrchestrator orchestrator,
                               ConversationStore store,
                               MentionService mentionService,
                               ExecutorService agentExecutor) {
        this.orchestrator   = orchestrator;
        this.store          = store;
        this.mentionService = mentionService;
        this.executor       = agentExecutor;
    }

    /**
     * Starts a run for the message.
     *
     * @throws ResponseStatusException 409 if a run is already in flight for this conversation
     */
    public CompletableFuture<RunOutcome> submit(String conversationId, String userText) {
        RunCancellation cancellation = new RunCancellation();
        if (activeRuns.putIfAbsent(conversationId, cancellation) != null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "A response is already being generated for conversation " + conversationId);
        }

        try {
            return CompletableFuture.supplyAsync(() -> runGuarded(conversationId, userText, cancellation), executor);
        } catch (RejectedExecutionException e) {
            activeRuns.remove(conversationId, cancellation);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Executor is shutting down", e);
        }
    }

    public boolean isProcessing(String conversationId) {
        return activeRuns.containsKey(conversationId);
    }

    /** Returns false when nothing was running. */
    public boolean cancel(String conversationId) {
        RunCancellation cancellation = activeRuns.get(conversationId);
        if (cancellation == null) {
            return false;
        }
        log.info("[Conversation:{}] Cancel requested", conversationId);
        return cancellation.cancel();
    }

    public List<ConversationMessage> history(String conversationId) {
        return store.load(conversationId);
    }

    /**
     * Forgets the history and pins of a conversation.
     *
     * @throws ResponseStatusException 409 while a run is in flight
     */
    public void clear(String conversationId) {
        if (isProcessing(conversationId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Cannot clear conversation " + conversationId + " while a response is being generated");
        }
        store.clear(conversationId);
        mentionService.clear(conversationId);
        log.info("[Conversation:{}] Cleared", conversationId);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private RunOutcome runGuarded(String conversationId, String userText, RunCancellation cancellation) {
        try {
            return orchestrator.run(conversationId, userText, cancellation);
        } finally {
            activeRuns.remove(conversationId, cancellation);
        }
    }
}
