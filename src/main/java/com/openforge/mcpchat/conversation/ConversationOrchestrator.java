package com.openforge.mcpchat.conversation;

import com.openforge.mcpchat.catalog.CatalogSnapshot;
import com.openforge.mcpchat.catalog.ToolCatalog;
import com.openforge.mcpchat.conversation.event.ChatEvent;
import com.openforge.mcpchat.dispatch.ToolDispatcher;
import com.openforge.mcpchat.dispatch.ToolResult;
import com.openforge.mcpchat.llm.CompletionStream;
import com.openforge.mcpchat.llm.StreamingCompletionClient;
import com.openforge.mcpchat.llm.model.Delta;
import com.openforge.mcpchat.llm.model.Message;
import com.openforge.mcpchat.mention.MentionService;
import com.openforge.mcpchat.selection.ToolSelection;
import com.openforge.mcpchat.selection.ToolSelector;
import com.openforge.mcpchat.websocket.ChatEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * The tool-augmented chat loop for one user message.
 *
 * Loop shape:
 *   IDLE
 *    └─ per iteration (at most MAX_ITERATIONS):
 *         SELECTING   — snapshot catalog + pins, pick the tools to expose
 *         STREAMING   — stream the model's answer into the accumulator,
 *                       mirroring text into the streaming history message
 *         no tool calls → FINALIZING → IDLE  (the text is the answer)
 *         tool calls    → DISPATCHING: run each call in request order, fold
 *                         the results into the transcript, loop
 *    └─ after the last allowed iteration still requests tools:
 *         FINALIZING with the truncation notice → IDLE
 *
 *   Any failure of the completion stream → ABORTED → IDLE. Content already
 *   shown is kept and one error message is appended. Tool failures never
 *   get here: the dispatcher folds them into the ToolResult the model sees.
 *
 * Two transcripts are maintained side by side. The provider transcript
 * (List of Message) is what the model sees. The visible history
 * ({@link ConversationHistory}) also carries selection reports and notices,
 * which are never sent to the model.
 */
@Slf4j
@Service
@EnableConfigurationProperties(ChatProperties.class)
public class ConversationOrchestrator {

    public static final int MAX_ITERATIONS = 10;

    static final String EMPTY_COMPLETION_TEXT = "I apologize, I could not generate a response.";
    static final String TRUNCATION_NOTICE     =
            "Reached maximum tool execution depth. The conversation may be incomplete.";
    static final String CANCELLED_NOTICE      = "Response cancelled.";

    private final ToolCatalog               toolCatalog;
    private final ToolSelector              toolSelector;
    private final StreamingCompletionClient completionClient;
    private final ToolDispatcher            toolDispatcher;
    private final ConversationStore         store;
    private final MentionService            mentionService;
    private final ChatEventPublisher        events;
    private final ChatProperties            properties;

    public ConversationOrchestrator(ToolCatalog toolCatalog,
                                    ToolSelector toolSelector,
                                    StreamingCompletionClient completionClient,
                                    ToolDispatcher toolDispatcher,
                                    ConversationStore store,
                                    MentionService mentionService,
                                    ChatEventPublisher events,
                                    ChatProperties properties) {
        this.toolCatalog      = toolCatalog;
        this.toolSelector     = toolSelector;
        this.completionClient = completionClient;
        this.toolDispatcher   = toolDispatcher;
        this.store            = store;
        this.mentionService   = mentionService;
        this.events           = events;
        this.properties       = properties;
    }

    // ── Entry point ──────────────────────────────────────────────────────────

    /**
     * Runs the loop for one user message. Never throws: every way a run can
     * end is reported through the returned outcome, the history and events.
     */
    public RunOutcome run(String conversationId, String userText, RunCancellation cancellation) {
        Run run = new Run(conversationId, cancellation,
                new ConversationHistory(conversationId, store, events));
        log.info("[Orchestrator:{}] Run started ({} prior message(s))",
                conversationId, run.history.messages().size());

        try {
            List<Message> transcript = buildTranscript(run.history.messages());
            run.history.append(ConversationMessage.user(userText), 0);
            transcript.add(Message.user(userText));

            return loop(run, transcript);

        } catch (RunCancelledException e) {
            return endCancelled(run);

        } catch (RuntimeException e) {
            if (cancellation.isCancelled()) {
                // closing the stream on cancel can surface as a read failure
                log.debug("[Orchestrator:{}] Ignoring failure after cancel: {}", conversationId, e.getMessage());
                return endCancelled(run);
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[Orchestrator:{}] Run aborted at iteration {}: {}", conversationId, run.iteration, message, e);
            transition(run, OrchestratorState.ABORTED);
            keepPartialMessage(run);
            run.history.append(ConversationMessage.error("Error: " + message), run.iteration);
            events.publish(ChatEvent.error(conversationId, message, run.iteration));
            return RunOutcome.aborted(run.iteration, run.toolInvocations, message);

        } finally {
            transition(run, OrchestratorState.IDLE);
        }
    }

    // ── Main loop ────────────────────────────────────────────────────────────

    private RunOutcome loop(Run run, List<Message> transcript) {
        String conversationId = run.conversationId;

        while (true) {
            run.cancellation.throwIfCancelled();
            run.iteration++;
            events.publish(ChatEvent.iterationStart(conversationId, run.iteration));
            log.debug("[Orchestrator:{}] Iteration {}", conversationId, run.iteration);

            // ── SELECTING ────────────────────────────────────────────────────
            transition(run, OrchestratorState.SELECTING);
            CatalogSnapshot catalog   = toolCatalog.snapshot();
            ToolSelection   selection = toolSelector.select(
                    transcript, catalog, mentionService.snapshot(conversationId));
            if (selection.metrics() != null) {
                run.history.append(ConversationMessage.filterMetrics(selection.metrics()), run.iteration);
            }
            events.publish(ChatEvent.toolsSelected(conversationId, selection, catalog.totalTools(), run.iteration));

            // ── STREAMING ────────────────────────────────────────────────────
            transition(run, OrchestratorState.STREAMING);
            AssistantTurn turn = streamTurn(run, transcript, selection);

            if (!turn.hasToolCalls()) {
                // ── FINALIZING: answer ───────────────────────────────────────
                transition(run, OrchestratorState.FINALIZING);
                String answer = turn.content();
                if (turn.isEmpty()) {
                    log.warn("[Orchestrator:{}] Empty completion at iteration {}", conversationId, run.iteration);
                    run.history.append(ConversationMessage.notice(EMPTY_COMPLETION_TEXT), run.iteration);
                    answer = EMPTY_COMPLETION_TEXT;
                }
                events.publish(ChatEvent.finalAnswer(conversationId, answer, run.iteration));
                log.info("[Orchestrator:{}] Completed in {} iteration(s), {} tool call(s)",
                        conversationId, run.iteration, run.toolInvocations);
                return RunOutcome.completed(run.iteration, run.toolInvocations, answer);
            }

            // ── DISPATCHING ──────────────────────────────────────────────────
            transition(run, OrchestratorState.DISPATCHING);
            dispatch(run, transcript, turn, catalog);

            if (run.iteration >= MAX_ITERATIONS) {
                // ── FINALIZING: truncated ────────────────────────────────────
                transition(run, OrchestratorState.FINALIZING);
                log.warn("[Orchestrator:{}] Max iterations ({}) reached with tool calls still pending",
                        conversationId, MAX_ITERATIONS);
                run.history.append(ConversationMessage.notice(TRUNCATION_NOTICE), run.iteration);
                events.publish(ChatEvent.iterationLimit(conversationId, TRUNCATION_NOTICE, run.iteration));
                return RunOutcome.iterationLimit(run.iteration, run.toolInvocations);
            }
        }
    }

    /**
     * Streams one model response. The first text fragment materializes the
     * assistant message; later ones update it in place. Closing the stream on
     * cancel unblocks a pending read.
     */
    private AssistantTurn streamTurn(Run run, List<Message> transcript, ToolSelection selection) {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        run.accumulator = accumulator;

        try (CompletionStream stream = completionClient.stream(List.copyOf(transcript), selection.providerTools());
             RunCancellation.Registration ignored = run.cancellation.onCancel(stream::close)) {

            while (stream.hasNext()) {
                run.cancellation.throwIfCancelled();
                Delta delta = stream.next();
                switch (accumulator.accept(delta)) {
                    case STARTED  -> run.history.beginStreaming(
                            ConversationMessage.assistant(accumulator.content()), run.iteration);
                    case EXTENDED -> run.history.updateStreaming(accumulator.content());
                    case NONE     -> { }
                }
                if (delta.hasContent()) {
                    events.publish(ChatEvent.messageDelta(run.conversationId, delta.contentFragment(), run.iteration));
                }
            }
            // a cancelled stream ends quietly; make sure it is not taken for an answer
            run.cancellation.throwIfCancelled();
        }

        AssistantTurn turn = accumulator.finish();
        run.accumulator = null;
        log.debug("[Orchestrator:{}] Stream finished: {} char(s), {} tool call(s)",
                run.conversationId, turn.content().length(), turn.toolCalls().size());

        if (turn.hasToolCalls()) {
            ConversationMessage message = ConversationMessage.assistantWithToolCalls(turn.content(), turn.toolCalls());
            if (run.history.isStreaming()) {
                run.history.finishStreaming(message, run.iteration);
            } else {
                run.history.append(message, run.iteration);
            }
        } else if (run.history.isStreaming()) {
            run.history.finishStreaming(ConversationMessage.assistant(turn.content()), run.iteration);
        }
        return turn;
    }

    /** Runs the calls one at a time so results reach the model in request order. */
    private void dispatch(Run run, List<Message> transcript, AssistantTurn turn, CatalogSnapshot catalog) {
        transcript.add(Message.assistantToolCalls(
                turn.hasContent() ? turn.content() : null,
                turn.toolCalls().stream().map(PendingToolCall::toProviderToolCall).toList()));

        for (PendingToolCall call : turn.toolCalls()) {
            // tools are not assumed idempotent: nothing further goes out once the run is cancelled
            run.cancellation.throwIfCancelled();
            events.publish(ChatEvent.toolCall(run.conversationId, call, run.iteration));

            ToolResult result = toolDispatcher.execute(call, catalog, run.cancellation);
            run.toolInvocations++;

            run.history.append(ConversationMessage.tool(result), run.iteration);
            transcript.add(Message.toolResult(call.id(), result.toProviderContent()));
            events.publish(ChatEvent.toolResult(run.conversationId, result, run.iteration));
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Provider transcript for a new run: system prompt, earlier user messages
     * and earlier assistant text. Earlier tool traffic is not replayed.
     */
    List<Message> buildTranscript(List<ConversationMessage> history) {
        List<Message> transcript = new ArrayList<>();
        transcript.add(Message.system(properties.systemPrompt()));
        for (ConversationMessage message : history) {
            if (message.synthetic()) continue;
            switch (message.role()) {
                case USER -> transcript.add(Message.user(message.content()));
                case ASSISTANT -> {
                    if (message.content() != null && !message.content().isBlank()) {
                        transcript.add(Message.assistantText(message.content()));
                    }
                }
                default -> { }
            }
        }
        return transcript;
    }

    private RunOutcome endCancelled(Run run) {
        log.info("[Orchestrator:{}] Run cancelled at iteration {}", run.conversationId, run.iteration);
        keepPartialMessage(run);
        run.history.append(ConversationMessage.notice(CANCELLED_NOTICE), run.iteration);
        return RunOutcome.cancelled(run.iteration, run.toolInvocations);
    }

    /** Persists whatever text streamed before the run ended. */
    private void keepPartialMessage(Run run) {
        if (run.history.isStreaming() && run.accumulator != null) {
            run.history.finishStreaming(ConversationMessage.assistant(run.accumulator.content()), run.iteration);
        }
    }

    private void transition(Run run, OrchestratorState next) {
        events.publish(ChatEvent.stateChange(run.conversationId, next, run.iteration));
    }

    /** Mutable state of one run; discarded when the run returns. */
    private static final class Run {

        final String              conversationId;
        final RunCancellation     cancellation;
        final ConversationHistory history;

        ToolCallAccumulator accumulator;
        int                 iteration;
        int                 toolInvocations;

        Run(String conversationId, RunCancellation cancellation, ConversationHistory history) {
            this.conversationId = conversationId;
            this.cancellation   = cancellation;
            this.history        = history;
        }
    }
}
