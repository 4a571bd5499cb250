package com.openforge.mcpchat.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpchat.catalog.CatalogSnapshot;
import com.openforge.mcpchat.conversation.PendingToolCall;
import com.openforge.mcpchat.conversation.RunCancellation;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Routes a reconstructed tool call to the server that owns it and runs it.
 *
 * Every failure is folded into a {@link ToolResult}; nothing thrown by the
 * backend escapes this class, so one bad call never takes down the run.
 *
 *   unknown tool        → "tool not found", no remote call
 *   malformed arguments → "invalid tool arguments: ...", no remote call
 *   remote failure      → the backend's message, with elapsed time
 *   no answer in time   → "tool timed out after ...", with elapsed time
 *   run cancelled       → "tool call cancelled", not submitted if already cancelled
 */
@Slf4j
@Service
public class ToolDispatcher {

    public static final String TOOL_NOT_FOUND      = "tool not found";
    public static final String TOOL_CALL_CANCELLED = "tool call cancelled";

    private final ToolInvoker     invoker;
    private final ObjectMapper    objectMapper;
    private final TimeLimiter     timeLimiter;
    private final ExecutorService executor;

    public ToolDispatcher(ToolInvoker invoker,
                          ObjectMapper objectMapper,
                          TimeLimiter toolCallTimeLimiter,
                          ExecutorService agentExecutor) {
        this.invoker      = invoker;
        this.objectMapper = objectMapper;
        this.timeLimiter  = toolCallTimeLimiter;
        this.executor     = agentExecutor;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ToolResult execute(PendingToolCall call, CatalogSnapshot catalog, RunCancellation cancellation) {
        String toolName = call.name();

        // ambiguous names resolve to the first server in catalog order
        String serverId = catalog.findServerFor(toolName).orElse(null);
        if (serverId == null) {
            log.warn("[Dispatcher] Tool {} not found on any connected server", toolName);
            return ToolResult.failure(call.id(), toolName, null, TOOL_NOT_FOUND, null);
        }

        JsonNode arguments;
        try {
            arguments = parseArguments(call.argumentsJson());
        } catch (IllegalArgumentException e) {
            log.warn("[Dispatcher] Rejected arguments for {}: {}", toolName, e.getMessage());
            return ToolResult.failure(call.id(), toolName, serverId,
                    "invalid tool arguments: " + e.getMessage(), null);
        }

        if (cancellation.isCancelled()) {
            log.debug("[Dispatcher] Run already cancelled, not submitting {}", toolName);
            return ToolResult.failure(call.id(), toolName, serverId, TOOL_CALL_CANCELLED, null);
        }

        log.info("[Dispatcher] Executing tool {} on server {}", toolName, serverId);
        long start = System.nanoTime();

        CompletableFuture<JsonNode> future = CompletableFuture.supplyAsync(
                () -> invoker.invoke(serverId, toolName, arguments), executor);

        try (RunCancellation.Registration ignored = cancellation.onCancel(() -> future.cancel(true))) {
            JsonNode payload = timeLimiter.executeFutureSupplier(() -> future);
            long elapsed = elapsedMs(start);
            log.debug("[Dispatcher] Tool {} completed in {}ms", toolName, elapsed);
            return ToolResult.success(call.id(), toolName, serverId, serialize(payload), elapsed);
        } catch (TimeoutException e) {
            log.warn("[Dispatcher] Tool {} timed out after {}", toolName,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            return ToolResult.failure(call.id(), toolName, serverId,
                    "tool timed out after %ds".formatted(
                            timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toSeconds()),
                    elapsedMs(start));
        } catch (CancellationException e) {
            return ToolResult.failure(call.id(), toolName, serverId, TOOL_CALL_CANCELLED, elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure(call.id(), toolName, serverId, "tool call interrupted", elapsedMs(start));
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            String message = cause.getMessage() != null ? cause.getMessage() : "Tool execution failed";
            log.warn("[Dispatcher] Tool {} failed: {}", toolName, message);
            return ToolResult.failure(call.id(), toolName, serverId, message, elapsedMs(start));
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Blank arguments mean "no arguments"; anything else must be a JSON object.
     * Only well-formedness is checked, not the tool's schema.
     */
    JsonNode parseArguments(String argumentsJson) {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(argumentsJson);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("arguments must be a JSON object");
        }
        return node;
    }

    private String serialize(JsonNode payload) throws JsonProcessingException {
        return objectMapper.writeValueAsString(payload);
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
