package com.openforge.mcpchat.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpchat.llm.model.ChatRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * Stateless client for one OpenAI-compatible provider.
 *
 * {@link #openStream(ChatRequest)} sends a streaming request and hands back
 * a {@link CompletionStream} over the SSE body. The connection stays open
 * until the stream is drained or closed; closing it from another thread is
 * how a run is cancelled mid-response.
 */
@Slf4j
public class LlmClient {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Opens a streaming chat completion.
     *
     * @param request a blank model falls back to this provider's configured model
     * @return open stream of deltas
     * @throws LlmRateLimitException on HTTP 429
     * @throws LlmException          on network errors or any other non-2xx status
     */
    public CompletionStream openStream(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }

        String model = request.model();
        if (model == null || model.isBlank()) {
            model = config.model();
        }
        ChatRequest effectiveRequest = request.toBuilder().model(model).stream(true).build();

        String requestBody = serialize(effectiveRequest);
        log.debug("[LlmClient:{}] → stream POST body-length={} tools={}", config.name(),
                requestBody.length(), effectiveRequest.tools() == null ? 0 : effectiveRequest.tools().size());

        HttpResponse<Stream<String>> httpResponse;
        try {
            httpResponse = httpClient.send(
                    buildHttpRequest(requestBody),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]"
                    .formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while opening stream to provider [%s]"
                    .formatted(config.name()), e);
        }

        int status = httpResponse.statusCode();
        if (status == 429) {
            closeQuietly(httpResponse.body());
            throw new LlmRateLimitException(
                    "Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            String bodySnippet = readSnippet(httpResponse.body());
            throw new LlmException(
                    "Provider [%s] returned HTTP %d on stream open: %s"
                            .formatted(config.name(), status, bodySnippet));
        }

        return new SseCompletionStream(httpResponse.body(), objectMapper, config.name());
    }

    /** The model name configured for this provider (e.g. "gpt-4o"). */
    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.completionsUrl()))
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    /** Error bodies of OpenAI-compatible APIs carry the reason; keep the first lines for the log. */
    private static String readSnippet(Stream<String> lines) {
        if (lines == null) return "";
        try (lines) {
            return lines.limit(20).reduce(
                    new StringBuilder(),
                    (sb, line) -> {
                        if (sb.length() > 0) sb.append('\n');
                        if (sb.length() < 2048) {
                            sb.append(line);
                        }
                        return sb;
                    },
                    StringBuilder::append
            ).toString();
        }
    }

    private static void closeQuietly(Stream<String> lines) {
        if (lines != null) lines.close();
    }

    private String serialize(ChatRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize streaming request", e);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
