package com.openforge.mcpchat.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Turns text into a vector through an OpenAI-compatible /embeddings endpoint.
 *
 * One input per request. The tool index embeds a few hundred short texts on
 * a catalog change and one query per selection, so batching is not needed.
 */
@Slf4j
@Component
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingClient {

    private static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    /**
     * @param text truncated to {@value #MAX_INPUT_CHARS} characters
     * @throws EmbeddingException on transport, HTTP or parse failure
     */
    public List<Float> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        if (!isConfigured()) {
            throw new EmbeddingException("Embedding endpoint is not configured");
        }

        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        HttpResponse<String> response = post(new Request(input, props.model(), props.dimensions()));
        List<Float> vector = readVector(response);

        if (props.dimensions() != null && vector.size() != props.dimensions()) {
            log.warn("[Embed] Expected {} dimensions, provider returned {}", props.dimensions(), vector.size());
        }
        return vector;
    }

    // ── HTTP ─────────────────────────────────────────────────────────────────

    private HttpResponse<String> post(Request request) {
        String body;
        try {
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(props.embeddingsUrl()))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (props.apiKey() != null && !props.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + props.apiKey());
        }

        log.debug("[Embed] → model={} chars={}", props.model(), request.input().length());
        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling embedding API", e);
        }
    }

    private List<Float> readVector(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, response.body()));
        }

        Response parsed;
        try {
            parsed = objectMapper.readValue(response.body(), Response.class);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Unparsable embedding response", e);
        }
        if (parsed.data() == null || parsed.data().isEmpty() || parsed.data().get(0).embedding() == null) {
            throw new EmbeddingException("Embedding response contained no vector");
        }
        return parsed.data().get(0).embedding();
    }

    // ── Wire format ──────────────────────────────────────────────────────────

    /** {"input": "...", "model": "...", "dimensions": 1536}; dimensions only for models that accept it. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Request(String input, String model, Integer dimensions) {}

    /** {"data": [{"index": 0, "embedding": [..]}], ...}; other members are ignored. */
    record Response(List<Item> data) {

        record Item(int index, List<Float> embedding) {}
    }

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
