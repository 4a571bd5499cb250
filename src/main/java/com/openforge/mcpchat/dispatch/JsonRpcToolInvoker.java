package com.openforge.mcpchat.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ToolInvoker} speaking JSON-RPC 2.0 "tools/call" over HTTP.
 *
 * Request:
 *   {"jsonrpc":"2.0","id":7,"method":"tools/call",
 *    "params":{"name":"search_issues","arguments":{...}}}
 *
 * Failure mapping:
 *   - transport error / non-2xx         → ToolInvocationException
 *   - JSON-RPC "error" member           → ToolInvocationException(error.message)
 *   - result with "isError": true       → ToolInvocationException(joined text content)
 *
 * The endpoint is expected to already hold an initialized session with the
 * tool server (connection management owns that handshake). Responses may be
 * plain JSON or a single-message SSE body.
 */
@Slf4j
@Component
@EnableConfigurationProperties(McpServerProperties.class)
public class JsonRpcToolInvoker implements ToolInvoker {

    private static final String SSE_DATA_PREFIX = "data:";

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final McpServerProperties properties;
    private final AtomicLong          requestIds = new AtomicLong();

    public JsonRpcToolInvoker(HttpClient httpClient,
                              ObjectMapper objectMapper,
                              McpServerProperties properties) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    @Override
    public JsonNode invoke(String serverId, String toolName, JsonNode arguments) {
        McpServerProperties.ServerEndpoint endpoint = properties.servers().get(serverId);
        if (endpoint == null || endpoint.url() == null || endpoint.url().isBlank()) {
            throw new ToolInvocationException("No endpoint configured for server " + serverId);
        }

        long id = requestIds.incrementAndGet();
        String body = serialize(buildRequest(id, toolName, arguments));
        log.debug("[JsonRpc:{}] → tools/call id={} tool={}", serverId, id, toolName);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(endpoint.url()))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json, text/event-stream")
                .timeout(Duration.ofSeconds(endpoint.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (endpoint.bearerToken() != null && !endpoint.bearerToken().isBlank()) {
            builder.header("Authorization", "Bearer " + endpoint.bearerToken());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ToolInvocationException("Network error calling server " + serverId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolInvocationException("Interrupted while calling server " + serverId, e);
        }

        return parseResponse(serverId, response);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private ObjectNode buildRequest(long id, String toolName, JsonNode arguments) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", "tools/call");
        ObjectNode params = request.putObject("params");
        params.put("name", toolName);
        params.set("arguments", arguments);
        return request;
    }

    JsonNode parseResponse(String serverId, HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[JsonRpc:{}] ← HTTP {} body-length={}", serverId, status, body == null ? 0 : body.length());

        if (status < 200 || status >= 300) {
            throw new ToolInvocationException("Server %s returned HTTP %d: %s".formatted(serverId, status, body));
        }

        JsonNode message;
        try {
            message = objectMapper.readTree(extractJson(body));
        } catch (JsonProcessingException e) {
            throw new ToolInvocationException("Unparsable response from server " + serverId, e);
        }
        if (message == null || message.isMissingNode()) {
            throw new ToolInvocationException("Empty response from server " + serverId);
        }

        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            throw new ToolInvocationException(error.path("message").asText("Unknown JSON-RPC error"));
        }

        JsonNode result = message.path("result");
        if (result.path("isError").asBoolean(false)) {
            throw new ToolInvocationException(joinText(result));
        }
        return result;
    }

    /** SSE bodies carry the JSON-RPC message on their last "data:" line. */
    private static String extractJson(String body) {
        if (body == null) return "";
        String trimmed = body.trim();
        if (!trimmed.startsWith("event:") && !trimmed.startsWith(SSE_DATA_PREFIX)) return trimmed;

        String last = "";
        for (String line : trimmed.split("\n")) {
            if (line.startsWith(SSE_DATA_PREFIX)) {
                last = line.substring(SSE_DATA_PREFIX.length()).trim();
            }
        }
        return last;
    }

    private static String joinText(JsonNode result) {
        List<String> texts = new ArrayList<>();
        for (JsonNode item : result.path("content")) {
            if ("text".equals(item.path("type").asText())) {
                texts.add(item.path("text").asText());
            }
        }
        return texts.isEmpty() ? "Tool reported an error" : String.join("\n", texts);
    }

    private String serialize(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ToolInvocationException("Failed to serialize tools/call request", e);
        }
    }
}
