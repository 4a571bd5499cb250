package com.openforge.mcpchat.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpchat.llm.model.ChatRequest;
import com.openforge.mcpchat.llm.model.Message;
import com.openforge.mcpchat.llm.model.Tool;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.List;
import java.util.function.Supplier;

/**
 * High-availability {@link StreamingCompletionClient}.
 *
 * Call graph:
 *
 *   stream(messages, tools)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryLlmClient.openStream(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry      (only if configured)
 *           └─ fallbackLlmClient.openStream(request)
 *
 * Resilience covers opening the stream only. Once deltas are flowing, a
 * broken connection surfaces from the stream itself and aborts the run;
 * switching providers mid-answer would splice two different responses.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter implements StreamingCompletionClient {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    @Autowired
    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.primary()),
                properties.hasFallback()
                        ? new LlmClient(httpClient, objectMapper, properties.fallback())
                        : null,
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public CompletionStream stream(List<Message> messages, List<Tool> tools) {
        ChatRequest request = ChatRequest.streaming(messages, tools);
        try {
            ChatRequest primaryRequest = overrideModel(request, primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.openStream(primaryRequest), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary stream failed ({}), falling back to {}. Cause: {}",
                    primaryException.getClass().getSimpleName(), fallbackClient.providerName(),
                    primaryException.getMessage());

            ChatRequest fallbackRequest = overrideModel(request, fallbackClient.modelName());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.openStream(fallbackRequest), "fallback");
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     */
    private CompletionStream executeWithResilience(CircuitBreaker cb,
                                                   Retry retry,
                                                   Supplier<CompletionStream> call,
                                                   String label) {
        Supplier<CompletionStream> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (RuntimeException e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }

    private ChatRequest overrideModel(ChatRequest original, String modelName) {
        return original.toBuilder().model(modelName).build();
    }
}
