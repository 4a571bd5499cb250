package com.openforge.mcpchat.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint used to
 * rank tools against the conversation.
 *
 * agent:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     timeout-seconds: 30
 *
 * Leaving base-url empty disables semantic tool filtering.
 */
@ConfigurationProperties(prefix = "agent.embedding")
public record EmbeddingProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        Integer dimensions,
        @DefaultValue("30") int timeoutSeconds
) {

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    public String embeddingsUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/embeddings";
    }
}
