package com.openforge.mcpchat.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Chat model providers, under "agent.llm". The primary provider is required;
 * the fallback is only used when opening a stream on the primary fails.
 *
 * agent:
 *   llm:
 *     primary:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: ${OPENAI_API_KEY:}
 *       model: gpt-4o-mini
 *     fallback:
 *       name: local
 *       base-url: http://localhost:11434/v1
 *       model: qwen2.5:14b
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public boolean hasFallback() {
        return fallback != null && fallback.isConfigured();
    }

    /**
     * One OpenAI-compatible endpoint. timeoutSeconds bounds the wait for the
     * response to start; a stream that has started is not cut off.
     */
    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }

        public String completionsUrl() {
            String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
            return base + "/chat/completions";
        }
    }
}
