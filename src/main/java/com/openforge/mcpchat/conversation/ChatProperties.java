package com.openforge.mcpchat.conversation;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chat behaviour under "agent.chat".
 *
 * @param systemPrompt first message of every provider transcript; a built-in
 *                     prompt is used when left empty
 */
@ConfigurationProperties(prefix = "agent.chat")
public record ChatProperties(String systemPrompt) {

    static final String DEFAULT_SYSTEM_PROMPT =
            """
            You are a helpful assistant with access to tools provided by connected servers.
            Use a tool only when it clearly helps answer the user's request.
            When a tool returns an error, explain it or try again with corrected arguments.
            When you have enough information, answer directly without calling more tools.
            """;

    public ChatProperties {
        systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
    }

    public static ChatProperties defaults() {
        return new ChatProperties(null);
    }
}
