package com.openforge.mcpchat.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Body of a streaming POST /chat/completions.
 *
 * model may be left null by callers; the provider client fills in its
 * configured model before sending.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Boolean stream,
        Double temperature
) {

    /**
     * The loop's request: tool choice left to the model. No tools means no
     * "tools" member at all; several providers reject an empty array.
     */
    public static ChatRequest streaming(List<Message> messages, List<Tool> tools) {
        boolean hasTools = tools != null && !tools.isEmpty();
        return ChatRequest.builder()
                .messages(messages)
                .tools(hasTools ? tools : null)
                .toolChoice(hasTools ? "auto" : null)
                .stream(true)
                .temperature(0.7)
                .build();
    }
}
