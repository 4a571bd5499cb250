package com.openforge.mcpchat.conversation.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Returned when a run is accepted. The client follows progress on
 * wsSubscribePath.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record RunResponse(
        String conversationId,
        boolean processing,
        String wsSubscribePath
) {

    public static RunResponse accepted(String conversationId, String topicPrefix) {
        return new RunResponse(conversationId, true, topicPrefix + conversationId);
    }
}
