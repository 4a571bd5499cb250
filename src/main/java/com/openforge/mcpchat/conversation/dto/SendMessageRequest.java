package com.openforge.mcpchat.conversation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of POST /api/conversations/{id}/messages.
 */
public record SendMessageRequest(

        @NotBlank(message = "message must not be blank")
        @Size(max = 32000, message = "message must not exceed 32000 characters")
        String message
) {
}
