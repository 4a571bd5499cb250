package com.openforge.mcpchat.mention.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.mcpchat.mention.Mention;
import com.openforge.mcpchat.mention.MentionKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body for pinning / unpinning.
 *
 * @param id       server id for SERVER pins, tool name for TOOL pins
 * @param serverId required for TOOL pins; defaults to id for SERVER pins
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record MentionRequest(
        @NotNull MentionKind kind,
        @NotBlank String id,
        String serverId
) {

    public Mention toMention() {
        return switch (kind) {
            case SERVER -> Mention.server(id);
            case TOOL   -> Mention.tool(id, serverId);
        };
    }
}
