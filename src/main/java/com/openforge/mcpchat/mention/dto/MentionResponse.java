package com.openforge.mcpchat.mention.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.mcpchat.mention.Mention;
import com.openforge.mcpchat.mention.MentionKind;

@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record MentionResponse(
        MentionKind kind,
        String id,
        String serverId
) {

    public static MentionResponse from(Mention mention) {
        return new MentionResponse(mention.kind(), mention.id(), mention.serverId());
    }
}
