package com.openforge.mcpchat.mention;

import java.util.Objects;

/**
 * A user pin that forces tools into scope, bypassing relevance filtering.
 *
 * For {@link MentionKind#SERVER} the id is the server id; for
 * {@link MentionKind#TOOL} it is the tool name, and serverId records where the
 * user picked it from. Equality is the (kind, id, serverId) tuple.
 */
public record Mention(
        MentionKind kind,
        String id,
        String serverId
) {

    public Mention {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(serverId, "serverId");
    }

    public static Mention server(String serverId) {
        return new Mention(MentionKind.SERVER, serverId, serverId);
    }

    public static Mention tool(String toolName, String serverId) {
        return new Mention(MentionKind.TOOL, toolName, serverId);
    }
}
