package com.openforge.mcpchat.catalog;

/**
 * Server-scoped lookup key for a tool. Two servers may expose tools with the
 * same name, so a bare tool name is never enough to address one.
 */
public record ToolRef(String serverId, String toolName) {

    public static ToolRef of(String serverId, ToolSchema tool) {
        return new ToolRef(serverId, tool.name());
    }
}
