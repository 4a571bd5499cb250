package com.openforge.mcpchat.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable copy of the catalog taken at the start of a selection phase.
 *
 * Iteration order is the catalog's registration order. Every "first match"
 * rule (tool pins, semantic results, dispatch routing) follows that order.
 */
public final class CatalogSnapshot {

    private final Map<String, List<ToolSchema>> toolsByServer;

    public CatalogSnapshot(Map<String, List<ToolSchema>> toolsByServer) {
        Map<String, List<ToolSchema>> copy = new LinkedHashMap<>();
        toolsByServer.forEach((serverId, tools) ->
                copy.put(serverId, tools == null ? List.of() : List.copyOf(tools)));
        this.toolsByServer = Collections.unmodifiableMap(copy);
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(Map.of());
    }

    public Map<String, List<ToolSchema>> toolsByServer() {
        return toolsByServer;
    }

    public List<String> serverIds() {
        return List.copyOf(toolsByServer.keySet());
    }

    public List<ToolSchema> toolsOf(String serverId) {
        return toolsByServer.getOrDefault(serverId, List.of());
    }

    public int totalTools() {
        return toolsByServer.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return totalTools() == 0;
    }

    /** First server (in registration order) that exposes a tool with this name. */
    public Optional<String> findServerFor(String toolName) {
        if (toolName == null) return Optional.empty();
        for (var entry : toolsByServer.entrySet()) {
            for (ToolSchema tool : entry.getValue()) {
                if (toolName.equals(tool.name())) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    /** Like {@link #findServerFor} but returns the schema together with its owner. */
    public Optional<ServerTool> findTool(String toolName) {
        return findServerFor(toolName).flatMap(serverId -> toolsOf(serverId).stream()
                .filter(t -> t.name().equals(toolName))
                .findFirst()
                .map(t -> new ServerTool(serverId, t)));
    }

    /** All tools flattened in catalog order, with their owning server. */
    public List<ServerTool> allTools() {
        List<ServerTool> all = new ArrayList<>();
        toolsByServer.forEach((serverId, tools) ->
                tools.forEach(t -> all.add(new ServerTool(serverId, t))));
        return all;
    }

    /**
     * Cheap change detector: server ids plus tool names, in order.
     * Used to decide whether a derived index (e.g. embeddings) is stale.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder();
        toolsByServer.forEach((serverId, tools) -> {
            sb.append(serverId).append('[');
            tools.forEach(t -> sb.append(t.name()).append(','));
            sb.append(']');
        });
        return sb.toString();
    }

    /** A tool together with the server that owns it. */
    public record ServerTool(String serverId, ToolSchema tool) {

        public ToolRef ref() {
            return new ToolRef(serverId, tool.name());
        }
    }
}
