package com.openforge.mcpchat.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the tools currently known per connected server.
 *
 * Populated by connection management; the chat loop only reads it, and only
 * through {@link #snapshot()} so that a run never observes a half-applied change.
 */
public interface ToolCatalog {

    /** Server ids in registration order. */
    List<String> allServers();

    /** Tools of one server, empty if the server is unknown. */
    List<ToolSchema> listTools(String serverId);

    default CatalogSnapshot snapshot() {
        Map<String, List<ToolSchema>> copy = new LinkedHashMap<>();
        for (String serverId : allServers()) {
            copy.put(serverId, listTools(serverId));
        }
        return new CatalogSnapshot(copy);
    }
}
