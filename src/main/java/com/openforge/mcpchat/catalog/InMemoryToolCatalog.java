package com.openforge.mcpchat.catalog;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local catalog fed by connection management (or the catalog REST API).
 *
 * Copy-on-write: every mutation swaps in a fresh map, so readers never need a
 * lock and a snapshot is always internally consistent.
 */
@Slf4j
@Component
public class InMemoryToolCatalog implements ToolCatalog {

    private final ApplicationEventPublisher eventPublisher;

    private volatile Map<String, List<ToolSchema>> toolsByServer = Map.of();

    public InMemoryToolCatalog(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public List<String> allServers() {
        return List.copyOf(toolsByServer.keySet());
    }

    @Override
    public List<ToolSchema> listTools(String serverId) {
        return toolsByServer.getOrDefault(serverId, List.of());
    }

    @Override
    public CatalogSnapshot snapshot() {
        return new CatalogSnapshot(toolsByServer);
    }

    /** Registers or replaces the tool list of one server. Keeps the server's original position. */
    public synchronized void register(String serverId, List<ToolSchema> tools) {
        Map<String, List<ToolSchema>> next = new LinkedHashMap<>(toolsByServer);
        next.put(serverId, List.copyOf(tools));
        toolsByServer = next;
        log.info("[Catalog] Registered {} tool(s) for server {}", tools.size(), serverId);
        publishChange();
    }

    public synchronized boolean remove(String serverId) {
        if (!toolsByServer.containsKey(serverId)) return false;
        Map<String, List<ToolSchema>> next = new LinkedHashMap<>(toolsByServer);
        next.remove(serverId);
        toolsByServer = next;
        log.info("[Catalog] Removed server {}", serverId);
        publishChange();
        return true;
    }

    private void publishChange() {
        eventPublisher.publishEvent(new CatalogChangedEvent(snapshot()));
    }
}
