package com.openforge.mcpchat.catalog;

import com.openforge.mcpchat.catalog.dto.RegisterToolsRequest;
import com.openforge.mcpchat.catalog.dto.ServerToolsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Entry point for connection management to publish the tool lists of
 * connected servers.
 *
 * Endpoints:
 *   GET    /api/catalog/servers                  — every server with its tools
 *   PUT    /api/catalog/servers/{serverId}/tools — register / replace one server's tools
 *   DELETE /api/catalog/servers/{serverId}       — forget a disconnected server
 */
@RestController
@RequestMapping("/api/catalog/servers")
@RequiredArgsConstructor
public class CatalogController {

    private final InMemoryToolCatalog catalog;

    @GetMapping
    public List<ServerToolsResponse> listServers() {
        return catalog.snapshot().toolsByServer().entrySet().stream()
                .map(e -> new ServerToolsResponse(e.getKey(), e.getValue()))
                .toList();
    }

    @PutMapping("/{serverId}/tools")
    public ServerToolsResponse registerTools(@PathVariable String serverId,
                                             @Valid @RequestBody RegisterToolsRequest request) {
        List<ToolSchema> tools = request.tools().stream()
                .map(RegisterToolsRequest.ToolDefinition::toSchema)
                .toList();
        catalog.register(serverId, tools);
        return new ServerToolsResponse(serverId, tools);
    }

    @DeleteMapping("/{serverId}")
    public ResponseEntity<Void> removeServer(@PathVariable String serverId) {
        if (!catalog.remove(serverId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown server: " + serverId);
        }
        return ResponseEntity.noContent().build();
    }
}
