package com.openforge.mcpchat.dispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Tool server endpoints, keyed by the same server id the catalog uses.
 *
 * agent:
 *   mcp:
 *     servers:
 *       github:
 *         url: http://localhost:8008/mcp/github
 *         bearer-token: ${GITHUB_MCP_TOKEN:}
 */
@ConfigurationProperties(prefix = "agent.mcp")
public record McpServerProperties(
        Map<String, ServerEndpoint> servers
) {

    public McpServerProperties {
        servers = servers == null ? Map.of() : Map.copyOf(servers);
    }

    public record ServerEndpoint(
            String url,
            String bearerToken,
            @DefaultValue("60") int timeoutSeconds
    ) {}
}
