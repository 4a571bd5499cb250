package com.openforge.mcpchat.config;

import com.openforge.mcpchat.dispatch.McpServerProperties;
import com.openforge.mcpchat.dispatch.ToolDispatchProperties;
import com.openforge.mcpchat.embedding.EmbeddingProperties;
import com.openforge.mcpchat.llm.LlmProperties;
import com.openforge.mcpchat.selection.ToolSelectorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a startup summary once the context is ready: HTTP port, database
 * check, LLM providers (keys masked), embedding model, tool filtering and the
 * configured tool servers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource             dataSource;
    private final LlmProperties          llmProperties;
    private final EmbeddingProperties    embeddingProperties;
    private final ToolSelectorProperties toolSelectorProperties;
    private final ToolDispatchProperties dispatchProperties;
    private final McpServerProperties    mcpServerProperties;
    private final Environment            env;

    @Override
    public void run(ApplicationArguments args) {
        LlmProperties.ProviderConfig primary  = llmProperties.primary();
        LlmProperties.ProviderConfig fallback = llmProperties.fallback();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              MCP Chat  —  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tool Selection                                          ║
                ║    Semantic       : {}  topK={}  minScore={}
                ║    Embedding      : {}
                ║    Fallback cap   : {} tools
                ╠══════════════════════════════════════════════════════════╣
                ║  Tool Servers                                            ║
                ║    Configured     : {}
                ║    Call timeout   : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                checkDatabase(),

                describe(primary),
                describe(fallback),

                toolSelectorProperties.enabled() ? "✔ enabled" : "✘ disabled",
                toolSelectorProperties.topK(),
                toolSelectorProperties.minScore(),
                embeddingProperties.isConfigured()
                        ? embeddingProperties.model() + "  @ " + embeddingProperties.baseUrl()
                        : "(not configured, selection falls back to all tools)",
                toolSelectorProperties.maxTools(),

                mcpServerProperties.servers().isEmpty() ? "(none)" : mcpServerProperties.servers().keySet(),
                dispatchProperties.timeout()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED — " + e.getMessage();
        }
    }

    private static String describe(LlmProperties.ProviderConfig config) {
        if (config == null || !config.isConfigured()) {
            return "(not configured)";
        }
        return "%s  [%s]  key=%s".formatted(config.name(), config.model(), maskKey(config.apiKey()));
    }

    /** First 6 chars + "..." + last 4; "(not set)" for empty keys. */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
