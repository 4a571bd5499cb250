package com.openforge.mcpchat.selection;

import com.openforge.mcpchat.catalog.CatalogSnapshot;
import com.openforge.mcpchat.catalog.CatalogSnapshot.ServerTool;
import com.openforge.mcpchat.catalog.ToolRef;
import com.openforge.mcpchat.catalog.ToolSchema;
import com.openforge.mcpchat.llm.model.Message;
import com.openforge.mcpchat.mention.Mention;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which tools the model sees on one call.
 *
 * Priority:
 *   1. PINNED   — any user pin short-circuits everything else; the scorer is
 *                 not consulted at all
 *   2. SEMANTIC — scorer enabled, ready, catalog non-empty; scorer failure
 *                 degrades to 3 with a warning
 *   3. FALLBACK — every catalog tool, deduplicated by name, capped at maxTools
 *
 * Never throws for scorer problems: a conversation turn must not fail because
 * relevance ranking is unavailable.
 */
@Slf4j
@Service
@EnableConfigurationProperties(ToolSelectorProperties.class)
public class ToolSelector {

    private final SemanticToolScorer     scorer;
    private final ToolSelectorProperties properties;

    public ToolSelector(SemanticToolScorer scorer, ToolSelectorProperties properties) {
        this.scorer     = scorer;
        this.properties = properties;
    }

    /**
     * @param conversation provider-format transcript; system turns are ignored
     * @param catalog      snapshot taken for this selection
     * @param pins         snapshot of the user's pins, possibly empty
     */
    public ToolSelection select(List<Message> conversation, CatalogSnapshot catalog, List<Mention> pins) {
        int totalTools = catalog.totalTools();

        if (pins != null && !pins.isEmpty()) {
            return selectPinned(catalog, pins, totalTools);
        }

        if (properties.enabled() && totalTools > 0 && isScorerReady()) {
            Optional<ToolSelection> semantic = selectSemantic(conversation, catalog, totalTools);
            if (semantic.isPresent()) {
                return semantic.get();
            }
        }

        return selectAll(catalog, totalTools);
    }

    // ── Pinned ───────────────────────────────────────────────────────────────

    private ToolSelection selectPinned(CatalogSnapshot catalog, List<Mention> pins, int totalTools) {
        Map<ToolRef, ServerTool> resolved = new LinkedHashMap<>();

        for (Mention pin : pins) {
            switch (pin.kind()) {
                case SERVER -> catalog.toolsOf(pin.id())
                        .forEach(tool -> resolved.putIfAbsent(
                                ToolRef.of(pin.id(), tool), new ServerTool(pin.id(), tool)));
                // names are expected to be unique; first server in catalog order wins
                case TOOL -> catalog.findTool(pin.id())
                        .ifPresent(st -> resolved.putIfAbsent(st.ref(), st));
            }
        }

        List<ServerTool> tools = new ArrayList<>(resolved.values());
        if (tools.size() > properties.maxTools()) {
            log.warn("[ToolSelector] {} pinned tools exceed the provider limit of {}; sending all pinned tools anyway",
                    tools.size(), properties.maxTools());
        }
        log.info("[ToolSelector] Using {} pinned tool(s) from {} pin(s), semantic filtering bypassed",
                tools.size(), pins.size());

        return new ToolSelection(tools, metrics(tools, totalTools, 0), SelectionMode.PINNED, false);
    }

    // ── Semantic ─────────────────────────────────────────────────────────────

    private Optional<ToolSelection> selectSemantic(List<Message> conversation,
                                                   CatalogSnapshot catalog,
                                                   int totalTools) {
        List<Message> turns = conversation.stream()
                .filter(m -> !m.isSystem())
                .toList();
        try {
            ScoringResult result = scorer.score(turns, properties.scoringOptions());

            List<ServerTool> tools = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (ScoredTool scored : result.tools()) {
                if (!seen.add(scored.toolName())) continue;
                // the scorer index may lag the catalog; drop names it no longer has
                catalog.findTool(scored.toolName()).ifPresent(tools::add);
            }

            log.info("[ToolSelector] Using {}/{} filtered tools ({}ms)",
                    tools.size(), totalTools, result.durationMs());
            return Optional.of(new ToolSelection(tools,
                    metrics(tools, totalTools, result.durationMs()), SelectionMode.SEMANTIC, false));
        } catch (RuntimeException e) {
            log.warn("[ToolSelector] Filtering failed, falling back to all tools: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isScorerReady() {
        try {
            return scorer.isReady();
        } catch (RuntimeException e) {
            log.warn("[ToolSelector] Scorer readiness check failed: {}", e.getMessage());
            return false;
        }
    }

    // ── Fallback ─────────────────────────────────────────────────────────────

    private ToolSelection selectAll(CatalogSnapshot catalog, int totalTools) {
        List<ServerTool> unique = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ServerTool st : catalog.allTools()) {
            ToolSchema tool = st.tool();
            if (!seen.add(tool.name())) {
                log.debug("[ToolSelector] Skipping duplicate tool name {} from server {}",
                        tool.name(), st.serverId());
                continue;
            }
            unique.add(st);
        }

        boolean truncated = unique.size() > properties.maxTools();
        if (truncated) {
            log.warn("[ToolSelector] Tool count ({}) exceeds provider limit, using first {} tools",
                    unique.size(), properties.maxTools());
        }
        List<ServerTool> limited = truncated
                ? unique.subList(0, properties.maxTools())
                : unique;

        log.debug("[ToolSelector] Unfiltered selection: {}/{} tools", limited.size(), totalTools);
        return new ToolSelection(limited, null, SelectionMode.FALLBACK, truncated);
    }

    private static FilterMetrics metrics(List<ServerTool> tools, int totalTools, long filterTimeMs) {
        List<ToolAttribution> details = tools.stream()
                .map(st -> new ToolAttribution(st.tool().name(), st.serverId()))
                .toList();
        return new FilterMetrics(tools.size(), totalTools, filterTimeMs, details);
    }
}
