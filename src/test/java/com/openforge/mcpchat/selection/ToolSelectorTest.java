package com.openforge.mcpchat.selection;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openforge.mcpchat.catalog.CatalogSnapshot;
import com.openforge.mcpchat.catalog.CatalogSnapshot.ServerTool;
import com.openforge.mcpchat.catalog.ToolSchema;
import com.openforge.mcpchat.llm.model.Message;
import com.openforge.mcpchat.mention.Mention;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ToolSelectorTest {

    private static final List<Message> CONVERSATION = List.of(
            Message.system("be helpful"),
            Message.user("find open issues"));

    private SemanticToolScorer scorer;
    private ToolSelector selector;

    @BeforeEach
    void setUp() {
        scorer = mock(SemanticToolScorer.class);
        selector = new ToolSelector(scorer, ToolSelectorProperties.defaults());
    }

    // ===== Pins =====

    @Test
    void pinsBypassScorerEvenWhenItIsBroken() {
        when(scorer.isReady()).thenThrow(new IllegalStateException("broken"));
        CatalogSnapshot catalog = catalog(Map.of("github", List.of("search_issues", "create_issue")));

        ToolSelection selection = selector.select(CONVERSATION, catalog, List.of(Mention.tool("create_issue", "github")));

        assertEquals(SelectionMode.PINNED, selection.mode());
        assertEquals(List.of("create_issue"), names(selection));
        assertEquals(0, selection.metrics().filterTimeMs());
        assertEquals(1, selection.metrics().toolsUsed());
        assertEquals(2, selection.metrics().toolsTotal());
        verifyNoInteractions(scorer);
    }

    @Test
    void serverAndToolPinsAreDeduplicated() {
        CatalogSnapshot catalog = catalog(Map.of(
                "github", List.of("search_issues", "create_issue"),
                "slack", List.of("post_message")));

        ToolSelection selection = selector.select(CONVERSATION, catalog, List.of(
                Mention.server("github"),
                Mention.tool("search_issues", "github"),
                Mention.server("github")));

        assertEquals(List.of("search_issues", "create_issue"), names(selection));
        List<ToolAttribution> details = selection.metrics().toolDetails();
        assertEquals("github", details.get(0).serverId());
    }

    @Test
    void unknownPinsResolveToNothing() {
        CatalogSnapshot catalog = catalog(Map.of("github", List.of("search_issues")));

        ToolSelection selection = selector.select(CONVERSATION, catalog, List.of(
                Mention.server("gone"), Mention.tool("missing", "github")));

        assertEquals(SelectionMode.PINNED, selection.mode());
        assertEquals(0, selection.size());
    }

    @Test
    void pinsAreNotCapped() {
        CatalogSnapshot catalog = catalog(Map.of("big", toolNames("t", 130)));

        ToolSelection selection = selector.select(CONVERSATION, catalog, List.of(Mention.server("big")));

        assertEquals(130, selection.size());
    }

    // ===== Semantic =====

    @Test
    void usesScorerRankingWithoutSystemTurns() {
        when(scorer.isReady()).thenReturn(true);
        when(scorer.score(any(), any())).thenReturn(new ScoringResult(List.of(
                new ScoredTool("create_issue", 0.9),
                new ScoredTool("stale_tool", 0.8),
                new ScoredTool("create_issue", 0.7)), 42));
        CatalogSnapshot catalog = catalog(Map.of("github", List.of("search_issues", "create_issue")));

        ToolSelection selection = selector.select(CONVERSATION, catalog, List.of());

        assertEquals(SelectionMode.SEMANTIC, selection.mode());
        assertEquals(List.of("create_issue"), names(selection));
        assertEquals(42, selection.metrics().filterTimeMs());
        assertEquals(2, selection.metrics().toolsTotal());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> turns = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<ScoringOptions> options = ArgumentCaptor.forClass(ScoringOptions.class);
        verify(scorer).score(turns.capture(), options.capture());
        assertEquals(1, turns.getValue().size());
        assertEquals("user", turns.getValue().get(0).role());
        assertEquals(22, options.getValue().topK());
        assertEquals(0.30, options.getValue().minScore(), 1e-9);
    }

    @Test
    void scorerFailureFallsBackToAllTools() {
        when(scorer.isReady()).thenReturn(true);
        when(scorer.score(any(), any())).thenThrow(new RuntimeException("embedding endpoint down"));
        CatalogSnapshot catalog = catalog(Map.of("github", List.of("search_issues", "create_issue")));

        ToolSelection selection = selector.select(CONVERSATION, catalog, List.of());

        assertEquals(SelectionMode.FALLBACK, selection.mode());
        assertEquals(2, selection.size());
        assertNull(selection.metrics());
    }

    @Test
    void disabledFilteringNeverConsultsScorer() {
        selector = new ToolSelector(scorer, new ToolSelectorProperties(false, 22, 0.30, 3, 2000, 120));
        CatalogSnapshot catalog = catalog(Map.of("github", List.of("search_issues")));

        ToolSelection selection = selector.select(CONVERSATION, catalog, List.of());

        assertEquals(SelectionMode.FALLBACK, selection.mode());
        verifyNoInteractions(scorer);
    }

    // ===== Fallback =====

    @Test
    void fallbackCapsAtOneHundredTwentyInCatalogOrder() {
        when(scorer.isReady()).thenReturn(false);
        Map<String, List<String>> servers = new LinkedHashMap<>();
        servers.put("a", toolNames("a", 100));
        servers.put("b", toolNames("b", 100));
        CatalogSnapshot catalog = catalog(servers);

        ToolSelection selection = selector.select(CONVERSATION, catalog, List.of());

        assertEquals(SelectionMode.FALLBACK, selection.mode());
        assertEquals(120, selection.size());
        assertTrue(selection.truncated());
        assertNull(selection.metrics());
        assertEquals("a_0", selection.tools().get(0).tool().name());
        assertEquals("b_19", selection.tools().get(119).tool().name());
    }

    @Test
    void fallbackDeduplicatesByName() {
        Map<String, List<String>> servers = new LinkedHashMap<>();
        servers.put("first", List.of("search"));
        servers.put("second", List.of("search", "fetch"));

        ToolSelection selection = selector.select(CONVERSATION, catalog(servers), List.of());

        assertEquals(List.of("search", "fetch"), names(selection));
        assertEquals("first", selection.tools().get(0).serverId());
        assertFalse(selection.truncated());
    }

    @Test
    void emptyCatalogYieldsNoTools() {
        when(scorer.isReady()).thenReturn(true);

        ToolSelection selection = selector.select(CONVERSATION, CatalogSnapshot.empty(), List.of());

        assertEquals(0, selection.size());
        assertTrue(selection.providerTools().isEmpty());
        verify(scorer, never()).score(any(), any());
    }

    // ===== Helpers =====

    private static CatalogSnapshot catalog(Map<String, List<String>> toolNamesByServer) {
        Map<String, List<ToolSchema>> tools = new LinkedHashMap<>();
        toolNamesByServer.forEach((server, names) -> tools.put(server, names.stream()
                .map(n -> new ToolSchema(n, "desc " + n, JsonNodeFactory.instance.objectNode()))
                .toList()));
        return new CatalogSnapshot(tools);
    }

    private static List<String> toolNames(String prefix, int count) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < count; i++) names.add(prefix + "_" + i);
        return names;
    }

    private static List<String> names(ToolSelection selection) {
        return selection.tools().stream().map(ServerTool::tool).map(ToolSchema::name).toList();
    }
}
