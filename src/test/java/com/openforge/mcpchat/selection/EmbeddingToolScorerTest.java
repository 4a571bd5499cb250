package com.openforge.mcpchat.selection;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openforge.mcpchat.catalog.CatalogSnapshot;
import com.openforge.mcpchat.catalog.ToolSchema;
import com.openforge.mcpchat.embedding.EmbeddingClient;
import com.openforge.mcpchat.llm.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class EmbeddingToolScorerTest {

    private EmbeddingClient embeddingClient;
    private ExecutorService executor;
    private EmbeddingToolScorer scorer;

    @BeforeEach
    void setUp() {
        embeddingClient = mock(EmbeddingClient.class);
        when(embeddingClient.isConfigured()).thenReturn(true);
        when(embeddingClient.embed(startsWith("weather"))).thenReturn(List.of(1f, 0f));
        when(embeddingClient.embed(startsWith("stocks"))).thenReturn(List.of(0f, 1f));

        executor = mock(ExecutorService.class);
        when(executor.submit(any(Runnable.class))).thenAnswer(inv -> {
            ((Runnable) inv.getArgument(0)).run();
            return null;
        });

        scorer = new EmbeddingToolScorer(embeddingClient, ToolSelectorProperties.defaults(), executor);
    }

    // ===== Index lifecycle =====

    @Test
    void notReadyUntilIndexed() {
        assertFalse(scorer.isReady());

        scorer.requestReindex(catalog("weather", "stocks"));

        assertTrue(scorer.isReady());
    }

    @Test
    void pendingRebuildMakesIndexStale() {
        scorer.requestReindex(catalog("weather"));
        assertTrue(scorer.isReady());

        reset(executor);
        scorer.requestReindex(catalog("weather", "stocks"));

        assertFalse(scorer.isReady());
    }

    @Test
    void unchangedToolsAreNotEmbeddedTwice() {
        scorer.requestReindex(catalog("weather"));
        scorer.requestReindex(catalog("weather", "stocks"));

        verify(embeddingClient, times(1)).embed(startsWith("weather"));
        verify(embeddingClient, times(1)).embed(startsWith("stocks"));
    }

    @Test
    void removedToolsLeaveTheVectorCache() {
        scorer.requestReindex(catalog("weather", "stocks"));
        assertEquals(2, scorer.cachedVectorCount());

        scorer.requestReindex(catalog("weather"));
        assertEquals(1, scorer.cachedVectorCount());

        // a tool that comes back is embedded again
        scorer.requestReindex(catalog("weather", "stocks"));
        verify(embeddingClient, times(2)).embed(startsWith("stocks"));
        verify(embeddingClient, times(1)).embed(startsWith("weather"));
    }

    @Test
    void toolThatFailsToEmbedIsLeftOut() {
        when(embeddingClient.embed(startsWith("broken")))
                .thenThrow(new EmbeddingClient.EmbeddingException("bad input"));
        when(embeddingClient.embed("weather tomorrow")).thenReturn(List.of(1f, 0f));

        scorer.requestReindex(catalog("weather", "broken"));
        ScoringResult result = scorer.score(List.of(Message.user("weather tomorrow")), new ScoringOptions(10, 0.0));

        assertTrue(scorer.isReady());
        assertEquals(List.of("weather"), result.tools().stream().map(ScoredTool::toolName).toList());
    }

    @Test
    void unconfiguredClientNeverIndexes() {
        when(embeddingClient.isConfigured()).thenReturn(false);

        scorer.requestReindex(catalog("weather"));

        assertFalse(scorer.isReady());
        verifyNoInteractions(executor);
    }

    // ===== Scoring =====

    @Test
    void ranksByCosineAndDropsLowScores() {
        when(embeddingClient.embed("what is the weather")).thenReturn(List.of(1f, 0.1f));
        scorer.requestReindex(catalog("stocks", "weather"));

        ScoringResult result = scorer.score(List.of(Message.user("what is the weather")), new ScoringOptions(22, 0.30));

        assertEquals(1, result.tools().size());
        assertEquals("weather", result.tools().get(0).toolName());
        assertTrue(result.tools().get(0).score() > 0.99);
    }

    @Test
    void respectsTopK() {
        when(embeddingClient.embed("both")).thenReturn(List.of(1f, 1f));
        scorer.requestReindex(catalog("stocks", "weather"));

        ScoringResult result = scorer.score(List.of(Message.user("both")), new ScoringOptions(1, 0.0));

        assertEquals(1, result.tools().size());
    }

    @Test
    void blankConversationSkipsEmbedding() {
        scorer.requestReindex(catalog("weather"));
        clearInvocations(embeddingClient);

        ScoringResult result = scorer.score(List.of(Message.assistantToolCalls(null, List.of())), new ScoringOptions(22, 0.3));

        assertTrue(result.tools().isEmpty());
        verify(embeddingClient, never()).embed(anyString());
    }

    // ===== Query and similarity =====

    @Test
    void queryUsesLastConversationalTurnsOldestFirst() {
        List<Message> turns = List.of(
                Message.user("one"),
                Message.assistantText("two"),
                Message.toolResult("call_0", "{\"ignored\":true}"),
                Message.user("three"),
                Message.assistantText("four"));

        assertEquals("two\nthree\nfour", scorer.buildQuery(turns));
    }

    @Test
    void queryKeepsTheMostRecentCharacters() {
        scorer = new EmbeddingToolScorer(embeddingClient,
                new ToolSelectorProperties(true, 22, 0.30, 3, 5, 120), executor);

        assertEquals("world", scorer.buildQuery(List.of(Message.user("hello world"))));
    }

    @Test
    void cosineOfOrthogonalAndZeroVectors() {
        assertEquals(0.0, EmbeddingToolScorer.cosine(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
        assertEquals(0.0, EmbeddingToolScorer.cosine(new float[]{0, 0}, new float[]{1, 1}), 1e-9);
        assertEquals(1.0, EmbeddingToolScorer.cosine(new float[]{2, 2}, new float[]{1, 1}), 1e-6);
    }

    @Test
    void toolTextCombinesNameDescriptionAndSchema() {
        ToolSchema tool = new ToolSchema("weather", "Forecast lookup",
                JsonNodeFactory.instance.objectNode().put("type", "object"));

        assertEquals("weather\nForecast lookup\n{\"type\":\"object\"}", EmbeddingToolScorer.toolText(tool));
    }

    // ===== Helpers =====

    private static CatalogSnapshot catalog(String... toolNames) {
        Map<String, List<ToolSchema>> tools = new LinkedHashMap<>();
        tools.put("srv", Arrays.stream(toolNames)
                .map(n -> new ToolSchema(n, n + " tool", null))
                .toList());
        return new CatalogSnapshot(tools);
    }
}
