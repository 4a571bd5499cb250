package com.openforge.mcpchat.selection;

import com.openforge.mcpchat.catalog.CatalogChangedEvent;
import com.openforge.mcpchat.catalog.CatalogSnapshot;
import com.openforge.mcpchat.catalog.CatalogSnapshot.ServerTool;
import com.openforge.mcpchat.catalog.ToolSchema;
import com.openforge.mcpchat.embedding.EmbeddingClient;
import com.openforge.mcpchat.llm.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Semantic scorer backed by the embedding endpoint.
 *
 * Every tool is embedded once as "name \n description \n schema" and kept in
 * an in-memory index tagged with the catalog fingerprint it was built from.
 * A catalog change schedules a rebuild on the shared executor; until that
 * rebuild lands the scorer reports not-ready and selection falls back.
 *
 * Vectors are cached by tool text, so reconnecting a server does not
 * re-embed tools whose text did not change. The cache holds only the texts
 * of the last published index.
 */
@Slf4j
@Component
public class EmbeddingToolScorer implements SemanticToolScorer {

    private static final int MAX_TOOL_TEXT_LEN   = 3500;
    private static final int MAX_SCHEMA_TEXT_LEN = 2000;

    private final EmbeddingClient        embeddingClient;
    private final ToolSelectorProperties properties;
    private final ExecutorService        executor;

    private final Map<String, float[]> vectorCache = new ConcurrentHashMap<>();
    private final AtomicLong           generation  = new AtomicLong();

    private volatile ToolIndex index = ToolIndex.EMPTY;
    private volatile String    wantedFingerprint = "";

    public EmbeddingToolScorer(EmbeddingClient embeddingClient,
                               ToolSelectorProperties properties,
                               ExecutorService agentExecutor) {
        this.embeddingClient = embeddingClient;
        this.properties      = properties;
        this.executor        = agentExecutor;
    }

    // ── Index lifecycle ──────────────────────────────────────────────────────

    @EventListener
    public void onCatalogChanged(CatalogChangedEvent event) {
        requestReindex(event.snapshot());
    }

    /** Schedules an asynchronous rebuild for this snapshot. Later requests supersede earlier ones. */
    public void requestReindex(CatalogSnapshot snapshot) {
        if (!properties.enabled() || !embeddingClient.isConfigured()) return;

        long gen = generation.incrementAndGet();
        wantedFingerprint = snapshot.fingerprint();
        try {
            executor.submit(() -> rebuild(snapshot, gen));
        } catch (RejectedExecutionException e) {
            log.warn("[ToolIndex] Could not schedule re-index: {}", e.getMessage());
        }
    }

    /**
     * Builds the index synchronously. Only publishes if no newer catalog
     * arrived meanwhile.
     */
    void rebuild(CatalogSnapshot snapshot, long gen) {
        long start = System.currentTimeMillis();
        List<IndexedTool> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> liveTexts = new HashSet<>();

        for (ServerTool st : snapshot.allTools()) {
            if (generation.get() != gen) {
                log.debug("[ToolIndex] Re-index generation {} superseded, abandoning", gen);
                return;
            }
            ToolSchema tool = st.tool();
            if (!seen.add(tool.name())) continue;

            String text = toolText(tool);
            liveTexts.add(text);
            try {
                float[] vector = vectorCache.computeIfAbsent(text, t -> toArray(embeddingClient.embed(t)));
                entries.add(new IndexedTool(tool.name(), vector));
            } catch (RuntimeException e) {
                log.warn("[ToolIndex] Failed to index tool {}: {}", tool.name(), e.getMessage());
            }
        }

        if (generation.get() != gen) return;
        index = new ToolIndex(snapshot.fingerprint(), List.copyOf(entries));
        // vectors of tools that left the catalog
        vectorCache.keySet().retainAll(liveTexts);
        log.info("[ToolIndex] Indexed {} tool(s) in {}ms", entries.size(), System.currentTimeMillis() - start);
    }

    // ── SemanticToolScorer ───────────────────────────────────────────────────

    @Override
    public boolean isReady() {
        ToolIndex current = index;
        return embeddingClient.isConfigured()
                && !current.entries().isEmpty()
                && current.fingerprint().equals(wantedFingerprint);
    }

    @Override
    public ScoringResult score(List<Message> turns, ScoringOptions options) {
        long start = System.currentTimeMillis();
        ToolIndex current = index;

        String query = buildQuery(turns);
        if (query.isBlank()) {
            return new ScoringResult(List.of(), System.currentTimeMillis() - start);
        }

        float[] queryVector = toArray(embeddingClient.embed(query));

        List<ScoredTool> ranked = current.entries().stream()
                .map(e -> new ScoredTool(e.toolName(), cosine(queryVector, e.vector())))
                .filter(s -> s.score() >= options.minScore())
                .sorted(Comparator.comparingDouble(ScoredTool::score).reversed())
                .limit(options.topK())
                .toList();

        return new ScoringResult(ranked, System.currentTimeMillis() - start);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * The last few user/assistant turns that carry text, oldest first,
     * trimmed from the front so the most recent words survive.
     */
    String buildQuery(List<Message> turns) {
        List<String> texts = new ArrayList<>();
        for (int i = turns.size() - 1; i >= 0 && texts.size() < properties.contextMessages(); i--) {
            Message m = turns.get(i);
            boolean conversational = "user".equals(m.role()) || "assistant".equals(m.role());
            if (conversational && m.content() != null && !m.content().isBlank()) {
                texts.add(0, m.content());
            }
        }
        String joined = String.join("\n", texts);
        int max = properties.maxContextChars();
        return joined.length() > max ? joined.substring(joined.length() - max) : joined;
    }

    static String toolText(ToolSchema tool) {
        String schemaText = tool.inputSchema() == null ? "" : tool.inputSchema().toString();
        if (schemaText.length() > MAX_SCHEMA_TEXT_LEN) {
            schemaText = schemaText.substring(0, MAX_SCHEMA_TEXT_LEN) + "...";
        }
        String description = tool.description() == null ? "" : tool.description();
        String text = tool.name() + "\n" + description + "\n" + schemaText;
        return text.length() > MAX_TOOL_TEXT_LEN ? text.substring(0, MAX_TOOL_TEXT_LEN) : text;
    }

    static double cosine(float[] a, float[] b) {
        int n = Math.min(a.length, b.length);
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < n; i++) {
            dot   += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    int cachedVectorCount() {
        return vectorCache.size();
    }

    private static float[] toArray(List<Float> vector) {
        float[] out = new float[vector.size()];
        for (int i = 0; i < out.length; i++) out[i] = vector.get(i);
        return out;
    }

    private record IndexedTool(String toolName, float[] vector) {}

    private record ToolIndex(String fingerprint, List<IndexedTool> entries) {
        static final ToolIndex EMPTY = new ToolIndex("", List.of());
    }
}
