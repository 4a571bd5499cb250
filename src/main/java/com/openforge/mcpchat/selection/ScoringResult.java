package com.openforge.mcpchat.selection;

import java.util.List;

/**
 * Ranked tools (best first) above the requested minimum score, at most topK
 * entries, plus how long scoring took.
 */
public record ScoringResult(List<ScoredTool> tools, long durationMs) {

    public ScoringResult {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
