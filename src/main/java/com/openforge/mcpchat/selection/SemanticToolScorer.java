package com.openforge.mcpchat.selection;

import com.openforge.mcpchat.llm.model.Message;

import java.util.List;

/**
 * Ranks catalog tools by relevance to the recent conversation.
 *
 * Treated as fallible and possibly slow: callers must survive any exception
 * and a scorer that never becomes ready.
 */
public interface SemanticToolScorer {

    /** True once the scorer can answer for the current catalog. */
    boolean isReady();

    /**
     * @param turns   non-system conversation turns, oldest first
     * @param options topK / minScore bounds
     */
    ScoringResult score(List<Message> turns, ScoringOptions options);
}
