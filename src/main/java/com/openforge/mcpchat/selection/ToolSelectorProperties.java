package com.openforge.mcpchat.selection;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tool selection tuning, under "agent.tool-filter".
 *
 * maxTools stays below the provider's 128-tool ceiling with some headroom.
 */
@ConfigurationProperties(prefix = "agent.tool-filter")
public record ToolSelectorProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("22") int topK,
        @DefaultValue("0.30") double minScore,
        @DefaultValue("3") int contextMessages,
        @DefaultValue("2000") int maxContextChars,
        @DefaultValue("120") int maxTools
) {

    public static ToolSelectorProperties defaults() {
        return new ToolSelectorProperties(true, 22, 0.30, 3, 2000, 120);
    }

    public ScoringOptions scoringOptions() {
        return new ScoringOptions(topK, minScore);
    }
}
