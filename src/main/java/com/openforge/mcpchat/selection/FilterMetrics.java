package com.openforge.mcpchat.selection;

import java.util.List;

/**
 * Reporting data for one selection: how many tools were exposed out of how
 * many known, how long it took, and where each exposed tool came from.
 *
 * Observability only; nothing in the chat loop branches on these values.
 */
public record FilterMetrics(
        int toolsUsed,
        int toolsTotal,
        long filterTimeMs,
        List<ToolAttribution> toolDetails
) {

    public FilterMetrics {
        toolDetails = toolDetails == null ? List.of() : List.copyOf(toolDetails);
    }
}
