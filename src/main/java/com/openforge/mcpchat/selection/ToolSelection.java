package com.openforge.mcpchat.selection;

import com.openforge.mcpchat.catalog.CatalogSnapshot.ServerTool;
import com.openforge.mcpchat.llm.model.Tool;

import java.util.List;

/**
 * Outcome of one selection pass.
 *
 * @param tools     tools to expose, with owning server, in exposure order
 * @param metrics   null in {@link SelectionMode#FALLBACK}
 * @param truncated true when the fallback cap dropped tools
 */
public record ToolSelection(
        List<ServerTool> tools,
        FilterMetrics metrics,
        SelectionMode mode,
        boolean truncated
) {

    public ToolSelection {
        tools = List.copyOf(tools);
    }

    public List<Tool> providerTools() {
        return tools.stream().map(t -> t.tool().toProviderTool()).toList();
    }

    public int size() {
        return tools.size();
    }
}
