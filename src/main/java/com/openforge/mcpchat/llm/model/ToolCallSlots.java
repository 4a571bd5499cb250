package com.openforge.mcpchat.llm.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Assigns stream indices to tool-call pieces for one response.
 *
 * Pieces that carry an index keep it. A piece without one belongs to the
 * call its id names; a new id opens the next free slot, and a piece with
 * neither continues the most recent call.
 *
 * Not thread-safe; one instance per stream.
 */
public final class ToolCallSlots {

    private final Map<String, Integer> slotsById = new HashMap<>();
    private int current = -1;
    private int highest = -1;

    public int resolve(Integer index, String id) {
        boolean hasId = id != null && !id.isEmpty();
        int slot;
        if (index != null) {
            slot = index;
        } else if (hasId) {
            slot = slotsById.computeIfAbsent(id, k -> highest + 1);
        } else {
            slot = Math.max(current, 0);
        }
        if (hasId) slotsById.putIfAbsent(id, slot);
        current = slot;
        highest = Math.max(highest, slot);
        return slot;
    }
}
