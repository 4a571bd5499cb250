package com.openforge.mcpchat.llm.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallSlotsTest {

    private final ToolCallSlots slots = new ToolCallSlots();

    // ===== Explicit indices =====

    @Test
    void explicitIndexIsKept() {
        assertEquals(3, slots.resolve(3, "call_1"));
        assertEquals(3, slots.resolve(3, null));
    }

    // ===== Missing indices =====

    @Test
    void singleIndexlessCallUsesSlotZero() {
        assertEquals(0, slots.resolve(null, "call_1"));
        assertEquals(0, slots.resolve(null, null));
        assertEquals(0, slots.resolve(null, ""));
    }

    @Test
    void freshIdOpensNextSlot() {
        assertEquals(0, slots.resolve(null, "call_a"));
        assertEquals(0, slots.resolve(null, null));
        assertEquals(1, slots.resolve(null, "call_b"));
        assertEquals(1, slots.resolve(null, null));
    }

    @Test
    void repeatedIdReturnsToItsSlot() {
        slots.resolve(null, "call_a");
        slots.resolve(null, "call_b");

        assertEquals(0, slots.resolve(null, "call_a"));
        assertEquals(0, slots.resolve(null, null));
    }

    @Test
    void freshIdAfterIndexedCallsDoesNotCollide() {
        slots.resolve(0, "call_a");
        slots.resolve(1, "call_b");

        assertEquals(2, slots.resolve(null, "call_c"));
        assertEquals(1, slots.resolve(null, "call_b"));
    }
}
