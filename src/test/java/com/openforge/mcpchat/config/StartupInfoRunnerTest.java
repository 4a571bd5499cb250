package com.openforge.mcpchat.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StartupInfoRunnerTest {

    @Test
    void maskKeyHidesTheMiddle() {
        assertEquals("(not set)", StartupInfoRunner.maskKey(null));
        assertEquals("(not set)", StartupInfoRunner.maskKey(" "));
        assertEquals("***", StartupInfoRunner.maskKey("short"));
        assertEquals("sk-abc...wxyz", StartupInfoRunner.maskKey("sk-abcdefghijklmnopqrstuvwxyz"));
    }
}
