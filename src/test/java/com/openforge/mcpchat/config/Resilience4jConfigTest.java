package com.openforge.mcpchat.config;

import com.openforge.mcpchat.dispatch.ToolDispatchProperties;
import com.openforge.mcpchat.llm.LlmClient;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class Resilience4jConfigTest {

    private final Resilience4jConfig config = new Resilience4jConfig();

    // ===== Retry classification =====

    @Test
    void rateLimitAndNetworkErrorsAreTransient() {
        assertTrue(Resilience4jConfig.isTransient(new LlmClient.LlmRateLimitException("429")));
        assertTrue(Resilience4jConfig.isTransient(new HttpTimeoutException("request timed out")));
        assertTrue(Resilience4jConfig.isTransient(
                new LlmClient.LlmException("Network error", new IOException("reset"))));
        assertTrue(Resilience4jConfig.isTransient(new UncheckedIOException(new IOException("eof"))));
    }

    @Test
    void clientErrorsAreNotRetried() {
        assertFalse(Resilience4jConfig.isTransient(new LlmClient.LlmException("HTTP 400: bad request")));
        assertFalse(Resilience4jConfig.isTransient(new IllegalArgumentException("bad")));
    }

    // ===== Beans =====

    @Test
    void retryMakesThreeAttempts() {
        Retry retry = config.primaryLlmRetry(config.retryRegistry());

        assertEquals("primaryLlm", retry.getName());
        assertEquals(3, retry.getRetryConfig().getMaxAttempts());
    }

    @Test
    void toolTimeLimiterUsesConfiguredTimeoutAndCancels() {
        TimeLimiter limiter = config.toolCallTimeLimiter(new ToolDispatchProperties(Duration.ofSeconds(15)));

        assertEquals(Duration.ofSeconds(15), limiter.getTimeLimiterConfig().getTimeoutDuration());
        assertTrue(limiter.getTimeLimiterConfig().shouldCancelRunningFuture());
    }
}
