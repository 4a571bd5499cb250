package com.openforge.mcpchat.config;

import com.openforge.mcpchat.dispatch.ToolDispatchProperties;
import com.openforge.mcpchat.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * LLM providers, one named instance each:
 *   • "primaryLlm"
 *   • "fallbackLlm"
 * Both guard opening the completion stream only (see LlmRouter).
 *
 * Tool calls:
 *   • "toolCall" time limiter, bounding every remote tool invocation
 */
@Configuration
@EnableConfigurationProperties(ToolDispatchProperties.class)
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // opening a stream should take seconds, not tens of seconds
                .slowCallDurationThreshold(Duration.ofSeconds(30))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker("primaryLlm");
        registry.circuitBreaker("fallbackLlm");
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("primaryLlm");
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("fallbackLlm");
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                // exponential back-off: 1 s → 2 s
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofSeconds(1), 2.0))
                .retryOnException(Resilience4jConfig::isTransient)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry("primaryLlm");
        registry.retry("fallbackLlm");
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry("primaryLlm");
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry("fallbackLlm");
    }

    // ── Tool calls ───────────────────────────────────────────────────────────

    @Bean
    public TimeLimiter toolCallTimeLimiter(ToolDispatchProperties properties) {
        return TimeLimiter.of("toolCall", TimeLimiterConfig.custom()
                .timeoutDuration(properties.timeout())
                .cancelRunningFuture(true)
                .build());
    }

    /** 429s and network errors are worth another attempt; other HTTP errors are not. */
    static boolean isTransient(Throwable e) {
        return e instanceof LlmClient.LlmRateLimitException
                || e instanceof IOException
                || e.getCause() instanceof IOException;
    }
}
