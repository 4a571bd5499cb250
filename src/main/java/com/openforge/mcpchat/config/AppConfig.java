package com.openforge.mcpchat.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure. One executor carries conversation runs, tool calls
 * and index rebuilds; one HttpClient talks to every remote endpoint.
 */
@Configuration
public class AppConfig {

    /**
     * Cached pool: runs block on network I/O for most of their life, so
     * threads are created on demand and reclaimed when idle.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "agent-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    /** Timeouts beyond connect are per request, set by each caller. */
    @Bean
    public HttpClient httpClient(ExecutorService agentExecutor) {
        return HttpClient.newBuilder()
                .executor(agentExecutor)
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * snake_case matches the provider wire format (tool_calls, tool_call_id).
     * Types that face the REST API or tool servers opt back into camelCase
     * with {@code @JsonNaming}.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
