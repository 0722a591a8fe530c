package com.openforge.chatrouter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Core infrastructure beans:
 *  - providerCallExecutor      → bounded pool that runs blocking provider calls
 *  - memoryExtractionExecutor  → small pool for post-response fact extraction
 *  - Java HttpClient           → the only HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper      → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - Clock                     → UTC; replaced by a fixed or mutable clock in tests
 *
 * Both pools have bounded queues.  A full provider pool rejects the call,
 * which the router treats as a transient failure of that provider.
 */
@Configuration
public class AppConfig {

    private static final int PROVIDER_THREADS   = 32;
    private static final int PROVIDER_QUEUE     = 256;
    private static final int EXTRACTION_THREADS = 2;
    private static final int EXTRACTION_QUEUE   = 500;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService providerCallExecutor() {
        return boundedPool(PROVIDER_THREADS, PROVIDER_QUEUE, "provider-call-",
                new ThreadPoolExecutor.AbortPolicy());
    }

    /** Extraction is best effort; when the queue is full the oldest pending job is dropped. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService memoryExtractionExecutor() {
        return boundedPool(EXTRACTION_THREADS, EXTRACTION_QUEUE, "memory-extract-",
                new ThreadPoolExecutor.DiscardOldestPolicy());
    }

    /**
     * Single, shared HttpClient instance.
     * 10 s connect timeout; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (finish_reason, max_tokens …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (API can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ExecutorService boundedPool(int threads, int queue, String prefix,
                                               RejectedExecutionHandler onFull) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queue),
                new CustomizableThreadFactory(prefix),
                onFull);
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
