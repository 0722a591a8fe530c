package com.openforge.chatrouter.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Retention, ranking and budget settings for long-term memory.
 *
 * chat-router:
 *   memory:
 *     retention: 180d
 *     weights:
 *       similarity: 0.6
 *       importance: 0.25
 *       recency: 0.15
 *     min-similarity: 0.35
 *     personal-min-similarity: 0.1
 *     recency-half-life: 30d
 *     token-budget: 800
 *     candidate-limit: 200
 *     weekly-summary-retention: 56d
 *     monthly-summary-retention: 365d
 */
@ConfigurationProperties(prefix = "chat-router.memory")
public record MemoryProperties(
        @DefaultValue("180d") Duration retention,
        @DefaultValue Weights  weights,
        @DefaultValue("0.35") double   minSimilarity,
        @DefaultValue("0.1")  double   personalMinSimilarity,
        @DefaultValue("30d")  Duration recencyHalfLife,
        @DefaultValue("800")  int      tokenBudget,
        @DefaultValue("200")  int      candidateLimit,
        @DefaultValue("56d")  Duration weeklySummaryRetention,
        @DefaultValue("365d") Duration monthlySummaryRetention
) {

    public record Weights(
            @DefaultValue("0.6")  double similarity,
            @DefaultValue("0.25") double importance,
            @DefaultValue("0.15") double recency
    ) {}

    public static MemoryProperties defaults() {
        return new MemoryProperties(Duration.ofDays(180), new Weights(0.6, 0.25, 0.15),
                0.35, 0.1, Duration.ofDays(30), 800, 200, Duration.ofDays(56), Duration.ofDays(365));
    }
}
