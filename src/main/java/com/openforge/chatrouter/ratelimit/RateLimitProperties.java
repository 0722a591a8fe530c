package com.openforge.chatrouter.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Tracker-wide thresholds.  Per-provider limits live on each provider entry
 * under {@code chat-router.llm.providers}.
 *
 * chat-router:
 *   rate-limit:
 *     soft-threshold: 0.8
 *     failure-threshold: 3
 *     cooldown: 60s
 */
@ConfigurationProperties(prefix = "chat-router.rate-limit")
public record RateLimitProperties(
        @DefaultValue("0.8") double softThreshold,
        @DefaultValue("3")   int    failureThreshold,
        @DefaultValue("60s") Duration cooldown
) {

    public static RateLimitProperties defaults() {
        return new RateLimitProperties(0.8, 3, Duration.ofSeconds(60));
    }
}
