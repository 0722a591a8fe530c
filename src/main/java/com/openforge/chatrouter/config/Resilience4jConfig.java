package com.openforge.chatrouter.config;

import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * Only the TimeLimiter is used: ProviderAdapterPool creates one named limiter
 * per provider from this registry, overriding the timeout with the
 * provider's {@code timeout-seconds}.  Retries and breaking are not
 * Resilience4j's job here: the router never retries a provider within a
 * request, and RateLimitTracker owns cooldowns.
 */
@Configuration
public class Resilience4jConfig {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(DEFAULT_TIMEOUT)
                // interrupt the provider thread so a hung HTTP call frees its slot
                .cancelRunningFuture(true)
                .build();
        return TimeLimiterRegistry.of(config);
    }
}
