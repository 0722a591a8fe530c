package com.openforge.chatrouter.llm;

import io.github.resilience4j.timelimiter.TimeLimiter;

/**
 * One entry of the {@link ProviderAdapterPool}: an adapter, its tier rank and
 * the time limiter bounding each call.
 */
public record PooledProvider(
        String          id,
        int             tier,
        ProviderAdapter adapter,
        TimeLimiter     timeLimiter
) {}
