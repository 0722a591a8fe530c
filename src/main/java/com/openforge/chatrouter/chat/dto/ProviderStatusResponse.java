package com.openforge.chatrouter.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.chatrouter.ratelimit.ProviderUsage;
import com.openforge.chatrouter.router.FallbackEvent;
import com.openforge.chatrouter.router.FallbackOutcome;

import java.util.List;
import java.util.Map;

/** Response body for GET /api/providers/status. */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ProviderStatusResponse(
        List<ProviderUsage>          providers,
        List<String>                 recommendations,
        Map<FallbackOutcome, Long>   outcomeCounts,
        List<FallbackEvent>          recentEvents,
        CacheSummary                 cache
) {

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record CacheSummary(long entries, long hits, long misses, double hitRate) {}
}
