package com.openforge.chatrouter.router;

import java.util.List;

/**
 * Outcome of a routing pass: either a provider reply or the degraded
 * response.  {@code events} holds one entry per candidate visited.
 */
public record RoutingResult(
        String              text,
        String              providerId,
        String              model,
        int                 tier,
        long                latencyMs,
        int                 tokensUsed,
        boolean             degraded,
        List<FallbackEvent> events
) {

    public static final String DEGRADED_PROVIDER = "system";
    public static final String DEGRADED_MODEL    = "graceful-degradation";

    public RoutingResult {
        events = List.copyOf(events);
    }

    public static RoutingResult degraded(String message, long latencyMs, List<FallbackEvent> events) {
        return new RoutingResult(message, DEGRADED_PROVIDER, DEGRADED_MODEL, 0, latencyMs, 0, true, events);
    }

    /** Provider calls plus skips; never more than the number of configured providers. */
    public int attempts() {
        return events.size();
    }

    /** True when a provider other than the first candidate produced the reply. */
    public boolean fallbackUsed() {
        return !degraded && events.size() > 1;
    }
}
