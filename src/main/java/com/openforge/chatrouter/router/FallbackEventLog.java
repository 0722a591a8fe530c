package com.openforge.chatrouter.router;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.LongAdder;

/**
 * Logs every {@link FallbackEvent} and keeps a bounded window of the most
 * recent ones plus per-outcome counters for the provider status endpoint.
 */
@Slf4j
@Component
@EnableConfigurationProperties(RouterProperties.class)
public class FallbackEventLog {

    private final ConcurrentLinkedDeque<FallbackEvent> recent   = new ConcurrentLinkedDeque<>();
    private final Map<FallbackOutcome, LongAdder>      counters = new ConcurrentHashMap<>();
    private final int                                  capacity;

    public FallbackEventLog(RouterProperties props) {
        this.capacity = Math.max(1, props.eventHistorySize());
    }

    public void record(FallbackEvent event) {
        switch (event.outcome()) {
            case SUCCESS -> log.debug("[Fallback] {} served request {} in {} ms",
                    event.providerId(), event.requestId(), event.latencyMs());
            case SKIPPED_DISABLED, SKIPPED_COOLDOWN, SKIPPED_RATE_LIMITED -> log.info(
                    "[Fallback] Skipped {} (tier {}) for request {}: {}",
                    event.providerId(), event.tier(), event.requestId(), event.outcome());
            default -> log.warn("[Fallback] {} (tier {}) failed for request {} with {} after {} ms: {}",
                    event.providerId(), event.tier(), event.requestId(), event.outcome(),
                    event.latencyMs(), event.detail());
        }

        counters.computeIfAbsent(event.outcome(), k -> new LongAdder()).increment();
        recent.addLast(event);
        while (recent.size() > capacity) {
            recent.pollFirst();
        }
    }

    /** Up to {@code limit} most recent events, newest first. */
    public List<FallbackEvent> recent(int limit) {
        List<FallbackEvent> result = new ArrayList<>(Math.min(limit, capacity));
        Iterator<FallbackEvent> it = recent.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    public Map<FallbackOutcome, Long> counts() {
        Map<FallbackOutcome, Long> result = new EnumMap<>(FallbackOutcome.class);
        counters.forEach((outcome, adder) -> result.put(outcome, adder.sum()));
        return result;
    }
}
