package com.openforge.chatrouter.memory;

import com.openforge.chatrouter.domain.MemorySummary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link MemoryService#retrieveRelevant}: selected records, any
 * summaries, the prompt block built from them and the facts read out of them.
 *
 * @param fingerprint stable hash of the owner's memory state, for cache keys
 */
public record MemoryContext(
        List<ScoredMemory>  memories,
        List<MemorySummary> summaries,
        String              contextString,
        Map<String, String> personalFacts,
        String              fingerprint,
        Stats               stats
) {

    public record Stats(int candidates, int aboveThreshold, int forced, int estimatedTokens, long latencyMs) {
        public static final Stats NONE = new Stats(0, 0, 0, 0, 0L);
    }

    public MemoryContext {
        memories      = List.copyOf(memories);
        summaries     = List.copyOf(summaries);
        personalFacts = Collections.unmodifiableMap(new LinkedHashMap<>(personalFacts));
    }

    public static MemoryContext empty(String fingerprint) {
        return new MemoryContext(List.of(), List.of(), "", Map.of(), fingerprint, Stats.NONE);
    }

    public boolean hasContent() {
        return !contextString.isBlank();
    }

    public List<String> memoryIds() {
        return memories.stream().map(m -> m.record().id()).toList();
    }
}
