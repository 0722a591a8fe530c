package com.openforge.chatrouter.memory;

/**
 * A record with its retrieval scores.
 *
 * @param forced true when included through an exact tag match rather than score
 */
public record ScoredMemory(
        MemoryRecord record,
        double       similarity,
        double       score,
        boolean      forced
) {}
