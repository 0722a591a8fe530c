package com.openforge.chatrouter.memory;

import java.util.Locale;

/** How much memory to pull into a prompt. */
public enum ContextLevel {

    /** Top one or two records. */
    LIGHT(2),

    /** Up to four records, preferring different tags. */
    BALANCED(4),

    /** Up to the caller's limit, plus summaries, within the token budget. */
    COMPREHENSIVE(Integer.MAX_VALUE);

    private final int maxRecords;

    ContextLevel(int maxRecords) {
        this.maxRecords = maxRecords;
    }

    public int recordsFor(int limit) {
        return Math.max(0, Math.min(limit, maxRecords));
    }

    public static ContextLevel from(String value) {
        if (value == null || value.isBlank()) return BALANCED;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
