package com.openforge.chatrouter.memory;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * One stored fact about a user.
 *
 * @param importance 1 (trivia) – 5 (identity-level fact)
 * @param tags       lowercase labels such as "name" or "goal"
 */
public record MemoryRecord(
        String      id,
        String      ownerId,
        String      content,
        List<Float> embedding,
        int         importance,
        Set<String> tags,
        Instant     createdAt,
        Instant     expiresAt,
        boolean     active
) {

    public MemoryRecord {
        embedding = embedding == null ? List.of() : List.copyOf(embedding);
        tags      = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /** Active and not yet expired. */
    public boolean retrievableAt(Instant now) {
        return active && (expiresAt == null || now.isBefore(expiresAt));
    }

    public MemoryRecord deactivated() {
        return new MemoryRecord(id, ownerId, content, embedding, importance, tags, createdAt, expiresAt, false);
    }
}
