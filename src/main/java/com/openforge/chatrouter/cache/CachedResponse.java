package com.openforge.chatrouter.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Stored reply.  Carries its own {@code createdAt} and {@code ttl} so reads can
 * reject an entry the moment it expires, independent of eviction timing.
 */
public record CachedResponse(
        String       content,
        String       provider,
        String       model,
        int          tokensUsed,
        List<String> memoryReferences,
        Instant      createdAt,
        Duration     ttl
) {

    public CachedResponse {
        memoryReferences = memoryReferences == null ? List.of() : List.copyOf(memoryReferences);
    }

    public boolean expiredAt(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
