package com.openforge.chatrouter.memory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage port for {@link MemoryRecord}s, always scoped by owner.
 *
 * Every finder returns only records that are active and not expired at
 * {@code now}; callers may rely on that but {@link MemoryService} checks it
 * again anyway.
 */
public interface MemoryRepository {

    MemoryRecord save(MemoryRecord record);

    Optional<MemoryRecord> findById(String id);

    /**
     * Retrieval candidates for one owner: the {@code limit} retrievable
     * records nearest to {@code queryVector}, chosen from all of the owner's
     * records.
     */
    List<MemoryRecord> findCandidates(String ownerId, List<Float> queryVector, int limit, Instant now);

    /** Records carrying at least one of {@code tags}. */
    List<MemoryRecord> findByTags(String ownerId, Set<String> tags, Instant now);

    /** Records created in {@code [from, to)}. */
    List<MemoryRecord> findCreatedBetween(String ownerId, Instant from, Instant to, Instant now);

    /** Ids of every retrievable record of the owner. */
    List<String> findActiveIds(String ownerId, Instant now);

    /** Owners with at least one retrievable record created at or after {@code since}. */
    Set<String> findOwnersWithRecordsSince(Instant since, Instant now);

    void deactivate(String id);

    /** Physically removes expired records; returns how many were removed. */
    long deleteExpired(Instant now);
}
