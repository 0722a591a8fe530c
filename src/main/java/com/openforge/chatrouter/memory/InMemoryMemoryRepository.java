package com.openforge.chatrouter.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local memory store used when Milvus is disabled.  Records are lost
 * on restart.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "chat-router.milvus.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryMemoryRepository implements MemoryRepository {

    private final Map<String, MemoryRecord> records = new ConcurrentHashMap<>();

    public InMemoryMemoryRepository() {
        log.info("[Memory] Using in-process memory store; records will not survive a restart.");
    }

    @Override
    public MemoryRecord save(MemoryRecord record) {
        records.put(record.id(), record);
        return record;
    }

    @Override
    public Optional<MemoryRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<MemoryRecord> findCandidates(String ownerId, List<Float> queryVector, int limit, Instant now) {
        // retrievable() is newest first and the sort is stable, so equal scores keep recency order
        return retrievable(ownerId, now).stream()
                .sorted(Comparator.comparingDouble(
                        (MemoryRecord r) -> MemoryRanker.cosine(queryVector, r.embedding())).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<MemoryRecord> findByTags(String ownerId, Set<String> tags, Instant now) {
        return retrievable(ownerId, now).stream()
                .filter(r -> !Collections.disjoint(r.tags(), tags))
                .toList();
    }

    @Override
    public List<MemoryRecord> findCreatedBetween(String ownerId, Instant from, Instant to, Instant now) {
        return retrievable(ownerId, now).stream()
                .filter(r -> !r.createdAt().isBefore(from) && r.createdAt().isBefore(to))
                .toList();
    }

    @Override
    public List<String> findActiveIds(String ownerId, Instant now) {
        return retrievable(ownerId, now).stream().map(MemoryRecord::id).toList();
    }

    @Override
    public Set<String> findOwnersWithRecordsSince(Instant since, Instant now) {
        return records.values().stream()
                .filter(r -> r.retrievableAt(now) && !r.createdAt().isBefore(since))
                .map(MemoryRecord::ownerId)
                .collect(Collectors.toSet());
    }

    @Override
    public void deactivate(String id) {
        records.computeIfPresent(id, (k, r) -> r.deactivated());
    }

    @Override
    public long deleteExpired(Instant now) {
        long before = records.size();
        records.values().removeIf(r -> r.expiresAt() != null && !now.isBefore(r.expiresAt()));
        return before - records.size();
    }

    private List<MemoryRecord> retrievable(String ownerId, Instant now) {
        return records.values().stream()
                .filter(r -> r.ownerId().equals(ownerId) && r.retrievableAt(now))
                .sorted((a, b) -> b.createdAt().compareTo(a.createdAt()))
                .toList();
    }
}
