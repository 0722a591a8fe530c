package com.openforge.chatrouter.memory;

import com.openforge.chatrouter.classifier.QueryClassifier;
import com.openforge.chatrouter.classifier.QueryType;
import com.openforge.chatrouter.domain.MemorySummary;
import com.openforge.chatrouter.repository.MemorySummaryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Long-term memory: storing facts about a user and pulling the relevant ones
 * back into a prompt.
 *
 * Retrieval pipeline:
 *
 *   embed(query)
 *     └─ candidates = nearest N records  (+ tag matches for personal queries)
 *     └─ MemoryRanker: blended score, similarity floor, forced tag matches
 *     └─ select by ContextLevel            light / balanced / comprehensive
 *     └─ token budget                       forced records always kept
 *     └─ context string + personal facts + fingerprint
 *
 * Retrieval failures surface as {@link MemoryRetrievalException}; callers
 * treat them as "no memory" rather than failing the chat.
 */
@Slf4j
@Service
public class MemoryService {

    static final int    CHARS_PER_TOKEN   = 4;
    static final String EMPTY_FINGERPRINT = "none";

    private final MemoryRepository        repository;
    private final MemorySummaryRepository summaryRepository;
    private final EmbeddingAdapter        embedder;
    private final MemoryRanker            ranker;
    private final PersonalFactExtractor   factExtractor;
    private final QueryClassifier         classifier;
    private final MemoryProperties        props;
    private final Clock                   clock;

    public MemoryService(MemoryRepository repository,
                         MemorySummaryRepository summaryRepository,
                         EmbeddingAdapter embedder,
                         MemoryRanker ranker,
                         PersonalFactExtractor factExtractor,
                         QueryClassifier classifier,
                         MemoryProperties props,
                         Clock clock) {
        this.repository        = repository;
        this.summaryRepository = summaryRepository;
        this.embedder          = embedder;
        this.ranker            = ranker;
        this.factExtractor     = factExtractor;
        this.classifier        = classifier;
        this.props             = props;
        this.clock             = clock;
    }

    // ── Store ────────────────────────────────────────────────────────────────

    /**
     * Embeds and persists a new active record expiring after the configured
     * retention.  Importance is clamped to 1..5 and tags are lowercased.
     *
     * @throws MemoryStoreException if embedding or persistence fails
     */
    public MemoryRecord storeMemory(String ownerId, String content, Collection<String> tags, int importance) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        Instant now = clock.instant();
        try {
            List<Float> vector = embedder.embed(content);
            MemoryRecord record = new MemoryRecord(
                    UUID.randomUUID().toString(),
                    ownerId,
                    content.trim(),
                    vector,
                    Math.max(1, Math.min(5, importance)),
                    normalizeTags(tags),
                    now,
                    now.plus(props.retention()),
                    true);
            repository.save(record);
            log.info("[Memory] Stored memory {} for owner {} (importance={} tags={})",
                    record.id(), ownerId, record.importance(), record.tags());
            return record;
        } catch (RuntimeException e) {
            throw new MemoryStoreException("Failed to store memory for owner " + ownerId, e);
        }
    }

    /**
     * Stores extracted facts, superseding earlier records that carry the
     * same fact tag.  A fact already stored with identical content is skipped.
     *
     * @return the newly stored records
     */
    public List<MemoryRecord> storeFacts(String ownerId, List<PersonalFactExtractor.Fact> facts) {
        List<MemoryRecord> stored = new ArrayList<>();
        Instant now = clock.instant();
        for (PersonalFactExtractor.Fact fact : facts) {
            List<MemoryRecord> existing = repository.findByTags(ownerId, Set.of(fact.tag()), now);
            boolean duplicate = existing.stream()
                    .anyMatch(r -> r.content().equalsIgnoreCase(fact.statement()));
            if (duplicate) {
                log.debug("[Memory] Fact {} already known for owner {}", fact.tag(), ownerId);
                continue;
            }
            for (MemoryRecord old : existing) {
                repository.deactivate(old.id());
                log.info("[Memory] Superseded memory {} ({}) for owner {}", old.id(), fact.tag(), ownerId);
            }
            stored.add(storeMemory(ownerId, fact.statement(), List.of(fact.tag(), "personal"), fact.importance()));
        }
        return stored;
    }

    public void deactivate(String id) {
        repository.deactivate(id);
        log.info("[Memory] Deactivated memory {}", id);
    }

    /**
     * Deactivates a record only if it belongs to {@code ownerId}.
     *
     * @return false when no such record exists for that owner
     */
    public boolean deactivate(String ownerId, String id) {
        return repository.findById(id)
                .filter(r -> r.ownerId().equals(ownerId))
                .map(r -> {
                    deactivate(id);
                    return true;
                })
                .orElse(false);
    }

    // ── Retrieve ─────────────────────────────────────────────────────────────

    /** Classifies {@code queryText} itself to decide whether personal rules apply. */
    public MemoryContext retrieveRelevant(String ownerId, String queryText, int limit, ContextLevel level) {
        return retrieveRelevant(ownerId, queryText, limit, level, classifier.classify(queryText).type());
    }

    /**
     * @throws MemoryRetrievalException if the query cannot be embedded or the
     *         store cannot be read
     */
    public MemoryContext retrieveRelevant(String ownerId,
                                          String queryText,
                                          int limit,
                                          ContextLevel level,
                                          QueryType queryType) {
        long    start    = System.nanoTime();
        Instant now      = clock.instant();
        boolean personal = queryType == QueryType.PERSONAL;

        try {
            List<Float> queryVector = embedder.embed(queryText);
            Set<String> queryTags   = personal ? factExtractor.queryTags(queryText) : Set.of();

            List<MemoryRecord> candidates = new ArrayList<>(
                    repository.findCandidates(ownerId, queryVector, props.candidateLimit(), now));
            if (personal && !queryTags.isEmpty()) {
                candidates.addAll(repository.findByTags(ownerId, queryTags, now));
            }

            List<ScoredMemory>  ranked    = ranker.rank(candidates, queryVector, queryTags, personal, now);
            List<ScoredMemory>  selected  = withinBudget(select(ranked, limit, level));
            List<MemorySummary> summaries = level == ContextLevel.COMPREHENSIVE
                    ? summariesWithinBudget(ownerId, now, tokens(selected))
                    : List.of();

            Map<String, String> facts = factExtractor.facts(
                    selected.stream().map(s -> s.record().content()).toList());
            String context = formatContext(selected, summaries, facts);

            MemoryContext.Stats stats = new MemoryContext.Stats(
                    new HashSet<>(candidates.stream().map(MemoryRecord::id).toList()).size(),
                    ranked.size(),
                    (int) selected.stream().filter(ScoredMemory::forced).count(),
                    estimateTokens(context),
                    (System.nanoTime() - start) / 1_000_000L);

            log.debug("[Memory] Retrieved {} memories + {} summaries for owner {} (level={} type={} stats={})",
                    selected.size(), summaries.size(), ownerId, level, queryType, stats);

            return new MemoryContext(selected, summaries, context, facts,
                    fingerprint(ownerId, now), stats);
        } catch (MemoryRetrievalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MemoryRetrievalException("Memory retrieval failed for owner " + ownerId, e);
        }
    }

    /**
     * Stable hash of the owner's retrievable records and live summaries.
     * Changes whenever a record is stored, superseded or expires.
     */
    public String fingerprint(String ownerId) {
        return fingerprint(ownerId, clock.instant());
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private String fingerprint(String ownerId, Instant now) {
        List<String> parts = new ArrayList<>(repository.findActiveIds(ownerId, now));
        for (MemorySummary s : liveSummaries(ownerId, now)) {
            parts.add("summary:" + s.getId() + ":" + s.getSourceCount());
        }
        if (parts.isEmpty()) return EMPTY_FINGERPRINT;
        parts.sort(null);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (String p : parts) {
                digest.update(p.getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '\n');
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private List<ScoredMemory> select(List<ScoredMemory> ranked, int limit, ContextLevel level) {
        int max = level.recordsFor(limit);
        List<ScoredMemory> forced = ranked.stream().filter(ScoredMemory::forced).toList();
        if (forced.size() >= max) return forced;

        List<ScoredMemory> picked = new ArrayList<>(forced);
        if (level == ContextLevel.BALANCED) {
            Set<String> seenTags = new HashSet<>();
            forced.forEach(s -> seenTags.addAll(s.record().tags()));
            for (ScoredMemory s : ranked) {
                if (picked.size() >= max) break;
                if (picked.contains(s)) continue;
                if (s.record().tags().isEmpty() || !seenTags.containsAll(s.record().tags())) {
                    picked.add(s);
                    seenTags.addAll(s.record().tags());
                }
            }
        }
        for (ScoredMemory s : ranked) {
            if (picked.size() >= max) break;
            if (!picked.contains(s)) picked.add(s);
        }
        picked.sort((a, b) -> Integer.compare(ranked.indexOf(a), ranked.indexOf(b)));
        return picked;
    }

    private List<ScoredMemory> withinBudget(List<ScoredMemory> selected) {
        int budget = props.tokenBudget();
        int used   = 0;
        List<ScoredMemory> kept = new ArrayList<>(selected.size());
        for (ScoredMemory s : selected) {
            int cost = estimateTokens(s.record().content());
            if (s.forced() || used + cost <= budget) {
                kept.add(s);
                used += cost;
            }
        }
        return kept;
    }

    private List<MemorySummary> summariesWithinBudget(String ownerId, Instant now, int usedTokens) {
        List<MemorySummary> kept = new ArrayList<>();
        int used = usedTokens;
        for (MemorySummary s : liveSummaries(ownerId, now)) {
            int cost = estimateTokens(s.getSummaryText());
            if (used + cost > props.tokenBudget()) break;
            kept.add(s);
            used += cost;
        }
        return kept;
    }

    private List<MemorySummary> liveSummaries(String ownerId, Instant now) {
        return summaryRepository.findByOwnerIdAndExpiresAtAfterOrderByPeriodStartDesc(ownerId, now);
    }

    private static String formatContext(List<ScoredMemory> memories,
                                        List<MemorySummary> summaries,
                                        Map<String, String> facts) {
        if (memories.isEmpty() && summaries.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        if (!facts.isEmpty()) {
            sb.append("Known facts about the user:\n");
            facts.forEach((k, v) -> sb.append("- ").append(k).append(": ").append(v).append('\n'));
            sb.append('\n');
        }
        if (!memories.isEmpty()) {
            sb.append("Relevant memories from previous conversations:\n");
            for (ScoredMemory m : memories) {
                sb.append("- ").append(m.record().content()).append('\n');
            }
        }
        if (!summaries.isEmpty()) {
            sb.append("\nEarlier conversation summaries:\n");
            for (MemorySummary s : summaries) {
                sb.append("- [").append(s.getPeriod().name().toLowerCase(Locale.ROOT))
                  .append(" from ").append(s.getPeriodStart()).append("] ")
                  .append(s.getSummaryText()).append('\n');
            }
        }
        return sb.toString().trim();
    }

    private static int tokens(List<ScoredMemory> memories) {
        return memories.stream().mapToInt(m -> estimateTokens(m.record().content())).sum();
    }

    static int estimateTokens(String text) {
        return text == null ? 0 : (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    private static Set<String> normalizeTags(Collection<String> tags) {
        Set<String> normalized = new LinkedHashSet<>();
        if (tags == null) return normalized;
        for (String t : tags) {
            if (t != null && !t.isBlank()) normalized.add(t.trim().toLowerCase(Locale.ROOT));
        }
        return normalized;
    }

    // ── Exceptions ───────────────────────────────────────────────────────────

    public static class MemoryRetrievalException extends RuntimeException {
        public MemoryRetrievalException(String message, Throwable cause) { super(message, cause); }
    }

    public static class MemoryStoreException extends RuntimeException {
        public MemoryStoreException(String message, Throwable cause) { super(message, cause); }
    }
}
