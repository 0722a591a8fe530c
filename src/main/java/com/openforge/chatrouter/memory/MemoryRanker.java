package com.openforge.chatrouter.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Blended relevance scoring for memory records.
 *
 *   score = similarity * wSimilarity
 *         + (importance / 5) * wImportance
 *         + 0.5^(age / halfLife) * wRecency
 *
 * Personal queries use the lower similarity floor and force-include any
 * record whose tags intersect the query's tag terms, so a stored "name" fact
 * survives a weak vector match.
 */
public class MemoryRanker {

    private static final Comparator<ScoredMemory> ORDER =
            Comparator.comparing(ScoredMemory::forced).reversed()
                    .thenComparing(Comparator.comparingDouble(ScoredMemory::score).reversed())
                    .thenComparing(s -> s.record().createdAt(), Comparator.reverseOrder());

    private final MemoryProperties props;

    public MemoryRanker(MemoryProperties props) {
        this.props = props;
    }

    /**
     * Scores, filters and orders {@code candidates}.  Duplicates (same id) and
     * records not retrievable at {@code now} are dropped.
     */
    public List<ScoredMemory> rank(Collection<MemoryRecord> candidates,
                                   List<Float> queryVector,
                                   Set<String> queryTags,
                                   boolean personal,
                                   Instant now) {
        Map<String, MemoryRecord> unique = new LinkedHashMap<>();
        for (MemoryRecord r : candidates) {
            if (r.retrievableAt(now)) unique.putIfAbsent(r.id(), r);
        }

        double floor = personal ? props.personalMinSimilarity() : props.minSimilarity();
        List<ScoredMemory> ranked = new ArrayList<>(unique.size());
        for (MemoryRecord r : unique.values()) {
            double  similarity = cosine(queryVector, r.embedding());
            boolean forced     = personal && !Collections.disjoint(r.tags(), queryTags);
            if (!forced && similarity < floor) continue;
            ranked.add(new ScoredMemory(r, similarity, score(r, similarity, now), forced));
        }
        ranked.sort(ORDER);
        return ranked;
    }

    double score(MemoryRecord r, double similarity, Instant now) {
        MemoryProperties.Weights w = props.weights();
        return similarity * w.similarity()
             + (Math.max(1, Math.min(5, r.importance())) / 5.0) * w.importance()
             + recency(r.createdAt(), now) * w.recency();
    }

    double recency(Instant createdAt, Instant now) {
        double ageMs      = Math.max(0, Duration.between(createdAt, now).toMillis());
        double halfLifeMs = Math.max(1, props.recencyHalfLife().toMillis());
        return Math.pow(0.5, ageMs / halfLifeMs);
    }

    /** Cosine similarity; 0 for empty or mismatched vectors. */
    static double cosine(List<Float> a, List<Float> b) {
        if (a.isEmpty() || a.size() != b.size()) return 0.0;
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i), y = b.get(i);
            dot += x * y;
            na  += x * x;
            nb  += y * y;
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
