package com.openforge.chatrouter.memory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.DeleteResp;
import io.milvus.v2.service.vector.response.QueryResp;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Memory records in a Milvus collection (see {@link MilvusConfig} for the
 * schema).
 *
 * Every read carries an owner filter plus {@code active == true} and an
 * expiry bound, so expired or superseded rows never leave the database.
 * Deactivation is an upsert of the full row because Milvus has no partial
 * update.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "chat-router.milvus.enabled", havingValue = "true")
public class MilvusMemoryRepository implements MemoryRepository {

    private static final List<String> SCALAR_FIELDS = List.of(
            "id", "owner_id", "content", "importance", "tags", "create_time_ms", "expires_at_ms", "active");

    private static final List<String> ALL_FIELDS;
    static {
        List<String> all = new ArrayList<>(SCALAR_FIELDS);
        all.add("embedding");
        ALL_FIELDS = List.copyOf(all);
    }

    private static final long QUERY_LIMIT = 16_384L;

    private final MilvusClientV2 milvusClient;
    private final String         collection;

    public MilvusMemoryRepository(MilvusClientV2 milvusClient, MilvusProperties props) {
        this.milvusClient = milvusClient;
        this.collection   = props.collectionName();
    }

    // ── Write ────────────────────────────────────────────────────────────────

    @Override
    public MemoryRecord save(MemoryRecord record) {
        milvusClient.upsert(UpsertReq.builder()
                .collectionName(collection)
                .data(List.of(toRow(record)))
                .build());
        log.debug("[Milvus] Upserted memory {} for owner {}", record.id(), record.ownerId());
        return record;
    }

    @Override
    public void deactivate(String id) {
        findById(id).ifPresent(r -> save(r.deactivated()));
    }

    @Override
    public long deleteExpired(Instant now) {
        DeleteResp resp = milvusClient.delete(DeleteReq.builder()
                .collectionName(collection)
                .filter("expires_at_ms <= %d".formatted(now.toEpochMilli()))
                .build());
        return resp == null ? 0L : resp.getDeleteCnt();
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    @Override
    public Optional<MemoryRecord> findById(String id) {
        List<MemoryRecord> found = query("id == \"%s\"".formatted(escape(id)), ALL_FIELDS, 1);
        return found.stream().findFirst();
    }

    @Override
    public List<MemoryRecord> findCandidates(String ownerId, List<Float> queryVector, int limit, Instant now) {
        SearchResp resp = milvusClient.search(SearchReq.builder()
                .collectionName(collection)
                .data(List.of(new FloatVec(queryVector)))
                .annsField("embedding")
                .topK(limit)
                .filter(retrievable(ownerId, now))
                .outputFields(ALL_FIELDS)
                .build());

        List<MemoryRecord> results = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return results;
        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                results.add(toRecord(hit.getEntity()));
            }
        }
        return results;
    }

    @Override
    public List<MemoryRecord> findByTags(String ownerId, Set<String> tags, Instant now) {
        if (tags.isEmpty()) return List.of();
        String tagList = tags.stream()
                .map(t -> "\"" + escape(t) + "\"")
                .collect(Collectors.joining(", ", "[", "]"));
        return query(retrievable(ownerId, now) + " && ARRAY_CONTAINS_ANY(tags, " + tagList + ")",
                ALL_FIELDS, QUERY_LIMIT);
    }

    @Override
    public List<MemoryRecord> findCreatedBetween(String ownerId, Instant from, Instant to, Instant now) {
        return query(retrievable(ownerId, now)
                        + " && create_time_ms >= %d && create_time_ms < %d".formatted(from.toEpochMilli(), to.toEpochMilli()),
                SCALAR_FIELDS, QUERY_LIMIT);
    }

    @Override
    public List<String> findActiveIds(String ownerId, Instant now) {
        return query(retrievable(ownerId, now), List.of("id"), QUERY_LIMIT).stream()
                .map(MemoryRecord::id)
                .toList();
    }

    @Override
    public Set<String> findOwnersWithRecordsSince(Instant since, Instant now) {
        String filter = "active == true && expires_at_ms > %d && create_time_ms >= %d"
                .formatted(now.toEpochMilli(), since.toEpochMilli());
        Set<String> owners = new LinkedHashSet<>();
        for (MemoryRecord r : query(filter, List.of("id", "owner_id"), QUERY_LIMIT)) {
            owners.add(r.ownerId());
        }
        return owners;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<MemoryRecord> query(String filter, List<String> fields, long limit) {
        QueryResp resp = milvusClient.query(QueryReq.builder()
                .collectionName(collection)
                .filter(filter)
                .outputFields(fields)
                .limit(limit)
                .build());
        List<MemoryRecord> list = new ArrayList<>();
        if (resp == null || resp.getQueryResults() == null) return list;
        for (QueryResp.QueryResult r : resp.getQueryResults()) {
            list.add(toRecord(r.getEntity()));
        }
        return list;
    }

    private static String retrievable(String ownerId, Instant now) {
        return "owner_id == \"%s\" && active == true && expires_at_ms > %d"
                .formatted(escape(ownerId), now.toEpochMilli());
    }

    private static JsonObject toRow(MemoryRecord record) {
        JsonObject row = new JsonObject();
        row.addProperty("id",             record.id());
        row.addProperty("owner_id",       record.ownerId());
        row.addProperty("content",        truncate(record.content(), 4000));
        row.addProperty("importance",     record.importance());
        row.addProperty("create_time_ms", record.createdAt().toEpochMilli());
        row.addProperty("expires_at_ms",  record.expiresAt() == null ? Long.MAX_VALUE : record.expiresAt().toEpochMilli());
        row.addProperty("active",         record.active());

        JsonArray tags = new JsonArray();
        record.tags().stream().limit(MilvusConfig.MAX_TAGS).forEach(tags::add);
        row.add("tags", tags);

        JsonArray embedding = new JsonArray();
        for (Float f : record.embedding()) embedding.add(f);
        row.add("embedding", embedding);
        return row;
    }

    private static MemoryRecord toRecord(Map<String, Object> e) {
        long expiresMs = num(e, "expires_at_ms", Long.MAX_VALUE);
        return new MemoryRecord(
                str(e, "id"),
                str(e, "owner_id"),
                str(e, "content"),
                floats(e.get("embedding")),
                (int) num(e, "importance", 1),
                strings(e.get("tags")),
                Instant.ofEpochMilli(num(e, "create_time_ms", 0L)),
                expiresMs == Long.MAX_VALUE ? null : Instant.ofEpochMilli(expiresMs),
                !Boolean.FALSE.equals(e.get("active")));
    }

    private static String str(Map<String, Object> e, String key) {
        Object v = e.get(key);
        return v == null ? "" : v.toString();
    }

    private static long num(Map<String, Object> e, String key, long fallback) {
        return e.get(key) instanceof Number n ? n.longValue() : fallback;
    }

    private static List<Float> floats(Object raw) {
        if (!(raw instanceof List<?> list)) return List.of();
        List<Float> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (o instanceof Number n) out.add(n.floatValue());
        }
        return out;
    }

    private static Set<String> strings(Object raw) {
        if (!(raw instanceof List<?> list)) return Set.of();
        Set<String> out = new HashSet<>();
        for (Object o : list) {
            if (o != null) out.add(o.toString());
        }
        return out;
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
