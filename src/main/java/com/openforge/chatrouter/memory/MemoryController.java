package com.openforge.chatrouter.memory;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API over an owner's long-term memory.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                               Description                  │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST   /api/memories                   store a memory               │
 * │  GET    /api/memories/search?q=...      ranked retrieval + context   │
 * │  DELETE /api/memories/{id}              deactivate one memory        │
 * └──────────────────────────────────────────────────────────────────────┘
 *
 * The owner comes from the {@code X-Owner-Id} header, set by the gateway
 * that authenticated the caller.
 */
@Validated
@RestController
@RequestMapping("/api/memories")
@RequiredArgsConstructor
public class MemoryController {

    static final String OWNER_HEADER = "X-Owner-Id";

    private final MemoryService memoryService;

    @PostMapping
    public ResponseEntity<MemoryView> addMemory(@RequestHeader(OWNER_HEADER) String ownerId,
                                                @Valid @RequestBody AddMemoryRequest req) {
        try {
            MemoryRecord record = memoryService.storeMemory(
                    ownerId,
                    req.content(),
                    req.tags() != null ? req.tags() : Set.of(),
                    req.importance() != null ? req.importance() : 3);
            return ResponseEntity.status(HttpStatus.CREATED).body(MemoryView.of(record, null));
        } catch (MemoryService.MemoryStoreException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Memory store unavailable", e);
        }
    }

    /**
     * Query params:
     *   q      search text                                   (required)
     *   limit  max records                 (default 5, max 50)
     *   level  light | balanced | comprehensive (default comprehensive)
     */
    @GetMapping("/search")
    public ResponseEntity<SearchResponse> search(@RequestHeader(OWNER_HEADER) String ownerId,
                                                 @RequestParam @NotBlank String q,
                                                 @RequestParam(defaultValue = "5") @Min(1) @Max(50) int limit,
                                                 @RequestParam(defaultValue = "comprehensive") String level) {
        ContextLevel contextLevel;
        try {
            contextLevel = ContextLevel.from(level);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown context level: " + level);
        }
        try {
            MemoryContext ctx = memoryService.retrieveRelevant(ownerId, q, limit, contextLevel);
            List<MemoryView> memories = ctx.memories().stream()
                    .map(m -> MemoryView.of(m.record(), m))
                    .toList();
            return ResponseEntity.ok(new SearchResponse(memories, ctx.contextString(), ctx.personalFacts(),
                    ctx.summaries().size(), ctx.stats()));
        } catch (MemoryService.MemoryRetrievalException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Memory retrieval unavailable", e);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deactivate(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable String id) {
        if (!memoryService.deactivate(ownerId, id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Memory not found: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record AddMemoryRequest(
            @NotBlank @Size(max = 4000) String content,
            Set<String> tags,
            @Min(1) @Max(5) Integer importance
    ) {}

    public record MemoryView(
            String      id,
            String      content,
            int         importance,
            Set<String> tags,
            Instant     createdAt,
            Instant     expiresAt,
            Double      similarity,
            Double      score,
            boolean     forced
    ) {
        static MemoryView of(MemoryRecord r, ScoredMemory scored) {
            return new MemoryView(r.id(), r.content(), r.importance(), r.tags(), r.createdAt(), r.expiresAt(),
                    scored == null ? null : scored.similarity(),
                    scored == null ? null : scored.score(),
                    scored != null && scored.forced());
        }
    }

    public record SearchResponse(
            List<MemoryView>    memories,
            String              contextString,
            Map<String, String> personalFacts,
            int                 summaryCount,
            MemoryContext.Stats stats
    ) {}
}
