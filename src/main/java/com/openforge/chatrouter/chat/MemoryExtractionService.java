package com.openforge.chatrouter.chat;

import com.openforge.chatrouter.memory.MemoryRecord;
import com.openforge.chatrouter.memory.MemoryService;
import com.openforge.chatrouter.memory.PersonalFactExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks memory-worthy facts out of a user's message after the reply has been
 * returned, on {@code memoryExtractionExecutor}.
 *
 * Two sources:
 *   - identity facts (name, age, location, school, subject, goal)
 *   - explicit "remember that ..." requests, stored verbatim as notes
 *
 * Failures are logged and never reach the chat response.
 */
@Slf4j
@Service
public class MemoryExtractionService {

    private static final Pattern REMEMBER_REQUEST =
            Pattern.compile("(?i)^\\s*(?:please\\s+)?remember(?:\\s+that)?\\s+(.{3,500}?)[.!]?\\s*$");

    static final int NOTE_IMPORTANCE = 4;

    private final MemoryService         memoryService;
    private final PersonalFactExtractor factExtractor;
    private final ExecutorService       executor;

    public MemoryExtractionService(MemoryService memoryService,
                                   PersonalFactExtractor factExtractor,
                                   @Qualifier("memoryExtractionExecutor") ExecutorService executor) {
        this.memoryService = memoryService;
        this.factExtractor = factExtractor;
        this.executor      = executor;
    }

    /**
     * Schedules extraction and returns immediately.  The future completes
     * with the number of records stored, or 0 when extraction failed.
     */
    public CompletableFuture<Integer> submit(String ownerId, String requestId, String userMessage) {
        return CompletableFuture
                .supplyAsync(() -> extractAndStore(ownerId, userMessage), executor)
                .exceptionally(e -> {
                    log.warn("[Extract] Memory extraction failed for request {} (owner {}): {}",
                            requestId, ownerId, e.getMessage(), e);
                    return 0;
                });
    }

    int extractAndStore(String ownerId, String userMessage) {
        List<MemoryRecord> stored = new ArrayList<>(
                memoryService.storeFacts(ownerId, factExtractor.extract(userMessage)));

        Matcher note = REMEMBER_REQUEST.matcher(userMessage);
        if (note.matches()) {
            stored.add(memoryService.storeMemory(ownerId, note.group(1).trim(), List.of("note"), NOTE_IMPORTANCE));
        }

        if (!stored.isEmpty()) {
            log.info("[Extract] Stored {} memories for owner {}: {}", stored.size(), ownerId,
                    stored.stream().map(MemoryRecord::tags).toList());
        }
        return stored.size();
    }
}
