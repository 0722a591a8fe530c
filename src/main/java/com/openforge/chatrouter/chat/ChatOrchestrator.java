package com.openforge.chatrouter.chat;

import com.openforge.chatrouter.cache.CacheKeys;
import com.openforge.chatrouter.cache.CachePolicy;
import com.openforge.chatrouter.cache.CachedResponse;
import com.openforge.chatrouter.cache.ResponseCache;
import com.openforge.chatrouter.classifier.QueryClassification;
import com.openforge.chatrouter.classifier.QueryClassifier;
import com.openforge.chatrouter.classifier.QueryType;
import com.openforge.chatrouter.llm.LlmProperties;
import com.openforge.chatrouter.llm.SendParams;
import com.openforge.chatrouter.llm.model.Message;
import com.openforge.chatrouter.memory.ContextLevel;
import com.openforge.chatrouter.memory.MemoryContext;
import com.openforge.chatrouter.memory.MemoryService;
import com.openforge.chatrouter.router.FallbackRouter;
import com.openforge.chatrouter.router.RoutingRequest;
import com.openforge.chatrouter.router.RoutingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Top-level entry point for one chat message.
 *
 * Flow:
 *
 *   handleChatRequest
 *     └─ validate                          ChatRequestException on bad input
 *     └─ classify                          QueryClassifier
 *     └─ cache lookup                      key includes the memory fingerprint
 *          hit  → append history, return
 *     └─ memory retrieval                  memory chat types only; failure = no memory
 *     └─ FallbackRouter.route              never throws for provider failures
 *          degraded → return (no cache, no extraction)
 *     └─ cache write                       per-classification TTL
 *     └─ async fact extraction             memory chat types only
 *     └─ append history, return
 */
@Slf4j
@Service
@EnableConfigurationProperties(ChatProperties.class)
public class ChatOrchestrator {

    static final String DEFAULT_CHAT_TYPE = "general";

    private final QueryClassifier            classifier;
    private final ResponseCache              cache;
    private final CachePolicy                cachePolicy;
    private final MemoryService              memoryService;
    private final FallbackRouter             router;
    private final MemoryExtractionService    extractionService;
    private final ConversationHistoryService historyService;
    private final ChatProperties             props;
    private final SendParams                 sendParams;
    private final Clock                      clock;

    public ChatOrchestrator(QueryClassifier classifier,
                            ResponseCache cache,
                            CachePolicy cachePolicy,
                            MemoryService memoryService,
                            FallbackRouter router,
                            MemoryExtractionService extractionService,
                            ConversationHistoryService historyService,
                            ChatProperties props,
                            LlmProperties llmProperties,
                            Clock clock) {
        this.classifier        = classifier;
        this.cache             = cache;
        this.cachePolicy       = cachePolicy;
        this.memoryService     = memoryService;
        this.router            = router;
        this.extractionService = extractionService;
        this.historyService    = historyService;
        this.props             = props;
        this.sendParams        = SendParams.from(llmProperties);
        this.clock             = clock;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Answers one message.  Resolves to RESPONDED or DEGRADED_RESPONDED;
     * provider and memory failures never escape as exceptions.
     *
     * @throws ChatRequestException for invalid input
     * @throws com.openforge.chatrouter.llm.RequestCancelledException if the
     *         calling thread is interrupted while a provider call is in flight
     */
    public ChatResult handleChatRequest(String ownerId, String conversationId, String message, String chatType) {
        long   start     = System.nanoTime();
        String requestId = UUID.randomUUID().toString();
        String type      = chatType == null || chatType.isBlank() ? DEFAULT_CHAT_TYPE : chatType.trim();
        RequestTrace trace = new RequestTrace(requestId);

        validate(ownerId, conversationId, message);
        String text = message.trim();

        QueryClassification classification = classifier.classify(text);
        trace.to(RequestState.CLASSIFIED);
        QueryType queryType      = classification.type();
        boolean   memoryEligible = props.memoryEnabledFor(type);

        // ── Cache ────────────────────────────────────────────────────────────
        Optional<String> cacheKey = cacheKey(ownerId, conversationId, text, queryType, type, memoryEligible);
        if (cacheKey.isPresent()) {
            Optional<CachedResponse> hit = cache.get(cacheKey.get());
            if (hit.isPresent()) {
                trace.to(RequestState.CACHE_HIT);
                CachedResponse cached = hit.get();
                appendHistory(ownerId, conversationId, type, text, cached.content());
                trace.to(RequestState.RESPONDED);
                log.info("[Chat] {} served from cache (type={} provider={})", requestId, queryType, cached.provider());
                return new ChatResult(cached.content(), cached.provider(), cached.model(), 0,
                        cached.tokensUsed(), elapsedMs(start), true, false, queryType,
                        cached.memoryReferences(), trace.state());
            }
        }
        trace.to(RequestState.CACHE_MISS);

        // ── Memory ───────────────────────────────────────────────────────────
        MemoryContext memory = memoryEligible ? retrieveMemory(requestId, ownerId, text, queryType) : null;
        trace.to(RequestState.MEMORY_RETRIEVED);

        // ── Route ────────────────────────────────────────────────────────────
        List<Message> history = loadHistory(ownerId, conversationId);
        trace.to(RequestState.PROVIDER_ATTEMPT);
        RoutingResult result = router.route(new RoutingRequest(
                requestId,
                classification,
                SystemPrompts.build(type, queryType, clock.instant()),
                memory == null ? null : memory.contextString(),
                history,
                text,
                sendParams));

        List<String> memoryRefs = memory == null ? List.of() : memory.memoryIds();

        if (result.degraded()) {
            trace.to(RequestState.EXHAUSTED);
            trace.to(RequestState.DEGRADED_RESPONDED);
            log.warn("[Chat] {} degraded after {} attempts (type={})", requestId, result.attempts(), queryType);
            return new ChatResult(result.text(), result.providerId(), result.model(), result.tier(),
                    0, elapsedMs(start), false, true, queryType, List.of(), trace.state());
        }

        // ── Side effects ─────────────────────────────────────────────────────
        if (cacheKey.isPresent()) {
            Duration ttl = cachePolicy.ttlFor(queryType);
            cache.set(cacheKey.get(), new CachedResponse(result.text(), result.providerId(), result.model(),
                    result.tokensUsed(), memoryRefs, clock.instant(), ttl), ttl);
        }
        if (memoryEligible) {
            extractionService.submit(ownerId, requestId, text);
        }
        appendHistory(ownerId, conversationId, type, text, result.text());

        trace.to(RequestState.RESPONDED);
        log.info("[Chat] {} answered by {} (tier {}, type={}, memories={}, {} ms)",
                requestId, result.providerId(), result.tier(), queryType, memoryRefs.size(), elapsedMs(start));
        return new ChatResult(result.text(), result.providerId(), result.model(), result.tier(),
                result.tokensUsed(), elapsedMs(start), false, false, queryType, memoryRefs, trace.state());
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void validate(String ownerId, String conversationId, String message) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ChatRequestException("ownerId is required");
        }
        if (conversationId == null || conversationId.isBlank()) {
            throw new ChatRequestException("conversationId is required");
        }
        if (message == null || message.isBlank()) {
            throw new ChatRequestException("message must not be blank");
        }
        if (message.length() > props.maxMessageLength()) {
            throw new ChatRequestException("message exceeds %d characters".formatted(props.maxMessageLength()));
        }
    }

    /**
     * Empty when the cache must not be used: policy skips the type, or the
     * memory fingerprint could not be computed for a personalised chat.
     *
     * Personal answers are always scoped to their owner.  Without memory the
     * only personal context is the conversation history, so the key is
     * scoped to the conversation as well.
     */
    private Optional<String> cacheKey(String ownerId, String conversationId, String text, QueryType queryType,
                                      String chatType, boolean memoryEligible) {
        if (!cachePolicy.applies(queryType)) {
            return Optional.empty();
        }
        String scope = "";
        if (memoryEligible) {
            try {
                scope = ownerId + ":" + memoryService.fingerprint(ownerId);
            } catch (RuntimeException e) {
                log.warn("[Chat] Memory fingerprint unavailable for owner {}, bypassing cache: {}",
                        ownerId, e.getMessage());
                return Optional.empty();
            }
        } else if (queryType == QueryType.PERSONAL) {
            scope = ownerId + ":" + conversationId;
        }
        return Optional.of(CacheKeys.of(text, queryType, chatType, scope));
    }

    private MemoryContext retrieveMemory(String requestId, String ownerId, String text, QueryType queryType) {
        boolean      personal = queryType == QueryType.PERSONAL;
        int          limit    = personal ? props.personalContextLimit() : props.defaultContextLimit();
        ContextLevel level    = personal ? ContextLevel.COMPREHENSIVE : ContextLevel.from(props.defaultContextLevel());
        try {
            MemoryContext ctx = memoryService.retrieveRelevant(ownerId, text, limit, level, queryType);
            log.debug("[Chat] {} memory: {} records, facts={}", requestId, ctx.memories().size(),
                    ctx.personalFacts().keySet());
            return ctx;
        } catch (MemoryService.MemoryRetrievalException e) {
            log.warn("[Chat] {} continuing without memory: {}", requestId, e.getMessage(), e);
            return null;
        }
    }

    private List<Message> loadHistory(String ownerId, String conversationId) {
        try {
            return historyService.load(ownerId, conversationId);
        } catch (ChatRequestException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Chat] Failed to load history for conversation {}, continuing without it: {}",
                    conversationId, e.getMessage(), e);
            return List.of();
        }
    }

    private void appendHistory(String ownerId, String conversationId, String chatType,
                               String userText, String reply) {
        try {
            historyService.append(ownerId, conversationId, chatType, Message.user(userText), Message.assistant(reply));
        } catch (ChatRequestException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Chat] Failed to persist history for conversation {}: {}", conversationId, e.getMessage(), e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    /** Walks the request state machine, logging each transition at debug level. */
    private static final class RequestTrace {

        private final String requestId;
        private RequestState state = RequestState.RECEIVED;

        RequestTrace(String requestId) {
            this.requestId = requestId;
        }

        void to(RequestState next) {
            log.debug("[Chat] {} {} → {}", requestId, state, next);
            state = next;
        }

        RequestState state() {
            return state;
        }
    }
}
