package com.openforge.chatrouter.router;

import com.openforge.chatrouter.llm.PooledProvider;
import com.openforge.chatrouter.llm.ProviderAdapterPool;
import com.openforge.chatrouter.llm.ProviderOutcome;
import com.openforge.chatrouter.llm.ProviderPrompt;
import com.openforge.chatrouter.llm.ProviderReply;
import com.openforge.chatrouter.llm.RequestCancelledException;
import com.openforge.chatrouter.ratelimit.ProviderUsage;
import com.openforge.chatrouter.ratelimit.RateLimitTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-tier request router with automatic fallback.
 *
 * Call graph:
 *
 *   route(request)
 *     └─ CandidateSelector.order(tiers, queryType, usage)
 *     └─ for each candidate (at most once):
 *           disabled / cooling down / consume() refused  → skip event, next
 *           pool.invoke(candidate)                        → success: return
 *                                                         → failure: event, next
 *     └─ degraded response
 *
 * The loop visits each configured provider at most once, so a request makes
 * no more attempts than there are providers.  Failures of one request never
 * touch another request's loop; the only shared state is the tracker, which
 * locks per provider.
 */
@Slf4j
@Component
@EnableConfigurationProperties(RouterProperties.class)
public class FallbackRouter {

    private final ProviderAdapterPool pool;
    private final RateLimitTracker    tracker;
    private final FallbackEventLog    eventLog;
    private final RouterProperties    props;
    private final Clock               clock;

    public FallbackRouter(ProviderAdapterPool pool,
                          RateLimitTracker tracker,
                          FallbackEventLog eventLog,
                          RouterProperties props,
                          Clock clock) {
        this.pool     = pool;
        this.tracker  = tracker;
        this.eventLog = eventLog;
        this.props    = props;
        this.clock    = clock;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Routes one request through the candidate list.  Never throws for
     * provider failures; exhaustion yields {@link RoutingResult#degraded}.
     *
     * @throws RequestCancelledException if the calling thread is interrupted
     *         while a provider call is in flight
     */
    public RoutingResult route(RoutingRequest request) {
        long           start      = System.nanoTime();
        ProviderPrompt prompt     = request.toPrompt();
        var            queryType  = request.classification().type();
        List<PooledProvider> candidates = CandidateSelector.order(
                pool.tiers(), queryType, props.preferences(), this::usageOrNull);
        List<FallbackEvent> events = new ArrayList<>(candidates.size());

        for (PooledProvider candidate : candidates) {
            FallbackOutcome skip = skipReason(candidate.id());
            if (skip != null) {
                record(events, request, candidate, skip, 0L, null);
                continue;
            }

            ProviderOutcome outcome;
            try {
                outcome = pool.invoke(candidate, prompt, request.params());
            } catch (RequestCancelledException e) {
                record(events, request, candidate, FallbackOutcome.CANCELLED, elapsedMs(start), e.getMessage());
                throw e;
            }

            if (outcome.succeeded()) {
                tracker.recordSuccess(candidate.id());
                ProviderReply reply = outcome.reply();
                record(events, request, candidate, FallbackOutcome.SUCCESS, reply.latencyMs(), null);
                if (events.size() > 1) {
                    log.info("[Router] Request {} served by fallback {} (tier {}) after {} skipped/failed",
                            request.requestId(), candidate.id(), candidate.tier(), events.size() - 1);
                }
                return new RoutingResult(reply.text(), candidate.id(), reply.model(), candidate.tier(),
                        elapsedMs(start), reply.tokensUsed(), false, events);
            }

            switch (outcome.failure()) {
                case AUTH_ERROR -> tracker.disable(candidate.id(), outcome.detail());
                case RATE_LIMITED, TRANSIENT_ERROR, INVALID_RESPONSE -> tracker.recordFailure(candidate.id());
            }
            record(events, request, candidate, FallbackOutcome.of(outcome.failure()),
                    outcome.latencyMs(), outcome.detail());
        }

        log.error("[Router] ALL_PROVIDERS_EXHAUSTED request={} attempts={} outcomes={}",
                request.requestId(), events.size(),
                events.stream().map(e -> e.providerId() + ":" + e.outcome()).toList());
        return RoutingResult.degraded(props.degradedMessage(), elapsedMs(start), events);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private FallbackOutcome skipReason(String providerId) {
        ProviderUsage usage = usageOrNull(providerId);
        if (usage == null || usage.disabled()) return FallbackOutcome.SKIPPED_DISABLED;
        if (usage.inCooldown())               return FallbackOutcome.SKIPPED_COOLDOWN;
        if (!tracker.consume(providerId))     return FallbackOutcome.SKIPPED_RATE_LIMITED;
        return null;
    }

    private ProviderUsage usageOrNull(String providerId) {
        return tracker.isRegistered(providerId) ? tracker.usage(providerId) : null;
    }

    private void record(List<FallbackEvent> events, RoutingRequest request, PooledProvider candidate,
                        FallbackOutcome outcome, long latencyMs, String detail) {
        FallbackEvent event = new FallbackEvent(request.requestId(), candidate.id(), candidate.tier(),
                outcome, latencyMs, clock.instant(), detail);
        events.add(event);
        eventLog.record(event);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
