package com.openforge.chatrouter.ratelimit;

import com.openforge.chatrouter.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-provider quota and health state.
 *
 * Two windows are tracked for every provider:
 *   - a sliding one-minute window (queue of consumption timestamps)
 *   - a calendar-month bucket (UTC), reset when the month rolls over
 *
 * Independently of quota, {@code failureThreshold} consecutive failures put
 * the provider into cooldown, and an auth error disables it until
 * {@link #reload()}.
 *
 * Concurrency: each provider owns its own monitor.  {@link #consume} checks
 * and records under that monitor, so N concurrent callers can never push a
 * window past its limit.  No lock spans more than one provider and none is
 * held during a provider call.
 */
@Slf4j
@Component
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitTracker {

    private static final long MINUTE_MS = 60_000L;

    private final Map<String, ProviderState> states = new ConcurrentHashMap<>();
    private final List<String>               order  = new CopyOnWriteArrayList<>();
    private final RateLimitProperties        props;
    private final Clock                      clock;

    @Autowired
    public RateLimitTracker(LlmProperties llmProperties, RateLimitProperties props, Clock clock) {
        this(props, clock);
        llmProperties.providers().forEach(this::register);
    }

    public RateLimitTracker(RateLimitProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    // ── Registration ─────────────────────────────────────────────────────────

    public void register(LlmProperties.ProviderConfig config) {
        register(config.id(), config.requestsPerMinute(), config.requestsPerMonth(), config.enabled());
    }

    public void register(String providerId, int perMinute, int perMonth, boolean enabled) {
        ProviderState previous = states.put(providerId,
                new ProviderState(providerId, perMinute, perMonth, enabled));
        if (previous == null) {
            order.add(providerId);
        }
        log.debug("[RateLimit] Registered {} (rpm={} rpmonth={} enabled={})",
                providerId, perMinute, perMonth, enabled);
    }

    // ── Quota ────────────────────────────────────────────────────────────────

    /**
     * True when a request to this provider would be admitted right now:
     * enabled, not cooling down, and below the hard limit on both windows.
     * Advisory only; use {@link #consume} to actually take the slot.
     */
    public boolean canConsume(String providerId) {
        ProviderState s = states.get(providerId);
        if (s == null) return false;
        synchronized (s) {
            return s.admits(now());
        }
    }

    /**
     * Atomically checks and records one request.
     *
     * @return true if the slot was granted, false if the provider is not
     *         admitting requests (disabled, cooling down or at its limit)
     */
    public boolean consume(String providerId) {
        ProviderState s = states.get(providerId);
        if (s == null) return false;
        Instant now = now();
        synchronized (s) {
            if (!s.admits(now)) {
                return false;
            }
            QuotaLevel before = s.levelAt(now);
            s.minuteWindow.addLast(now.toEpochMilli());
            s.monthCount++;
            s.totalRequests++;
            if (before == QuotaLevel.OK && s.levelAt(now) == QuotaLevel.WARNING) {
                log.warn("[RateLimit] {} passed {}% of its quota (minute {}/{}, month {}/{})",
                        providerId, Math.round(props.softThreshold() * 100),
                        s.minuteWindow.size(), s.perMinute, s.monthCount, s.perMonth);
            }
            return true;
        }
    }

    /** Clears both usage windows for a provider. */
    public void resetWindow(String providerId) {
        ProviderState s = states.get(providerId);
        if (s == null) return;
        synchronized (s) {
            s.minuteWindow.clear();
            s.monthCount = 0;
        }
        log.info("[RateLimit] Usage window reset for {}", providerId);
    }

    // ── Health ───────────────────────────────────────────────────────────────

    public void recordSuccess(String providerId) {
        ProviderState s = states.get(providerId);
        if (s == null) return;
        synchronized (s) {
            s.consecutiveFailures = 0;
        }
    }

    /**
     * Counts a failed call.  Reaching the failure threshold starts a cooldown
     * and resets the consecutive counter.
     */
    public void recordFailure(String providerId) {
        ProviderState s = states.get(providerId);
        if (s == null) return;
        Instant now = now();
        synchronized (s) {
            s.totalFailures++;
            s.consecutiveFailures++;
            if (s.consecutiveFailures >= props.failureThreshold()) {
                s.cooldownUntil       = now.plus(props.cooldown());
                s.consecutiveFailures = 0;
                log.warn("[RateLimit] {} failed {} times in a row, cooling down until {}",
                        providerId, props.failureThreshold(), s.cooldownUntil);
            }
        }
    }

    /** Puts a provider into cooldown regardless of its failure count. */
    public void forceCooldown(String providerId, Duration duration) {
        ProviderState s = require(providerId);
        synchronized (s) {
            s.cooldownUntil = now().plus(duration);
        }
        log.info("[RateLimit] {} forced into cooldown for {}", providerId, duration);
    }

    /** Disables a provider until {@link #reload()}; used for authentication failures. */
    public void disable(String providerId, String reason) {
        ProviderState s = states.get(providerId);
        if (s == null) return;
        synchronized (s) {
            s.disabledReason = reason;
        }
        log.error("[RateLimit] {} disabled until config reload: {}", providerId, reason);
    }

    /** Re-enables every provider that was disabled at runtime. */
    public void reload() {
        for (ProviderState s : states.values()) {
            synchronized (s) {
                s.disabledReason = null;
            }
        }
        log.info("[RateLimit] Runtime disables cleared for {} providers", states.size());
    }

    /** Clears windows, cooldown, failure counters and runtime disable. */
    public void resetStats(String providerId) {
        ProviderState s = require(providerId);
        synchronized (s) {
            s.minuteWindow.clear();
            s.monthCount          = 0;
            s.consecutiveFailures = 0;
            s.cooldownUntil       = null;
            s.disabledReason      = null;
            s.totalRequests       = 0;
            s.totalFailures       = 0;
        }
        log.info("[RateLimit] Stats reset for {}", providerId);
    }

    // ── Views ────────────────────────────────────────────────────────────────

    public ProviderUsage usage(String providerId) {
        ProviderState s = require(providerId);
        Instant now = now();
        synchronized (s) {
            s.prune(now);
            Instant cooldown = s.cooling(now) ? s.cooldownUntil : null;
            return new ProviderUsage(
                    s.providerId, s.enabled, s.disabledReason,
                    s.minuteWindow.size(), s.perMinute,
                    s.monthCount, s.perMonth,
                    s.levelAt(now), cooldown,
                    s.consecutiveFailures, s.totalRequests, s.totalFailures);
        }
    }

    public boolean isRegistered(String providerId) {
        return states.containsKey(providerId);
    }

    /** Usage of all providers in registration order. */
    public List<ProviderUsage> snapshot() {
        List<ProviderUsage> result = new ArrayList<>(order.size());
        for (String id : order) {
            result.add(usage(id));
        }
        return result;
    }

    /** Human-readable operator hints derived from the current snapshot. */
    public List<String> recommendations() {
        List<String> hints = new ArrayList<>();
        for (ProviderUsage u : snapshot()) {
            switch (u.status()) {
                case DISABLED  -> hints.add("%s is disabled%s".formatted(u.providerId(),
                        u.disabledReason() == null ? " in configuration" : ": " + u.disabledReason()));
                case COOLDOWN  -> hints.add("%s is cooling down until %s".formatted(u.providerId(), u.cooldownUntil()));
                case EXHAUSTED -> hints.add("%s has reached its request limit".formatted(u.providerId()));
                case WARNING   -> hints.add("%s is at %d%% of its quota; traffic is shifted to other providers"
                        .formatted(u.providerId(), Math.round(u.loadFactor() * 100)));
                case HEALTHY   -> { }
            }
        }
        return hints;
    }

    // ── Private ──────────────────────────────────────────────────────────────

    private ProviderState require(String providerId) {
        ProviderState s = states.get(providerId);
        if (s == null) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        return s;
    }

    private Instant now() {
        return clock.instant();
    }

    /** Mutable state of one provider; every access is synchronized on the instance. */
    private final class ProviderState {

        final String  providerId;
        final int     perMinute;
        final int     perMonth;
        final boolean enabled;

        final Deque<Long> minuteWindow = new ArrayDeque<>();
        YearMonth month;
        int       monthCount;
        int       consecutiveFailures;
        Instant   cooldownUntil;
        String    disabledReason;
        long      totalRequests;
        long      totalFailures;

        ProviderState(String providerId, int perMinute, int perMonth, boolean enabled) {
            this.providerId = providerId;
            this.perMinute  = perMinute;
            this.perMonth   = perMonth;
            this.enabled    = enabled;
        }

        boolean admits(Instant now) {
            if (!enabled || disabledReason != null) return false;
            if (cooling(now)) return false;
            prune(now);
            return !full(minuteWindow.size(), perMinute) && !full(monthCount, perMonth);
        }

        boolean cooling(Instant now) {
            if (cooldownUntil == null) return false;
            if (!now.isBefore(cooldownUntil)) {
                cooldownUntil = null;
                return false;
            }
            return true;
        }

        void prune(Instant now) {
            long cutoff = now.toEpochMilli() - MINUTE_MS;
            while (!minuteWindow.isEmpty() && minuteWindow.peekFirst() <= cutoff) {
                minuteWindow.pollFirst();
            }
            YearMonth current = YearMonth.from(now.atZone(ZoneOffset.UTC));
            if (!current.equals(month)) {
                month      = current;
                monthCount = 0;
            }
        }

        QuotaLevel levelAt(Instant now) {
            prune(now);
            if (full(minuteWindow.size(), perMinute) || full(monthCount, perMonth)) {
                return QuotaLevel.EXHAUSTED;
            }
            double load = Math.max(ProviderUsage.ratio(minuteWindow.size(), perMinute),
                                   ProviderUsage.ratio(monthCount, perMonth));
            return load >= props.softThreshold() ? QuotaLevel.WARNING : QuotaLevel.OK;
        }

        private boolean full(int count, int limit) {
            return limit > 0 && count >= limit;
        }
    }
}
