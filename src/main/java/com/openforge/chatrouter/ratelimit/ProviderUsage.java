package com.openforge.chatrouter.ratelimit;

import java.time.Instant;

/**
 * Point-in-time view of one provider's quota and health state.
 * A limit of 0 means "unlimited".
 */
public record ProviderUsage(
        String  providerId,
        boolean enabled,
        String  disabledReason,
        int     minuteCount,
        int     minuteLimit,
        int     monthCount,
        int     monthLimit,
        QuotaLevel level,
        Instant cooldownUntil,
        int     consecutiveFailures,
        long    totalRequests,
        long    totalFailures
) {

    public enum Status { HEALTHY, WARNING, EXHAUSTED, COOLDOWN, DISABLED }

    public boolean disabled() {
        return !enabled || disabledReason != null;
    }

    public boolean inCooldown() {
        return cooldownUntil != null;
    }

    /** Highest usage ratio across both windows, 0.0 when unlimited. */
    public double loadFactor() {
        return Math.max(ratio(minuteCount, minuteLimit), ratio(monthCount, monthLimit));
    }

    public Status status() {
        if (disabled())                        return Status.DISABLED;
        if (inCooldown())                      return Status.COOLDOWN;
        if (level == QuotaLevel.EXHAUSTED)     return Status.EXHAUSTED;
        if (level == QuotaLevel.WARNING)       return Status.WARNING;
        return Status.HEALTHY;
    }

    static double ratio(int count, int limit) {
        return limit <= 0 ? 0.0 : (double) count / limit;
    }
}
