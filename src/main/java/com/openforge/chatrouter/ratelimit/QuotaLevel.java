package com.openforge.chatrouter.ratelimit;

/** Quota pressure on a provider's tightest window. */
public enum QuotaLevel {
    OK,
    /** At or above the soft threshold; still usable but demoted by the router. */
    WARNING,
    /** Hard limit reached; refused until the window rolls over. */
    EXHAUSTED
}
