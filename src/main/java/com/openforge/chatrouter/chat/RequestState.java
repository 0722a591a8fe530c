package com.openforge.chatrouter.chat;

/**
 * Lifecycle of one chat request.
 *
 *   RECEIVED → CLASSIFIED → CACHE_HIT  → RESPONDED
 *                         → CACHE_MISS → MEMORY_RETRIEVED → PROVIDER_ATTEMPT → RESPONDED
 *                                                                            → EXHAUSTED → DEGRADED_RESPONDED
 *
 * Only {@link #RESPONDED} and {@link #DEGRADED_RESPONDED} are terminal.
 */
public enum RequestState {
    RECEIVED,
    CLASSIFIED,
    CACHE_HIT,
    CACHE_MISS,
    MEMORY_RETRIEVED,
    PROVIDER_ATTEMPT,
    EXHAUSTED,
    RESPONDED,
    DEGRADED_RESPONDED;

    public boolean terminal() {
        return this == RESPONDED || this == DEGRADED_RESPONDED;
    }
}
