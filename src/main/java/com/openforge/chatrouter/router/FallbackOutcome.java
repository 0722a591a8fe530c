package com.openforge.chatrouter.router;

import com.openforge.chatrouter.llm.FailureKind;

/** What happened to one candidate during a routing pass. */
public enum FallbackOutcome {
    SUCCESS,
    SKIPPED_DISABLED,
    SKIPPED_COOLDOWN,
    SKIPPED_RATE_LIMITED,
    RATE_LIMITED,
    AUTH_ERROR,
    TRANSIENT_ERROR,
    INVALID_RESPONSE,
    CANCELLED;

    public static FallbackOutcome of(FailureKind kind) {
        return switch (kind) {
            case RATE_LIMITED     -> RATE_LIMITED;
            case AUTH_ERROR       -> AUTH_ERROR;
            case TRANSIENT_ERROR  -> TRANSIENT_ERROR;
            case INVALID_RESPONSE -> INVALID_RESPONSE;
        };
    }

    public boolean skipped() {
        return this == SKIPPED_DISABLED || this == SKIPPED_COOLDOWN || this == SKIPPED_RATE_LIMITED;
    }
}
