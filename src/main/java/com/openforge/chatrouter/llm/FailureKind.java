package com.openforge.chatrouter.llm;

/** Categorised reason a provider call did not produce a usable reply. */
public enum FailureKind {
    /** HTTP 429 or equivalent quota refusal. */
    RATE_LIMITED,
    /** Rejected credentials (401/403); the provider stays disabled until reload. */
    AUTH_ERROR,
    /** Network error, timeout, 408 or 5xx; may succeed on a later request. */
    TRANSIENT_ERROR,
    /** Reply could not be parsed or contained no text. */
    INVALID_RESPONSE
}
