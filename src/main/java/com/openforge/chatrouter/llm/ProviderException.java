package com.openforge.chatrouter.llm;

import lombok.Getter;

/**
 * Thrown by a {@link ProviderAdapter} when a call fails.  Never leaves the
 * {@link ProviderAdapterPool}; it is converted into a {@link ProviderOutcome}.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final String      providerId;
    private final FailureKind kind;

    public ProviderException(String providerId, FailureKind kind, String message) {
        super(message);
        this.providerId = providerId;
        this.kind       = kind;
    }

    public ProviderException(String providerId, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.kind       = kind;
    }
}
