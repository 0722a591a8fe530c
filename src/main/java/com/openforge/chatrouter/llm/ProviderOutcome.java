package com.openforge.chatrouter.llm;

/**
 * Result of one provider attempt: exactly one of {@code reply} and
 * {@code failure} is non-null.
 */
public record ProviderOutcome(
        String        providerId,
        ProviderReply reply,
        FailureKind   failure,
        String        detail,
        long          latencyMs
) {

    public static ProviderOutcome success(String providerId, ProviderReply reply) {
        return new ProviderOutcome(providerId, reply, null, null, reply.latencyMs());
    }

    public static ProviderOutcome failure(String providerId, FailureKind kind, String detail, long latencyMs) {
        return new ProviderOutcome(providerId, null, kind, detail, latencyMs);
    }

    public boolean succeeded() {
        return reply != null;
    }
}
