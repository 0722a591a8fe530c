package com.openforge.chatrouter.llm;

/**
 * Successful provider reply.
 *
 * @param tokensUsed total tokens reported by the provider, or an estimate
 *                   (≈ 4 characters per token) when it reports none
 */
public record ProviderReply(
        String text,
        int    tokensUsed,
        long   latencyMs,
        String model
) {}
