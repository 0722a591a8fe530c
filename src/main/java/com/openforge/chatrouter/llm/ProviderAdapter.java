package com.openforge.chatrouter.llm;

/**
 * Uniform contract over one external language-model provider.
 *
 * Implementations are stateless apart from their configuration and must be
 * safe to call from many threads at once.  Any failure is reported as a
 * {@link ProviderException} with a {@link FailureKind}; adapters never
 * retry on their own.
 */
public interface ProviderAdapter {

    String providerId();

    /** Model name sent to the provider. */
    String model();

    ProviderReply send(ProviderPrompt prompt, SendParams params);
}
