package com.openforge.chatrouter.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Externalised provider tier configuration.
 *
 * Reads from application.yml under the "chat-router.llm" prefix:
 *
 * chat-router:
 *   llm:
 *     temperature: 0.7
 *     max-tokens: 1024
 *     providers:
 *       - id: groq
 *         type: openai
 *         tier: 1
 *         base-url: https://api.groq.com/openai/v1
 *         api-key: ${GROQ_API_KEY:}
 *         model: llama-3.3-70b-versatile
 *         requests-per-minute: 30
 *         requests-per-month: 400000
 *       - id: gemini
 *         type: gemini
 *         tier: 2
 *         ...
 *
 * A limit of 0 means "no local limit" (the provider still enforces its own).
 */
@ConfigurationProperties(prefix = "chat-router.llm")
public record LlmProperties(
        List<ProviderConfig> providers,
        @DefaultValue("0.7")  double temperature,
        @DefaultValue("1024") int    maxTokens
) {

    public LlmProperties {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public record ProviderConfig(
            String id,
            @DefaultValue("openai") ProviderType type,
            @DefaultValue("1")      int     tier,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("30")     int     requestsPerMinute,
            @DefaultValue("0")      int     requestsPerMonth,
            @DefaultValue("true")   boolean enabled,
            @DefaultValue("30")     int     timeoutSeconds
    ) {}
}
