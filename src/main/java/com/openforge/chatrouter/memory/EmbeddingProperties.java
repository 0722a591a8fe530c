package com.openforge.chatrouter.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * chat-router:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     timeout-seconds: 30
 *
 * When {@code base-url} is blank the local {@link HashingEmbeddingAdapter} is
 * used instead and {@code dimensions} sizes its vectors.
 */
@ConfigurationProperties(prefix = "chat-router.embedding")
public record EmbeddingProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("1536") int dimensions,
        @DefaultValue("30")   int timeoutSeconds
) {

    public boolean remote() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
