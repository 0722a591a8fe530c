package com.openforge.chatrouter.memory;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Request body for POST /embeddings (OpenAI-compatible).
 *
 * {@code dimensions} is only honoured by text-embedding-3-* models.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        String input,
        String model,
        Integer dimensions
) {}
