package com.openforge.chatrouter.memory;

import java.util.List;

/**
 * Response from POST /embeddings.
 */
public record EmbeddingResponse(
        List<EmbeddingData> data,
        String model
) {

    public List<Float> firstEmbedding() {
        if (data == null || data.isEmpty() || data.get(0).embedding() == null) {
            return null;
        }
        return data.get(0).embedding();
    }

    public record EmbeddingData(int index, List<Float> embedding) {}
}
