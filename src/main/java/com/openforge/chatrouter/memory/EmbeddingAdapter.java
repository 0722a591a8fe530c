package com.openforge.chatrouter.memory;

import java.util.List;

/** Turns text into a vector for similarity comparison. */
public interface EmbeddingAdapter {

    /**
     * @throws EmbeddingClient.EmbeddingException when the text cannot be embedded
     */
    List<Float> embed(String text);

    int dimensions();
}
