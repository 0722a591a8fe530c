package com.openforge.chatrouter.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Local, deterministic bag-of-words embedding (feature hashing).
 *
 * Each content word is hashed to a signed bucket; the vector is then
 * L2-normalised so the dot product is a cosine similarity.  Quality is far
 * below a trained model but it needs no network and gives identical vectors
 * for identical words, which is what exact-fact recall relies on.
 */
public class HashingEmbeddingAdapter implements EmbeddingAdapter {

    static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "is", "am", "are", "was", "were", "be", "to", "of", "in", "on",
            "and", "or", "for", "with", "at", "by", "it", "this", "that", "do", "does", "did",
            "i", "me", "my", "you", "your", "what", "who", "s", "please", "can", "could");

    private final int dimensions;

    public HashingEmbeddingAdapter(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public List<Float> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingClient.EmbeddingException("Cannot embed blank text");
        }
        float[] vector = new float[dimensions];
        for (String token : tokenize(text)) {
            int hash   = token.hashCode();
            int bucket = Math.floorMod(hash, dimensions);
            float sign = (Integer.rotateLeft(hash, 16) & 1) == 0 ? 1f : -1f;
            vector[bucket] += sign;
        }

        double norm = 0;
        for (float v : vector) norm += v * v;
        norm = Math.sqrt(norm);

        List<Float> result = new ArrayList<>(dimensions);
        for (float v : vector) {
            result.add(norm == 0 ? 0f : (float) (v / norm));
        }
        return result;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    /** Lowercase content words with stop words removed. */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!raw.isEmpty() && !STOP_WORDS.contains(raw)) {
                tokens.add(raw);
            }
        }
        return tokens;
    }
}
