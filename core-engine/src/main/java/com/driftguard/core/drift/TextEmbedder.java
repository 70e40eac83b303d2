package com.driftguard.core.drift;

import java.io.Serializable;

/**
 * Turns text into a fixed-dimension embedding.
 *
 * <p>
 * Implementations must be deterministic: identical text always yields the
 * same vector, hence similarity {@code 1.0}. Returned vectors are
 * L2-normalized, except for text without features, which yields the zero
 * vector.
 * </p>
 */
public interface TextEmbedder extends Serializable {

    /** Embedding dimension used throughout the engine. */
    int DIMENSION = 384;

    /**
     * @param text the text; must not be {@code null}
     * @return the embedding
     */
    EmbeddingVector embed(String text);
}
