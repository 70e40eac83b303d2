package com.driftguard.core.drift;

import java.util.Locale;

/**
 * Similarity measures between two embeddings.
 *
 * @since 1.0.0
 */
public enum SimilarityMethod {

    /** Dot product; cosine similarity for normalized vectors. */
    COSINE {
        @Override
        public double similarity(EmbeddingVector a, EmbeddingVector b) {
            return a.dot(b);
        }
    },

    /** {@code 1 / (1 + L2 distance)}. */
    EUCLIDEAN {
        @Override
        public double similarity(EmbeddingVector a, EmbeddingVector b) {
            return 1.0 / (1.0 + a.euclideanDistance(b));
        }
    },

    /** {@code 1 / (1 + L1 distance)}. */
    MANHATTAN {
        @Override
        public double similarity(EmbeddingVector a, EmbeddingVector b) {
            return 1.0 / (1.0 + a.manhattanDistance(b));
        }
    };

    public abstract double similarity(EmbeddingVector a, EmbeddingVector b);

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param name method name; unknown or {@code null} names resolve to
     *             {@link #COSINE}
     * @return the method
     */
    public static SimilarityMethod fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (SimilarityMethod method : values()) {
                if (method.getId().equals(normalized)) {
                    return method;
                }
            }
        }
        return COSINE;
    }
}
