package com.driftguard.core.drift;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable real-valued text embedding.
 *
 * <p>
 * Embeddings produced by a {@link TextEmbedder} are L2-normalized (or all
 * zero for empty text), so {@link #dot(EmbeddingVector)} is their cosine
 * similarity. Vectors parsed from reference data are kept exactly as given.
 * </p>
 *
 * @since 1.0.0
 */
public final class EmbeddingVector implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] values;

    private EmbeddingVector(double[] values) {
        this.values = values;
    }

    /**
     * @param values components; copied defensively
     * @return a vector holding exactly the given components
     */
    public static EmbeddingVector of(double... values) {
        Objects.requireNonNull(values, "values must not be null");
        return new EmbeddingVector(values.clone());
    }

    /**
     * Build a vector of fixed dimension from leading features: extra features
     * are truncated, missing ones are zero-padded, and the result is scaled to
     * unit length unless it is all zero.
     *
     * @param features  raw features
     * @param dimension target dimension
     * @return the normalized vector
     */
    public static EmbeddingVector normalized(double[] features, int dimension) {
        double[] vec = Arrays.copyOf(features, dimension);
        double norm = 0;
        for (double v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= norm;
            }
        }
        return new EmbeddingVector(vec);
    }

    public int dimension() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    /**
     * @param other vector of the same dimension
     * @return the dot product
     * @throws IllegalArgumentException if the dimensions differ
     */
    public double dot(EmbeddingVector other) {
        requireSameDimension(other);
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * other.values[i];
        }
        return sum;
    }

    /**
     * @param other vector of the same dimension
     * @return the L2 (euclidean) distance
     */
    public double euclideanDistance(EmbeddingVector other) {
        requireSameDimension(other);
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            double diff = values[i] - other.values[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * @param other vector of the same dimension
     * @return the L1 (manhattan) distance
     */
    public double manhattanDistance(EmbeddingVector other) {
        requireSameDimension(other);
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += Math.abs(values[i] - other.values[i]);
        }
        return sum;
    }

    public double norm() {
        return Math.sqrt(dot(this));
    }

    private void requireSameDimension(EmbeddingVector other) {
        Objects.requireNonNull(other, "other vector must not be null");
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("Embedding dimension mismatch: "
                    + values.length + " vs " + other.values.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EmbeddingVector that))
            return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector{dimension=" + values.length + '}';
    }
}
