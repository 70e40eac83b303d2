package com.driftguard.core.drift;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Digest-based embedder.
 *
 * <p>
 * The SHA-256 digest of the UTF-8 text supplies 32 components in
 * {@code [0, 1]} (unsigned byte / 255); the rest of the {@link #DIMENSION}
 * components are zero and the vector is L2-normalized. Identical texts map to
 * identical vectors, but similarity between different texts carries no
 * meaning.
 * </p>
 *
 * @since 1.0.0
 */
public class HashingTextEmbedder implements TextEmbedder {

    private static final long serialVersionUID = 1L;

    @Override
    public EmbeddingVector embed(String text) {
        Objects.requireNonNull(text, "text must not be null");
        byte[] digest = sha256(text.getBytes(StandardCharsets.UTF_8));

        int used = Math.min(digest.length, DIMENSION / 8);
        double[] features = new double[used];
        for (int i = 0; i < used; i++) {
            features[i] = (digest[i] & 0xFF) / 255.0;
        }
        return EmbeddingVector.normalized(features, DIMENSION);
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
