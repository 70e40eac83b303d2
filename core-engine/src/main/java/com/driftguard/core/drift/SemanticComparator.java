package com.driftguard.core.drift;

import java.io.Serializable;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Compares two texts of the same record (typically prompt and response) by
 * embedding similarity.
 *
 * <p>
 * The similarity uses the requested {@link SimilarityMethod}. The shift
 * analysis always uses cosine similarity and adds word overlap (Jaccard index
 * of lower-cased whitespace tokens) and the length ratio
 * {@code len(second) / max(len(first), 1)}.
 * </p>
 *
 * @since 1.0.0
 */
public class SemanticComparator implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TextEmbedder embedder;

    public SemanticComparator(TextEmbedder embedder) {
        this.embedder = Objects.requireNonNull(embedder, "TextEmbedder must not be null");
    }

    /**
     * @param first  first text; must not be {@code null}
     * @param second second text; must not be {@code null}
     * @param method similarity method for the headline score
     * @return the comparison
     */
    public SemanticComparison compare(String first, String second, SimilarityMethod method) {
        Objects.requireNonNull(first, "first text must not be null");
        Objects.requireNonNull(second, "second text must not be null");
        Objects.requireNonNull(method, "method must not be null");

        EmbeddingVector a = embedder.embed(first);
        EmbeddingVector b = embedder.embed(second);

        double similarity = method.similarity(a, b);
        double cosine = SimilarityMethod.COSINE.similarity(a, b);
        double lengthRatio = FeatureTextEmbedder.length(second)
                / (double) Math.max(FeatureTextEmbedder.length(first), 1);

        return new SemanticComparison(similarity, cosine, wordOverlap(first, second), lengthRatio);
    }

    static double wordOverlap(String first, String second) {
        Set<String> words1 = tokens(first);
        Set<String> words2 = tokens(second);
        if (words1.isEmpty() && words2.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);
        Set<String> intersection = new HashSet<>(words1);
        intersection.retainAll(words2);
        return union.isEmpty() ? 0.0 : intersection.size() / (double) union.size();
    }

    private static Set<String> tokens(String text) {
        return new HashSet<>(FeatureTextEmbedder.words(text.toLowerCase(Locale.ROOT)));
    }
}
