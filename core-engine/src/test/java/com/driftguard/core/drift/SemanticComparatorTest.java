package com.driftguard.core.drift;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SemanticComparator}.
 */
class SemanticComparatorTest {

    private SemanticComparator comparator;

    @BeforeEach
    void setUp() {
        comparator = new SemanticComparator(new FeatureTextEmbedder());
    }

    @Test
    @DisplayName("Should rate identical texts as fully similar")
    void shouldCompareIdenticalTexts() {
        SemanticComparison result = comparator.compare("What is a model?", "What is a model?", SimilarityMethod.COSINE);

        assertThat(result.getSimilarity()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getSemanticDistance()).isCloseTo(0.0, within(1e-9));
        assertThat(result.getWordOverlap()).isEqualTo(1.0);
        assertThat(result.getLengthRatio()).isEqualTo(1.0);
        assertThat(result.getShiftDirection()).isEqualTo("stable");
        assertThat(result.getSimilarityCategory()).isEqualTo("very_high");
    }

    @Test
    @DisplayName("Should map distances into (0, 1] for distance methods")
    void shouldBoundDistanceSimilarity() {
        SemanticComparison same = comparator.compare("abc", "abc", SimilarityMethod.EUCLIDEAN);
        SemanticComparison different = comparator.compare("abc", "zzz yyy xxx", SimilarityMethod.MANHATTAN);

        assertThat(same.getSimilarity()).isCloseTo(1.0, within(1e-9));
        assertThat(different.getSimilarity()).isGreaterThan(0.0).isLessThan(1.0);
    }

    @Test
    @DisplayName("Should report expansion when the second text is much longer")
    void shouldDetectExpansion() {
        SemanticComparison result = comparator.compare("Hi", "Hello there, how can I help you today?",
                SimilarityMethod.COSINE);

        assertThat(result.getLengthRatio()).isEqualTo(19.0);
        assertThat(result.getShiftDirection()).isEqualTo("expansion");
    }

    @Test
    @DisplayName("Should compute Jaccard word overlap case-insensitively")
    void shouldComputeWordOverlap() {
        assertThat(SemanticComparator.wordOverlap("The cat sat", "the dog sat")).isEqualTo(0.5);
        assertThat(SemanticComparator.wordOverlap("", "")).isEqualTo(1.0);
        assertThat(SemanticComparator.wordOverlap("a", "")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should fall back to cosine for unknown method names")
    void shouldResolveMethodNames() {
        assertThat(SimilarityMethod.fromName("Manhattan")).isEqualTo(SimilarityMethod.MANHATTAN);
        assertThat(SimilarityMethod.fromName("jaccard")).isEqualTo(SimilarityMethod.COSINE);
        assertThat(SimilarityMethod.fromName(null)).isEqualTo(SimilarityMethod.COSINE);
    }

    @Test
    @DisplayName("Should bucket similarity categories")
    void shouldCategorizeSimilarity() {
        Map<Double, String> expected = Map.of(0.95, "very_high", 0.7, "high", 0.5, "medium", 0.3, "low", 0.1, "very_low");
        expected.forEach((similarity, category) ->
                assertThat(new SemanticComparison(similarity, similarity, 0, 1).getSimilarityCategory())
                        .isEqualTo(category));
    }
}
