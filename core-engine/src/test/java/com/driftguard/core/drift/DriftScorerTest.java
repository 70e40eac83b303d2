package com.driftguard.core.drift;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DriftScorer}.
 */
class DriftScorerTest {

    private static final EmbeddingVector X = EmbeddingVector.of(1, 0);
    private static final EmbeddingVector Y = EmbeddingVector.of(0, 1);
    private static final EmbeddingVector DIAGONAL = EmbeddingVector.of(Math.sqrt(0.5), Math.sqrt(0.5));

    private static final Map<String, EmbeddingVector> VECTORS = Map.of("x", X, "y", Y, "d", DIAGONAL);

    private DriftScorer scorer;
    private RecentSampleWindow recent;

    @BeforeEach
    void setUp() {
        TextEmbedder lookup = VECTORS::get;
        scorer = new DriftScorer(lookup, 0.8);
        recent = new RecentSampleWindow(5);
    }

    @Test
    @DisplayName("Should report no drift for text matching a baseline")
    void shouldNotDriftOnBaselineText() {
        DriftResult result = scorer.score("x", List.of(Y, X), recent);

        assertThat(result.getDriftScore()).isCloseTo(0.0, within(1e-12));
        assertThat(result.isDriftDetected()).isFalse();
        assertThat(result.getBaselineSimilarity()).isCloseTo(1.0, within(1e-12));
        assertThat(result.getSeverity()).isEqualTo(DriftSeverity.MINIMAL);
    }

    @ParameterizedTest
    @EnumSource(EmbedderType.class)
    @DisplayName("Should never flag embedded text against itself, even at threshold 1.0")
    void shouldNotDriftAgainstOwnEmbedding(EmbedderType type) {
        TextEmbedder embedder = type.create();
        DriftScorer strict = new DriftScorer(embedder, 1.0);
        List<String> texts = List.of(
                "The quick brown fox jumps over the lazy dog.",
                "a",
                "Hello, world! 123",
                "The model returned a great answer.",
                "   mixed CASE   text, with punctuation?!");

        for (String text : texts) {
            DriftResult result = strict.score(text, List.of(embedder.embed(text)), new RecentSampleWindow());

            assertThat(result.isDriftDetected()).as("drift for '%s'", text).isFalse();
            assertThat(result.getDriftScore()).as("score for '%s'", text)
                    .isGreaterThanOrEqualTo(0.0)
                    .isCloseTo(0.0, within(1e-9));
            assertThat(result.getBaselineSimilarity()).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Should detect drift from dissimilar baselines")
    void shouldDetectDrift() {
        DriftResult result = scorer.score("y", List.of(X), recent);

        assertThat(result.getDriftScore()).isCloseTo(1.0, within(1e-12));
        assertThat(result.isDriftDetected()).isTrue();
        assertThat(result.getSeverity()).isEqualTo(DriftSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should score zero drift without baselines")
    void shouldScoreZeroWithoutBaselines() {
        DriftResult result = scorer.score("y", List.of(), recent);

        assertThat(result.getDriftScore()).isZero();
        assertThat(result.isDriftDetected()).isFalse();
    }

    @Test
    @DisplayName("Should average similarity against recent samples and then append")
    void shouldTrackRecentSimilarity() {
        DriftResult first = scorer.score("x", List.of(), recent);
        DriftResult second = scorer.score("y", List.of(), recent);
        DriftResult third = scorer.score("d", List.of(), recent);

        assertThat(first.getRecentSimilarity()).isEqualTo(1.0);
        assertThat(second.getRecentSimilarity()).isCloseTo(0.0, within(1e-12));
        assertThat(third.getRecentSimilarity()).isCloseTo(Math.sqrt(0.5), within(1e-12));
        assertThat(recent.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should flag drift only when the score exceeds one minus the threshold")
    void shouldUseStrictThreshold() {
        // similarity sqrt(0.5) ~ 0.707, drift ~ 0.293
        assertThat(new DriftScorer(VECTORS::get, 0.7).score("d", List.of(X), recent).isDriftDetected()).isFalse();
        assertThat(new DriftScorer(VECTORS::get, 0.75).score("d", List.of(X), recent).isDriftDetected()).isTrue();
    }

    @Test
    @DisplayName("Should reject a threshold outside [0, 1]")
    void shouldRejectThreshold() {
        assertThatThrownBy(() -> new DriftScorer(VECTORS::get, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should classify drift severity by score")
    void shouldClassifySeverity() {
        assertThat(DriftSeverity.classify(0.05)).isEqualTo(DriftSeverity.MINIMAL);
        assertThat(DriftSeverity.classify(0.1)).isEqualTo(DriftSeverity.LOW);
        assertThat(DriftSeverity.classify(0.3)).isEqualTo(DriftSeverity.MEDIUM);
        assertThat(DriftSeverity.classify(0.5)).isEqualTo(DriftSeverity.HIGH);
        assertThat(DriftSeverity.classify(0.7)).isEqualTo(DriftSeverity.CRITICAL);
        assertThat(DriftSeverity.HIGH.label()).isEqualTo("high");
    }
}
