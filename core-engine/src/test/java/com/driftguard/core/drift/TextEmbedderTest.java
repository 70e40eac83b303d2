package com.driftguard.core.drift;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the {@link TextEmbedder} implementations.
 */
class TextEmbedderTest {

    @ParameterizedTest
    @EnumSource(EmbedderType.class)
    @DisplayName("Should produce deterministic unit vectors of the fixed dimension")
    void shouldProduceUnitVectors(EmbedderType type) {
        TextEmbedder embedder = type.create();

        EmbeddingVector first = embedder.embed("The model returned a great answer.");
        EmbeddingVector second = embedder.embed("The model returned a great answer.");

        assertThat(first.dimension()).isEqualTo(TextEmbedder.DIMENSION);
        assertThat(first.norm()).isCloseTo(1.0, within(1e-9));
        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should ignore case and extra whitespace in feature embeddings")
    void shouldNormalizeText() {
        TextEmbedder embedder = new FeatureTextEmbedder();

        assertThat(embedder.embed("Hello   World")).isEqualTo(embedder.embed("hello world"));
    }

    @Test
    @DisplayName("Should embed empty text without failing")
    void shouldEmbedEmptyText() {
        EmbeddingVector vector = new FeatureTextEmbedder().embed("");

        assertThat(vector.dimension()).isEqualTo(TextEmbedder.DIMENSION);
    }

    @Test
    @DisplayName("Should give different hash embeddings for different text")
    void shouldHashDistinctTexts() {
        TextEmbedder embedder = new HashingTextEmbedder();

        assertThat(embedder.embed("alpha")).isNotEqualTo(embedder.embed("beta"));
    }

    @Test
    @DisplayName("Should resolve embedder names and reject unknown ones")
    void shouldResolveEmbedderNames() {
        assertThat(EmbedderType.fromName(" HASH ")).isEqualTo(EmbedderType.HASH);
        assertThatThrownBy(() -> EmbedderType.fromName("bert"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown embedder");
    }

    @Test
    @DisplayName("Should reject vectors of different dimension")
    void shouldRejectDimensionMismatch() {
        assertThatThrownBy(() -> EmbeddingVector.of(1, 0).dot(EmbeddingVector.of(1, 0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
