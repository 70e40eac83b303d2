package com.driftguard.core.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link LlmMetricsCalculator}.
 */
class LlmMetricsCalculatorTest {

    private static final String RESPONSE = "The model works well. However, it fails on long inputs.";
    private static final String PROMPT = "Does the model work?";

    private LlmMetricsCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new LlmMetricsCalculator();
    }

    @Test
    @DisplayName("Should compute every quality metric in a fixed order")
    void shouldComputeQuality() {
        Map<String, Double> quality = calculator.responseQuality(RESPONSE, PROMPT);

        assertThat(quality.keySet()).containsExactly("response_length", "word_count", "sentence_count",
                "avg_word_length", "readability_score", "coherence_score", "completeness_score",
                "language_quality", "information_density");
        assertThat(quality.get("response_length")).isEqualTo(55.0);
        assertThat(quality.get("word_count")).isEqualTo(10.0);
        assertThat(quality.get("sentence_count")).isEqualTo(2.0);
        assertThat(quality.get("avg_word_length")).isCloseTo(4.6, within(1e-9));
        assertThat(quality.get("readability_score")).isCloseTo(0.491667, within(1e-6));
        assertThat(quality.get("coherence_score")).isCloseTo(0.075, within(1e-9));
        assertThat(quality.get("completeness_score")).isCloseTo(0.4, within(1e-9));
        assertThat(quality.get("language_quality")).isCloseTo(1.0, within(1e-9));
        assertThat(quality.get("information_density")).isCloseTo(0.8, within(1e-9));
        assertThat(calculator.overallQuality(quality)).isCloseTo(0.491667, within(1e-6));
    }

    @Test
    @DisplayName("Should score a single sentence as fully coherent")
    void shouldTreatSingleSentenceAsCoherent() {
        assertThat(LlmMetricsCalculator.coherence("Just one sentence")).isEqualTo(1.0);
        assertThat(LlmMetricsCalculator.coherence("")).isZero();
    }

    @Test
    @DisplayName("Should reward conclusions and examples in completeness")
    void shouldScoreCompleteness() {
        String response = "For example, caching helps. In conclusion, use it.";

        assertThat(LlmMetricsCalculator.completeness(response, null)).isCloseTo(1.0, within(1e-9));
        assertThat(LlmMetricsCalculator.completeness("", "anything")).isZero();
    }

    @Test
    @DisplayName("Should measure repetition above the normal ten percent")
    void shouldMeasureRepetition() {
        assertThat(LlmMetricsCalculator.repetition("go go go go")).isCloseTo(0.9, within(1e-9));
        assertThat(LlmMetricsCalculator.repetition("single")).isZero();
    }

    @Test
    @DisplayName("Should compute performance metrics and categories")
    void shouldComputePerformance() {
        Map<String, Object> perf = calculator.performance(0.5, 100, 0.95);

        assertThat(perf)
                .containsEntry("response_time", 0.5)
                .containsEntry("tokens_per_second", 200.0)
                .containsEntry("time_per_token", 0.005)
                .containsEntry("token_count", 100)
                .containsEntry("performance_category", "excellent")
                .containsEntry("confidence_score", 0.95)
                .containsEntry("confidence_category", "very_high");
    }

    @Test
    @DisplayName("Should omit confidence fields when confidence is unknown")
    void shouldOmitConfidence() {
        Map<String, Object> perf = calculator.performance(12.0, 10, null);

        assertThat(perf).doesNotContainKeys("confidence_score", "confidence_category");
        assertThat(perf).containsEntry("performance_category", "poor");
    }

    @Test
    @DisplayName("Should bucket performance and confidence categories")
    void shouldCategorize() {
        assertThat(LlmMetricsCalculator.performanceCategory(2.0, 120)).isEqualTo("good");
        assertThat(LlmMetricsCalculator.performanceCategory(5.0, 150)).isEqualTo("acceptable");
        assertThat(LlmMetricsCalculator.confidenceCategory(0.7)).isEqualTo("high");
        assertThat(LlmMetricsCalculator.confidenceCategory(0.5)).isEqualTo("medium");
        assertThat(LlmMetricsCalculator.confidenceCategory(0.3)).isEqualTo("low");
        assertThat(LlmMetricsCalculator.confidenceCategory(0.29)).isEqualTo("very_low");
    }

    @Test
    @DisplayName("Should compare current metrics with the history average")
    void shouldComputeTrends() {
        MetricsHistory history = new MetricsHistory();
        history.add(Map.of("response_time", 1.0, "token_count", 50.0));
        history.add(Map.of("response_time", 3.0));

        Map<String, Object> trends = calculator.trends(Map.of("response_time", 2.4, "token_count", 50.0), history);

        assertThat((Double) trends.get("response_time_trend_pct")).isCloseTo(20.0, within(1e-9));
        assertThat(trends).containsEntry("response_time_trend_direction", "improving")
                .containsEntry("response_time_volatility", 1.0)
                .containsEntry("token_count_trend_pct", 0.0)
                .containsEntry("token_count_trend_direction", "stable")
                .doesNotContainKey("token_count_volatility")
                .doesNotContainKey("confidence_score_trend_pct");
    }

    @Test
    @DisplayName("Should produce no trends without history")
    void shouldSkipTrendsWithoutHistory() {
        assertThat(calculator.trends(Map.of("response_time", 1.0), new MetricsHistory())).isEmpty();
    }
}
