package com.driftguard.core.detection;

import com.driftguard.core.model.DetectionResult;
import com.driftguard.core.window.WindowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreDetector}.
 */
class ZScoreDetectorTest {

    private ZScoreDetector detector;
    private WindowStore windows;

    @BeforeEach
    void setUp() {
        detector = new ZScoreDetector(2.0);
        windows = new WindowStore(100);
    }

    @Test
    @DisplayName("Should stay silent until ten values are seen")
    void shouldWarmUp() {
        for (int i = 0; i < 9; i++) {
            DetectionResult result = detector.evaluate(windows, "response_time", i * 100.0);
            assertThat(result).isEqualTo(DetectionResult.normal());
        }
    }

    @Test
    @DisplayName("Should never flag a constant window")
    void shouldIgnoreConstantWindow() {
        DetectionResult result = null;
        for (int i = 0; i < 20; i++) {
            result = detector.evaluate(windows, "response_time", 1.5);
        }

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getScore()).isZero();
    }

    @Test
    @DisplayName("Should flag a value more than two standard deviations away")
    void shouldFlagOutlier() {
        for (int i = 0; i < 9; i++) {
            detector.evaluate(windows, "response_time", 10.0);
        }

        DetectionResult result = detector.evaluate(windows, "response_time", 20.0);

        // mean 11, sample stdev sqrt(10)
        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getScore()).isCloseTo(9.0 / Math.sqrt(10), within(1e-9));
        assertThat(result.getDiagnostics())
                .containsEntry("mean", 11.0)
                .containsEntry("sample_size", 10);
    }

    @Test
    @DisplayName("Should not flag a value at the mean")
    void shouldNotFlagTypicalValue() {
        double[] history = {10, 11, 9, 10, 12, 8, 10, 11, 9};
        for (double v : history) {
            detector.evaluate(windows, "response_time", v);
        }

        DetectionResult result = detector.evaluate(windows, "response_time", 10.0);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getScore()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("Should keep its own window per field")
    void shouldUseFieldScopedWindow() {
        detector.evaluate(windows, "token_count", 5.0);

        assertThat(windows.values("token_count_zscore")).containsExactly(5.0);
        assertThat(windows.values("response_time_zscore")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectThreshold() {
        assertThatThrownBy(() -> new ZScoreDetector(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
