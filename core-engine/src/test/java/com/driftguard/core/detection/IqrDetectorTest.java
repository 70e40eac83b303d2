package com.driftguard.core.detection;

import com.driftguard.core.model.DetectionResult;
import com.driftguard.core.window.WindowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IqrDetector}.
 */
class IqrDetectorTest {

    private IqrDetector detector;
    private WindowStore windows;

    @BeforeEach
    void setUp() {
        detector = new IqrDetector();
        windows = new WindowStore();
    }

    @Test
    @DisplayName("Should score the distance past the upper fence in IQR units")
    void shouldFlagValueAboveUpperFence() {
        for (int i = 1; i <= 9; i++) {
            detector.evaluate(windows, "token_count", i);
        }

        DetectionResult result = detector.evaluate(windows, "token_count", 20.0);

        // sorted [1..9, 20]: q1 = 3, q3 = 8, upper fence 15.5
        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getScore()).isCloseTo(0.9, within(1e-9));
        assertThat(result.getDiagnostics())
                .containsEntry("q1", 3.0)
                .containsEntry("q3", 8.0)
                .containsEntry("upper_bound", 15.5);
    }

    @Test
    @DisplayName("Should not flag a value inside the fences")
    void shouldAcceptValueInsideFences() {
        for (int i = 1; i <= 9; i++) {
            detector.evaluate(windows, "token_count", i);
        }

        DetectionResult result = detector.evaluate(windows, "token_count", 5.0);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getScore()).isZero();
    }

    @Test
    @DisplayName("Should stay silent with fewer than ten values")
    void shouldWarmUp() {
        for (int i = 0; i < 8; i++) {
            detector.evaluate(windows, "token_count", 1.0);
        }
        assertThat(detector.evaluate(windows, "token_count", 1000.0).isAnomaly()).isFalse();
    }
}
