package com.driftguard.core.detection;

import com.driftguard.core.model.DetectionResult;
import com.driftguard.core.window.WindowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationDetector}.
 */
class IsolationDetectorTest {

    private IsolationDetector detector;
    private WindowStore windows;

    @BeforeEach
    void setUp() {
        detector = new IsolationDetector();
        windows = new WindowStore();
    }

    @Test
    @DisplayName("Should flag a value far from a spread-out window")
    void shouldFlagIsolatedValue() {
        for (int round = 0; round < 3; round++) {
            for (int i = 1; i <= 5; i++) {
                detector.evaluate(windows, "confidence_score", i);
            }
        }
        for (int i = 1; i <= 4; i++) {
            detector.evaluate(windows, "confidence_score", i);
        }

        DetectionResult result = detector.evaluate(windows, "confidence_score", 100.0);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getScore()).isCloseTo(68.8654, within(1e-3));
        assertThat(result.getDiagnostics()).containsEntry("sample_size", 20);
    }

    @Test
    @DisplayName("Should not flag a value in the middle of the window")
    void shouldNotFlagCentralValue() {
        for (int i = 1; i <= 19; i++) {
            detector.evaluate(windows, "confidence_score", i);
        }

        DetectionResult result = detector.evaluate(windows, "confidence_score", 10.0);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getScore()).isCloseTo(1.8819, within(1e-3));
    }

    @Test
    @DisplayName("Should return normal when every window value equals the new value")
    void shouldHandleConstantWindow() {
        DetectionResult result = null;
        for (int i = 0; i < 25; i++) {
            result = detector.evaluate(windows, "confidence_score", 0.7);
        }
        assertThat(result).isEqualTo(DetectionResult.normal());
    }

    @Test
    @DisplayName("Should stay silent with fewer than twenty values")
    void shouldWarmUp() {
        for (int i = 0; i < 18; i++) {
            detector.evaluate(windows, "confidence_score", i);
        }
        assertThat(detector.evaluate(windows, "confidence_score", 1e6)).isEqualTo(DetectionResult.normal());
    }
}
