package com.driftguard.core.detection;

import com.driftguard.core.model.DetectionResult;
import com.driftguard.core.window.WindowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TrendDetector}.
 */
class TrendDetectorTest {

    private TrendDetector detector;
    private WindowStore windows;

    @BeforeEach
    void setUp() {
        detector = new TrendDetector();
        windows = new WindowStore();
    }

    @Test
    @DisplayName("Should never flag a perfectly linear series")
    void shouldAcceptPerfectFit() {
        DetectionResult result = null;
        for (int i = 0; i < 10; i++) {
            result = detector.evaluate(windows, "response_time", i);
        }

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getDiagnostics().get("slope")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should flag a value that breaks the fitted trend")
    void shouldFlagBreak() {
        for (int i = 0; i < 9; i++) {
            detector.evaluate(windows, "response_time", i);
        }

        DetectionResult result = detector.evaluate(windows, "response_time", 10.0);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getScore()).isCloseTo(2.4271, within(1e-3));
        assertThat((Double) result.getDiagnostics().get("predicted_value")).isCloseTo(9.3455, within(1e-3));
    }

    @Test
    @DisplayName("Should fit only the last lookback values")
    void shouldUseLookbackOnly() {
        TrendDetector shortLookback = new TrendDetector(3);
        for (int i = 0; i < 50; i++) {
            shortLookback.evaluate(windows, "x", i % 7 == 0 ? 500.0 : 1.0);
        }
        DetectionResult result = shortLookback.evaluate(windows, "x", 1.0);

        assertThat(result.getDiagnostics()).containsKey("slope");
        assertThat(windows.size("x_trend")).isEqualTo(51);
    }

    @Test
    @DisplayName("Should stay silent before the lookback is filled")
    void shouldWarmUp() {
        for (int i = 0; i < 9; i++) {
            assertThat(detector.evaluate(windows, "response_time", i * i)).isEqualTo(DetectionResult.normal());
        }
    }
}
