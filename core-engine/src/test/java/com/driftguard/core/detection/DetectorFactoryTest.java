package com.driftguard.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory} and {@link DetectorKind}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create a z-score detector carrying the threshold")
    void shouldCreateZScoreDetector() {
        AnomalyDetector detector = DetectorFactory.create(DetectorKind.ZSCORE, 3.0);

        assertThat(detector).isInstanceOf(ZScoreDetector.class);
        assertThat(((ZScoreDetector) detector).getThreshold()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should use the threshold as IQR multiplier")
    void shouldCreateIqrDetector() {
        AnomalyDetector detector = DetectorFactory.create(DetectorKind.IQR, 2.5);

        assertThat(((IqrDetector) detector).getMultiplier()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should create every detector for 'all' in declaration order")
    void shouldCreateAll() {
        List<AnomalyDetector> detectors = DetectorFactory.createAll(DetectorKind.parseSelection("ALL"), 2.0);

        assertThat(detectors).extracting(AnomalyDetector::getKind)
                .containsExactly(DetectorKind.ZSCORE, DetectorKind.IQR, DetectorKind.ISOLATION, DetectorKind.TREND);
    }

    @Test
    @DisplayName("Should parse a single method case-insensitively")
    void shouldParseSingleMethod() {
        assertThat(DetectorKind.parseSelection(" Trend ")).isEqualTo(Set.of(DetectorKind.TREND));
    }

    @Test
    @DisplayName("Should reject an unknown method")
    void shouldRejectUnknownMethod() {
        assertThatThrownBy(() -> DetectorKind.parseSelection("forest"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown detection method");
    }

    @Test
    @DisplayName("Should compose anomaly identifiers from field and method")
    void shouldComposeAnomalyId() {
        assertThat(DetectorKind.ISOLATION.anomalyId("token_count")).isEqualTo("token_count_isolation");
    }
}
