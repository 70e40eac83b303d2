package com.driftguard.flink;

import com.driftguard.core.model.TelemetryRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the keying and error helpers of {@link DriftGuardJob} and
 * {@link AnnotationProcessFunction}.
 */
class DriftGuardJobTest {

    @Test
    @DisplayName("Should key records by the configured field")
    void shouldKeyByField() {
        TelemetryRecord record = new TelemetryRecord(Map.of("model_id", "gpt-4", "tenant", 7));

        assertThat(DriftGuardJob.streamKey(record, "model_id")).isEqualTo("gpt-4");
        assertThat(DriftGuardJob.streamKey(record, "tenant")).isEqualTo("7");
    }

    @Test
    @DisplayName("Should fall back to the default stream key")
    void shouldFallBackToDefaultKey() {
        assertThat(DriftGuardJob.streamKey(new TelemetryRecord(), "model_id")).isEqualTo("default");
    }

    @Test
    @DisplayName("Should recognise error annotations")
    void shouldDetectErrorFields() {
        TelemetryRecord clean = new TelemetryRecord(Map.of("drift_score", 0.1));
        TelemetryRecord failed = new TelemetryRecord(Map.of("baseline_comparison_error", "No baseline"));
        TelemetryRecord partial = new TelemetryRecord(Map.of("anomaly_field_errors", "Missing metric field: x"));

        assertThat(AnnotationProcessFunction.hasErrorField(clean)).isFalse();
        assertThat(AnnotationProcessFunction.hasErrorField(failed)).isTrue();
        assertThat(AnnotationProcessFunction.hasErrorField(partial)).isTrue();
    }
}
