package com.driftguard.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TelemetryRecord}.
 */
class TelemetryRecordTest {

    @Test
    @DisplayName("Should read numbers and numeric strings")
    void shouldReadNumericValues() {
        TelemetryRecord record = new TelemetryRecord(Map.of("response_time", 1.25, "token_count", " 42 "));

        assertThat(record.readNumeric("response_time").getValue()).isEqualTo(1.25);
        assertThat(record.getNumericField("token_count")).contains(42.0);
    }

    @Test
    @DisplayName("Should distinguish missing from invalid numeric fields")
    void shouldDescribeProblems() {
        TelemetryRecord record = new TelemetryRecord(Map.of("flag", true, "latency", "slow"));

        FieldReading missing = record.readNumeric("response_time");
        FieldReading bool = record.readNumeric("flag");
        FieldReading text = record.readNumeric("latency");

        assertThat(missing.getStatus()).isEqualTo(FieldReading.Status.MISSING);
        assertThat(missing.describeProblem()).isEqualTo("Missing metric field: response_time");
        assertThat(bool.getStatus()).isEqualTo(FieldReading.Status.INVALID);
        assertThat(text.describeProblem()).isEqualTo("Invalid numeric value for latency: slow");
        assertThatThrownBy(text::getValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should treat absent text as empty and keep field order")
    void shouldReadText() {
        TelemetryRecord record = new TelemetryRecord();
        record.setField("b", "second");
        record.setField("a", null);

        assertThat(record.getText("a")).isEmpty();
        assertThat(record.getText(null)).isEmpty();
        assertThat(record.getText("b")).isEqualTo("second");
        assertThat(record.getFields().keySet()).containsExactly("b", "a");
    }
}
