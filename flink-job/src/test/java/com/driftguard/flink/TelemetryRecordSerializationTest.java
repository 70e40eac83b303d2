package com.driftguard.flink;

import com.driftguard.core.model.TelemetryRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TelemetryRecordDeserializationSchema} and
 * {@link TelemetryRecordSerializationSchema}.
 */
class TelemetryRecordSerializationTest {

    private final TelemetryRecordDeserializationSchema deserializer = new TelemetryRecordDeserializationSchema();
    private final TelemetryRecordSerializationSchema serializer = new TelemetryRecordSerializationSchema();

    @Test
    @DisplayName("Should read arbitrary JSON fields in order")
    void shouldDeserializeRecord() throws IOException {
        String json = "{\"model_id\":\"gpt-4\",\"response_time\":1.25,\"token_count\":120,\"prompt\":\"Hi\"}";

        TelemetryRecord record = deserializer.deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(record).isNotNull();
        assertThat(record.getFields().keySet()).containsExactly("model_id", "response_time", "token_count", "prompt");
        assertThat(record.getNumericField("response_time")).contains(1.25);
        assertThat(record.getStringField("model_id")).contains("gpt-4");
    }

    @Test
    @DisplayName("Should skip malformed and empty messages")
    void shouldSkipBadMessages() throws IOException {
        assertThat(deserializer.deserialize("{not json".getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(deserializer.deserialize(new byte[0])).isNull();
        assertThat(deserializer.deserialize(null)).isNull();
    }

    @Test
    @DisplayName("Should write annotation fields as flat JSON")
    void shouldSerializeRecord() {
        TelemetryRecord record = new TelemetryRecord();
        record.setField("model_id", "gpt-4");
        record.setField("anomaly_detected", true);
        record.setField("drift_score", 0.25);

        String json = new String(serializer.serialize(record), StandardCharsets.UTF_8);

        assertThat(json).isEqualTo("{\"model_id\":\"gpt-4\",\"anomaly_detected\":true,\"drift_score\":0.25}");
    }

    @Test
    @DisplayName("Should carry ISO-8601 timestamps through as plain strings")
    void shouldKeepTimestampText() throws IOException {
        String json = "{\"timestamp\":\"2024-03-01T12:30:45.123Z\",\"model_id\":\"gpt-4\"}";

        TelemetryRecord record = deserializer.deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(record.getStringField("timestamp")).contains("2024-03-01T12:30:45.123Z");
        assertThat(new String(serializer.serialize(record), StandardCharsets.UTF_8)).isEqualTo(json);
    }
}
