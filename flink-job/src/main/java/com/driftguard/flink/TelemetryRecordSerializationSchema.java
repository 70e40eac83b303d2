package com.driftguard.flink;

import com.driftguard.core.model.TelemetryRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts an annotated
 * {@link TelemetryRecord} into JSON bytes for the output topic.
 * <p>
 * Non-finite numbers (for example an infinite percentage change) are written
 * as the strings {@code "Infinity"}, {@code "-Infinity"} and {@code "NaN"}.
 * </p>
 */
public class TelemetryRecordSerializationSchema implements SerializationSchema<TelemetryRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryRecordSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(TelemetryRecord record) {
        try {
            return objectMapper().writeValueAsBytes(record);
        } catch (Exception e) {
            LOG.error("Failed to serialize telemetry record: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        return mapper;
    }
}
