package com.driftguard.flink;

import com.driftguard.core.model.TelemetryRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link TelemetryRecord}.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}) so that a
 * single bad message does not stop the pipeline. Only JSON objects are
 * records; arrays and scalars are dropped the same way.
 * </p>
 */
public class TelemetryRecordDeserializationSchema implements DeserializationSchema<TelemetryRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryRecordDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public TelemetryRecord deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, TelemetryRecord.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize telemetry record - skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(TelemetryRecord nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<TelemetryRecord> getProducedType() {
        return TypeInformation.of(TelemetryRecord.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
