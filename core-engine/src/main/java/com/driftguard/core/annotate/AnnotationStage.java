package com.driftguard.core.annotate;

import com.driftguard.core.model.TelemetryRecord;
import com.driftguard.core.reference.ReferenceData;

import java.io.Serializable;

/**
 * One step of record annotation.
 *
 * <p>
 * Implementations read their input fields from the record and add their
 * output fields to it. Per-record failures must be written to the stage's
 * error field rather than thrown.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnnotationStage extends Serializable {

    /**
     * Annotate one record.
     *
     * @param record    the record, modified in place
     * @param session   the stream's mutable state
     * @param reference current reference data snapshot
     */
    void annotate(TelemetryRecord record, MonitoringSession session, ReferenceData reference);

    /**
     * @return short stage name used in logs and error fields
     */
    String getName();
}
