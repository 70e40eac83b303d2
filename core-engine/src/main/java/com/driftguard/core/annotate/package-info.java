/**
 * Per-record orchestration.
 *
 * <p>
 * {@link com.driftguard.core.annotate.RecordAnnotator} runs the enabled
 * {@link com.driftguard.core.annotate.AnnotationStage}s against one
 * {@link com.driftguard.core.annotate.MonitoringSession} per stream and a
 * shared {@link com.driftguard.core.reference.ReferenceData} snapshot.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftguard.core.annotate;
