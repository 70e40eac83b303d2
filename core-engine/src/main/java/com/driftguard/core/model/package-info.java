/**
 * Domain model classes shared by the monitoring stages.
 *
 * <ul>
 * <li>{@link com.driftguard.core.model.TelemetryRecord} - one LLM-interaction
 * record, annotated in place</li>
 * <li>{@link com.driftguard.core.model.FieldReading} - typed outcome of reading
 * a numeric input field</li>
 * <li>{@link com.driftguard.core.model.DetectionResult} - verdict of one
 * anomaly detector</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftguard.core.model;
