/**
 * Windowed anomaly detection algorithms.
 *
 * <p>
 * All detectors implement the
 * {@link com.driftguard.core.detection.AnomalyDetector} interface and are
 * instantiated via {@link com.driftguard.core.detection.DetectorFactory}.
 * Built-in detector kinds:
 * </p>
 * <ul>
 * <li>{@link com.driftguard.core.detection.ZScoreDetector} - distance from the
 * window mean in sample standard deviations</li>
 * <li>{@link com.driftguard.core.detection.IqrDetector} - positional
 * interquartile fences</li>
 * <li>{@link com.driftguard.core.detection.IsolationDetector} - mean/stdev
 * ratio of distances to the other window values</li>
 * <li>{@link com.driftguard.core.detection.TrendDetector} - least-squares
 * prediction error</li>
 * </ul>
 *
 * <p>
 * {@link com.driftguard.core.detection.AnomalySeverity} turns the anomalies of
 * one record into an ordinal severity.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftguard.core.detection;
