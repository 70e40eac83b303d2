package com.driftguard.core.detection;

import java.util.Locale;

/**
 * Ordinal severity of the anomalies found on one record.
 *
 * @since 1.0.0
 */
public enum AnomalySeverity {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Classify by anomaly count and the highest anomaly score. Rules are
     * checked in order and the first match wins:
     * <ol>
     * <li>no anomaly: {@link #NONE}</li>
     * <li>one anomaly scoring below 3: {@link #LOW}</li>
     * <li>up to two anomalies scoring below 5: {@link #MEDIUM}</li>
     * <li>up to three anomalies scoring below 8: {@link #HIGH}</li>
     * <li>anything else, including four or more anomalies: {@link #CRITICAL}</li>
     * </ol>
     *
     * @param anomalyCount number of anomalies on the record
     * @param maxScore     highest score among them
     * @return the severity
     */
    public static AnomalySeverity classify(int anomalyCount, double maxScore) {
        if (anomalyCount == 0) {
            return NONE;
        } else if (anomalyCount == 1 && maxScore < 3.0) {
            return LOW;
        } else if (anomalyCount <= 2 && maxScore < 5.0) {
            return MEDIUM;
        } else if (anomalyCount <= 3 && maxScore < 8.0) {
            return HIGH;
        }
        return CRITICAL;
    }

    /**
     * @return lowercase label written onto records
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
