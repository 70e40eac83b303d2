package com.driftguard.core.drift;

import java.util.Locale;

/**
 * Severity bucket of a drift score.
 *
 * @since 1.0.0
 */
public enum DriftSeverity {
    MINIMAL,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @param driftScore drift score, normally in {@code [0, 1]}
     * @return minimal below 0.1, low below 0.3, medium below 0.5, high below
     *         0.7, otherwise critical
     */
    public static DriftSeverity classify(double driftScore) {
        if (driftScore < 0.1) {
            return MINIMAL;
        } else if (driftScore < 0.3) {
            return LOW;
        } else if (driftScore < 0.5) {
            return MEDIUM;
        } else if (driftScore < 0.7) {
            return HIGH;
        }
        return CRITICAL;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
