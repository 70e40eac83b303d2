package com.driftguard.core.baseline;

import java.util.Locale;

/**
 * Outcome of comparing a metric against its baseline.
 *
 * @since 1.0.0
 */
public enum ComparisonStatus {

    NORMAL,
    WARNING,
    CRITICAL;

    /**
     * @return the lowercase label written to records
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
