package com.driftguard.core.reference;

import java.util.Locale;

/**
 * How a {@link ThresholdRule} is applied.
 *
 * @since 1.0.0
 */
public enum ThresholdType {

    /** Higher values are worse; thresholds compare the current value. */
    UPPER,

    /** Lower values are worse; thresholds compare the current value. */
    LOWER,

    /** Thresholds compare the absolute percentage change from the baseline. */
    PERCENTAGE;

    /**
     * Resolve a table value. {@code upper} and {@code lower} are recognised
     * case-insensitively; every other value selects {@link #PERCENTAGE}.
     *
     * @param value raw table value; {@code null} selects {@link #UPPER}
     * @return the type
     */
    public static ThresholdType fromTableValue(String value) {
        if (value == null) {
            return UPPER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "upper" -> UPPER;
            case "lower" -> LOWER;
            default -> PERCENTAGE;
        };
    }
}
