package com.driftguard.core.detection;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Small descriptive-statistics helpers shared by the detectors and the
 * metrics calculator.
 *
 * @since 1.0.0
 */
public final class Stats {

    private Stats() {
        // utility class - not instantiable
    }

    /**
     * @param values non-empty list of values
     * @return arithmetic mean
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("mean requires at least one value");
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (Bessel-corrected, divides by {@code n - 1}).
     *
     * @param values the values
     * @return the sample standard deviation, or {@code 0} for fewer than two
     *         values
     */
    public static double sampleStdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.size() - 1));
    }

    /**
     * Population standard deviation (divides by {@code n}).
     *
     * @param values the values
     * @return the population standard deviation, or {@code 0} for an empty
     *         list
     */
    public static double populationStdDev(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }

    /**
     * Round half-even to the given number of decimal places, as used for the
     * values written onto records.
     *
     * @param value  the value; non-finite values are returned unchanged
     * @param places number of decimal places
     * @return the rounded value
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value)
                .setScale(places, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}
