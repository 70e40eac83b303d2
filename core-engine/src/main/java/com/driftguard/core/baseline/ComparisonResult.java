package com.driftguard.core.baseline;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one {@link BaselineComparator#compare} call.
 *
 * <p>
 * When the baseline is zero the ratio and the z-score estimate are undefined
 * and their accessors return empty. A non-zero current value against a zero
 * baseline has a percentage change of {@link Double#POSITIVE_INFINITY}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ComparisonResult {

    private final double current;
    private final double baseline;
    private final double absoluteDeviation;
    private final double percentageChange;
    private final Double ratio;
    private final Double zScoreEstimate;
    private final ComparisonStatus status;
    private final String comparisonType;
    private final String metricName;

    ComparisonResult(double current, double baseline, double absoluteDeviation, double percentageChange,
            Double ratio, Double zScoreEstimate, ComparisonStatus status, String comparisonType,
            String metricName) {
        this.current = current;
        this.baseline = baseline;
        this.absoluteDeviation = absoluteDeviation;
        this.percentageChange = percentageChange;
        this.ratio = ratio;
        this.zScoreEstimate = zScoreEstimate;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.comparisonType = comparisonType;
        this.metricName = metricName;
    }

    public double getCurrent() {
        return current;
    }

    public double getBaseline() {
        return baseline;
    }

    public double getAbsoluteDeviation() {
        return absoluteDeviation;
    }

    public double getPercentageChange() {
        return percentageChange;
    }

    public Optional<Double> getRatio() {
        return Optional.ofNullable(ratio);
    }

    /**
     * @return {@code (current - baseline) / (baseline * 0.1)}, an estimate that
     *         assumes a standard deviation of 10% of the baseline
     */
    public Optional<Double> getZScoreEstimate() {
        return Optional.ofNullable(zScoreEstimate);
    }

    public ComparisonStatus getStatus() {
        return status;
    }

    public String getComparisonType() {
        return comparisonType;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * Magnitude bucket of {@code |percentageChange|}: minimal (&lt; 5), small
     * (&lt; 15), moderate (&lt; 30), large (&lt; 50), extreme.
     *
     * @return the category label
     */
    public String getDeviationCategory() {
        double abs = Math.abs(percentageChange);
        if (abs < 5) {
            return "minimal";
        } else if (abs < 15) {
            return "small";
        } else if (abs < 30) {
            return "moderate";
        } else if (abs < 50) {
            return "large";
        }
        return "extreme";
    }

    /**
     * @return {@code increasing} above +5%, {@code decreasing} below -5%,
     *         otherwise {@code stable}
     */
    public String getTrend() {
        if (percentageChange > 5) {
            return "increasing";
        } else if (percentageChange < -5) {
            return "decreasing";
        }
        return "stable";
    }

    @Override
    public String toString() {
        return "ComparisonResult{" +
                "metricName='" + metricName + '\'' +
                ", current=" + current +
                ", baseline=" + baseline +
                ", percentageChange=" + percentageChange +
                ", status=" + status +
                '}';
    }
}
