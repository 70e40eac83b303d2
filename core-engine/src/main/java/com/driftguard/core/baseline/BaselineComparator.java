package com.driftguard.core.baseline;

import com.driftguard.core.reference.ThresholdRule;
import com.driftguard.core.reference.ThresholdTable;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares a current metric value with its reference value and classifies
 * the deviation.
 *
 * <h3>Status rules</h3>
 * <p>
 * With a {@link ThresholdRule} for the metric, {@code upper} rules compare the
 * current value against the thresholds from above, {@code lower} rules from
 * below, and any other type compares {@code |percentageChange|}. Without a
 * rule, {@code |percentageChange| > 50} is critical and {@code > 25} is a
 * warning. All comparisons are strict.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineComparator implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Comparison type recorded when none is configured. */
    public static final String DEFAULT_COMPARISON_TYPE = "percentage";

    static final double DEFAULT_CRITICAL_PCT = 50.0;
    static final double DEFAULT_WARNING_PCT = 25.0;
    static final double ASSUMED_STDEV_FRACTION = 0.1;

    private final ThresholdTable thresholds;

    public BaselineComparator() {
        this(ThresholdTable.empty());
    }

    /**
     * @param thresholds alert thresholds by metric name; must not be
     *                   {@code null}
     */
    public BaselineComparator(ThresholdTable thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "ThresholdTable must not be null");
    }

    /**
     * Compare a current value with its baseline.
     *
     * @param current        current metric value
     * @param baseline       reference value
     * @param metricName     metric name, used to find a threshold rule
     * @param comparisonType recorded on the result only
     * @return the comparison
     */
    public ComparisonResult compare(double current, double baseline, String metricName, String comparisonType) {
        if (baseline == 0) {
            if (current == 0) {
                return new ComparisonResult(current, baseline, 0.0, 0.0, null, null,
                        ComparisonStatus.NORMAL, comparisonType, metricName);
            }
            return new ComparisonResult(current, baseline, current, Double.POSITIVE_INFINITY, null, null,
                    ComparisonStatus.CRITICAL, comparisonType, metricName);
        }

        double absoluteDeviation = current - baseline;
        double percentageChange = absoluteDeviation / baseline * 100;
        ComparisonStatus status = determineStatus(metricName, current, percentageChange);
        double ratio = current / baseline;
        double zScore = (current - baseline) / (baseline * ASSUMED_STDEV_FRACTION);
        return new ComparisonResult(current, baseline, absoluteDeviation, percentageChange, ratio, zScore,
                status, comparisonType, metricName);
    }

    /**
     * Render a human readable alert, for example
     * {@code "CRITICAL - Model gpt-4: response_time has increased by 50.0% (current: 1.500, baseline: 1.000)"}.
     *
     * @param result  the comparison
     * @param modelId model the metric belongs to
     * @return the message
     */
    public String alertMessage(ComparisonResult result, String modelId) {
        Objects.requireNonNull(result, "ComparisonResult must not be null");
        if (result.getStatus() == ComparisonStatus.NORMAL) {
            return "Model " + modelId + ": " + result.getMetricName() + " is within normal range";
        }
        String direction = result.getPercentageChange() > 0 ? "increased" : "decreased";
        return String.format(Locale.ROOT, "%s - Model %s: %s has %s by %.1f%% (current: %.3f, baseline: %.3f)",
                result.getStatus().name(), modelId, result.getMetricName(), direction,
                Math.abs(result.getPercentageChange()), result.getCurrent(), result.getBaseline());
    }

    public Optional<ThresholdRule> thresholdFor(String metricName) {
        return thresholds.find(metricName);
    }

    public ThresholdTable getThresholds() {
        return thresholds;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ComparisonStatus determineStatus(String metricName, double current, double percentageChange) {
        Optional<ThresholdRule> rule = thresholds.find(metricName);
        if (rule.isEmpty()) {
            return classify(Math.abs(percentageChange), DEFAULT_WARNING_PCT, DEFAULT_CRITICAL_PCT);
        }
        ThresholdRule r = rule.get();
        return switch (r.getType()) {
            case UPPER -> classify(current, r.getWarningThreshold(), r.getCriticalThreshold());
            case LOWER -> {
                if (current < r.getCriticalThreshold()) {
                    yield ComparisonStatus.CRITICAL;
                } else if (current < r.getWarningThreshold()) {
                    yield ComparisonStatus.WARNING;
                }
                yield ComparisonStatus.NORMAL;
            }
            case PERCENTAGE -> classify(Math.abs(percentageChange), r.getWarningThreshold(),
                    r.getCriticalThreshold());
        };
    }

    private static ComparisonStatus classify(double value, double warning, double critical) {
        if (value > critical) {
            return ComparisonStatus.CRITICAL;
        } else if (value > warning) {
            return ComparisonStatus.WARNING;
        }
        return ComparisonStatus.NORMAL;
    }
}
