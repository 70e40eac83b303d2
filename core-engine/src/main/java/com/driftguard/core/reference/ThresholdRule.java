package com.driftguard.core.reference;

import java.io.Serializable;
import java.util.Objects;

/**
 * Alert thresholds for one metric, one row of the threshold table.
 *
 * @since 1.0.0
 */
public final class ThresholdRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final String thresholdType;
    private final double warningThreshold;
    private final double criticalThreshold;
    private final String unit;
    private final String description;

    /**
     * @param metricName        metric the rule applies to; must not be
     *                          {@code null}
     * @param thresholdType     raw type as written in the table
     *                          ({@code upper}, {@code lower},
     *                          {@code percentage})
     * @param warningThreshold  warning level
     * @param criticalThreshold critical level
     * @param unit              unit label, may be empty
     * @param description       free-text description, may be empty
     */
    public ThresholdRule(String metricName, String thresholdType, double warningThreshold,
            double criticalThreshold, String unit, String description) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.thresholdType = thresholdType != null ? thresholdType : "upper";
        this.warningThreshold = warningThreshold;
        this.criticalThreshold = criticalThreshold;
        this.unit = unit != null ? unit : "";
        this.description = description != null ? description : "";
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return the raw type string from the table
     */
    public String getThresholdType() {
        return thresholdType;
    }

    public ThresholdType getType() {
        return ThresholdType.fromTableValue(thresholdType);
    }

    public double getWarningThreshold() {
        return warningThreshold;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public String getUnit() {
        return unit;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdRule that))
            return false;
        return Double.compare(warningThreshold, that.warningThreshold) == 0
                && Double.compare(criticalThreshold, that.criticalThreshold) == 0
                && metricName.equals(that.metricName)
                && thresholdType.equals(that.thresholdType)
                && unit.equals(that.unit)
                && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, thresholdType, warningThreshold, criticalThreshold, unit, description);
    }

    @Override
    public String toString() {
        return "ThresholdRule{" +
                "metricName='" + metricName + '\'' +
                ", thresholdType='" + thresholdType + '\'' +
                ", warningThreshold=" + warningThreshold +
                ", criticalThreshold=" + criticalThreshold +
                ", unit='" + unit + '\'' +
                '}';
    }
}
