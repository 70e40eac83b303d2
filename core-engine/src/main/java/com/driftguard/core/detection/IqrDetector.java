package com.driftguard.core.detection;

import com.driftguard.core.model.DetectionResult;
import com.driftguard.core.window.WindowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interquartile-range detector.
 *
 * <p>
 * Quartiles are taken positionally from the sorted window:
 * {@code Q1 = sorted[n / 4]}, {@code Q3 = sorted[3n / 4]} with integer
 * division and no interpolation. A value outside
 * {@code [Q1 - m * IQR, Q3 + m * IQR]} is anomalous; its score is the distance
 * past the violated bound in units of {@code max(IQR, 0.001)}.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(IqrDetector.class);

    static final int MIN_SAMPLES = 10;
    static final double MIN_IQR = 0.001;

    /** Default fence multiplier. */
    public static final double DEFAULT_MULTIPLIER = 1.5;

    private final double multiplier;

    public IqrDetector() {
        this(DEFAULT_MULTIPLIER);
    }

    /**
     * @param multiplier IQR fence multiplier; must be positive
     * @throws IllegalArgumentException if {@code multiplier <= 0}
     */
    public IqrDetector(double multiplier) {
        if (multiplier <= 0) {
            throw new IllegalArgumentException("IQR multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public DetectionResult evaluate(WindowStore windows, String field, double value) {
        Objects.requireNonNull(windows, "WindowStore must not be null");
        List<Double> window = windows.observe(DetectorKind.IQR.anomalyId(field), value);

        if (window.size() < MIN_SAMPLES) {
            return DetectionResult.normal();
        }

        List<Double> sorted = new ArrayList<>(window);
        Collections.sort(sorted);
        int n = sorted.size();

        double q1 = sorted.get(n / 4);
        double q3 = sorted.get(3 * n / 4);
        double iqr = q3 - q1;
        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;

        boolean anomaly = value < lowerBound || value > upperBound;
        double score = 0.0;
        if (value < lowerBound) {
            score = (lowerBound - value) / Math.max(iqr, MIN_IQR);
        } else if (value > upperBound) {
            score = (value - upperBound) / Math.max(iqr, MIN_IQR);
        }
        if (anomaly) {
            LOG.debug("IQR anomaly on {}: value={} bounds=[{}, {}]", field, value, lowerBound, upperBound);
        }

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("q1", q1);
        diagnostics.put("q3", q3);
        diagnostics.put("iqr", iqr);
        diagnostics.put("lower_bound", lowerBound);
        diagnostics.put("upper_bound", upperBound);
        diagnostics.put("multiplier", multiplier);
        diagnostics.put("sample_size", n);
        return DetectionResult.of(anomaly, score, diagnostics);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.IQR;
    }

    public double getMultiplier() {
        return multiplier;
    }
}
