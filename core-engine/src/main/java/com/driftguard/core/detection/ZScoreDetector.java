package com.driftguard.core.detection;

import com.driftguard.core.model.DetectionResult;
import com.driftguard.core.window.WindowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Z-score detector.
 *
 * <p>
 * Flags a value whose distance from the window mean exceeds
 * {@code threshold} sample standard deviations. The new value is part of the
 * window it is judged against.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Needs at least {@value #MIN_SAMPLES} values (including the new one). A
 * constant window (standard deviation {@code 0}) never produces a verdict.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    static final int MIN_SAMPLES = 10;

    /** Default number of standard deviations. */
    public static final double DEFAULT_THRESHOLD = 2.0;

    private final double threshold;

    public ZScoreDetector() {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * @param threshold number of standard deviations beyond which a value is
     *                  anomalous; must be positive
     * @throws IllegalArgumentException if {@code threshold <= 0}
     */
    public ZScoreDetector(double threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("Z-score threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public DetectionResult evaluate(WindowStore windows, String field, double value) {
        Objects.requireNonNull(windows, "WindowStore must not be null");
        List<Double> values = windows.observe(DetectorKind.ZSCORE.anomalyId(field), value);

        if (values.size() < MIN_SAMPLES) {
            return DetectionResult.normal();
        }

        double mean = Stats.mean(values);
        double stdev = Stats.sampleStdDev(values);
        if (stdev == 0) {
            return DetectionResult.normal();
        }

        double zscore = (value - mean) / stdev;
        boolean anomaly = Math.abs(zscore) > threshold;
        if (anomaly) {
            LOG.debug("Z-score anomaly on {}: value={} mean={} stdev={} z={}", field, value, mean, stdev, zscore);
        }

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("mean", mean);
        diagnostics.put("stdev", stdev);
        diagnostics.put("zscore", zscore);
        diagnostics.put("threshold", threshold);
        diagnostics.put("sample_size", values.size());
        return DetectionResult.of(anomaly, Math.abs(zscore), diagnostics);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.ZSCORE;
    }

    public double getThreshold() {
        return threshold;
    }
}
