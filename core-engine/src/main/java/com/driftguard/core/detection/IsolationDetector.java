package com.driftguard.core.detection;

import com.driftguard.core.model.DetectionResult;
import com.driftguard.core.window.WindowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Distance-based isolation detector.
 *
 * <p>
 * A cheap stand-in for an isolation forest: the absolute distances from the
 * new value to every window element with a different value are summarised as
 * {@code mean(d) / max(stdev(d), 0.001)}. Scores above
 * {@value #ISOLATION_THRESHOLD} are anomalous. The threshold is fixed and does
 * not follow the configured anomaly threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(IsolationDetector.class);

    static final int MIN_SAMPLES = 20;
    static final double ISOLATION_THRESHOLD = 2.0;
    static final double MIN_STD_DISTANCE = 0.001;

    @Override
    public DetectionResult evaluate(WindowStore windows, String field, double value) {
        Objects.requireNonNull(windows, "WindowStore must not be null");
        List<Double> window = windows.observe(DetectorKind.ISOLATION.anomalyId(field), value);

        if (window.size() < MIN_SAMPLES) {
            return DetectionResult.normal();
        }

        List<Double> distances = new ArrayList<>();
        for (double v : window) {
            if (v != value) {
                distances.add(Math.abs(value - v));
            }
        }
        if (distances.isEmpty()) {
            return DetectionResult.normal();
        }

        double avgDistance = Stats.mean(distances);
        double stdDistance = Stats.sampleStdDev(distances);
        double isolationScore = avgDistance / Math.max(stdDistance, MIN_STD_DISTANCE);
        boolean anomaly = isolationScore > ISOLATION_THRESHOLD;
        if (anomaly) {
            LOG.debug("Isolation anomaly on {}: value={} score={}", field, value, isolationScore);
        }

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("avg_distance", avgDistance);
        diagnostics.put("std_distance", stdDistance);
        diagnostics.put("isolation_score", isolationScore);
        diagnostics.put("sample_size", window.size());
        return DetectionResult.of(anomaly, isolationScore, diagnostics);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.ISOLATION;
    }
}
