package com.driftguard.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Uniform verdict returned by every anomaly detector.
 *
 * <p>
 * {@code score} is only meaningful when the detector had enough history to
 * evaluate; cold-start and degenerate windows produce {@link #normal()}, i.e.
 * not anomalous, score {@code 0} and no diagnostics.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final DetectionResult NORMAL = new DetectionResult(false, 0.0, Map.of());

    private final boolean anomaly;
    private final double score;
    private final Map<String, Object> diagnostics;

    private DetectionResult(boolean anomaly, double score, Map<String, Object> diagnostics) {
        this.anomaly = anomaly;
        this.score = score;
        this.diagnostics = diagnostics;
    }

    /**
     * @param anomaly     whether the value is anomalous
     * @param score       detector-specific anomaly score
     * @param diagnostics ordered diagnostic values; copied defensively
     * @return a new result
     */
    public static DetectionResult of(boolean anomaly, double score, Map<String, Object> diagnostics) {
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        return new DetectionResult(anomaly, score,
                Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics)));
    }

    /**
     * @return the shared "not anomalous, score 0, no diagnostics" result
     */
    public static DetectionResult normal() {
        return NORMAL;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public double getScore() {
        return score;
    }

    public Map<String, Object> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return anomaly == that.anomaly
                && Double.compare(score, that.score) == 0
                && Objects.equals(diagnostics, that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomaly, score, diagnostics);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "anomaly=" + anomaly +
                ", score=" + score +
                ", diagnostics=" + diagnostics +
                '}';
    }
}
