package com.driftguard.core.drift;

/**
 * Drift verdict for one text.
 *
 * @since 1.0.0
 */
public final class DriftResult {

    private final double driftScore;
    private final boolean driftDetected;
    private final double recentSimilarity;
    private final DriftSeverity severity;

    DriftResult(double driftScore, boolean driftDetected, double recentSimilarity) {
        this.driftScore = driftScore;
        this.driftDetected = driftDetected;
        this.recentSimilarity = recentSimilarity;
        this.severity = DriftSeverity.classify(driftScore);
    }

    /**
     * @return {@code 1 - max similarity to the baseline set}, {@code 0} without
     *         baselines
     */
    public double getDriftScore() {
        return driftScore;
    }

    public boolean isDriftDetected() {
        return driftDetected;
    }

    /**
     * @return the best similarity to the baseline set, {@code 1 - driftScore}
     */
    public double getBaselineSimilarity() {
        return 1.0 - driftScore;
    }

    /**
     * @return mean similarity to the latest recent samples, {@code 1.0} for the
     *         first sample of a stream
     */
    public double getRecentSimilarity() {
        return recentSimilarity;
    }

    public DriftSeverity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return "DriftResult{" +
                "driftScore=" + driftScore +
                ", driftDetected=" + driftDetected +
                ", recentSimilarity=" + recentSimilarity +
                ", severity=" + severity +
                '}';
    }
}
