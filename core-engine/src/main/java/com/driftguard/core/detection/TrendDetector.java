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
 * Trend (linear regression) detector.
 *
 * <p>
 * Fits an ordinary-least-squares line to the last {@code lookback} values of
 * the window against positions {@code 0..n-1} and compares the newest value
 * with the fitted value at {@code n - 1}. The value is anomalous when the
 * prediction error exceeds twice the sample standard deviation of the
 * residuals; a perfect fit (residual deviation {@code 0}) is never anomalous.
 * </p>
 *
 * <p>
 * The lookback is independent of the window store capacity.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TrendDetector.class);

    /** Default number of most recent values the line is fitted to. */
    public static final int DEFAULT_LOOKBACK = 10;

    static final double MIN_RESIDUAL_STD = 0.001;

    private final int lookback;

    public TrendDetector() {
        this(DEFAULT_LOOKBACK);
    }

    /**
     * @param lookback number of recent values to fit; must be positive
     * @throws IllegalArgumentException if {@code lookback < 1}
     */
    public TrendDetector(int lookback) {
        if (lookback < 1) {
            throw new IllegalArgumentException("Trend lookback must be >= 1, got: " + lookback);
        }
        this.lookback = lookback;
    }

    @Override
    public DetectionResult evaluate(WindowStore windows, String field, double value) {
        Objects.requireNonNull(windows, "WindowStore must not be null");
        List<Double> window = windows.observe(DetectorKind.TREND.anomalyId(field), value);

        if (window.size() < lookback) {
            return DetectionResult.normal();
        }

        List<Double> values = window.subList(window.size() - lookback, window.size());
        int n = values.size();
        if (n < 2) {
            return DetectionResult.normal();
        }

        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumX2 = 0;
        for (int i = 0; i < n; i++) {
            double y = values.get(i);
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumX2 += (double) i * i;
        }

        double denominator = n * sumX2 - sumX * sumX;
        if (denominator == 0) {
            return DetectionResult.normal();
        }

        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;

        double predicted = slope * (n - 1) + intercept;
        double predictionError = Math.abs(value - predicted);

        List<Double> residuals = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            residuals.add(values.get(i) - (slope * i + intercept));
        }
        double residualStd = Stats.sampleStdDev(residuals);

        boolean anomaly = residualStd > 0 && predictionError > 2 * residualStd;
        double score = predictionError / Math.max(residualStd, MIN_RESIDUAL_STD);
        if (anomaly) {
            LOG.debug("Trend anomaly on {}: value={} predicted={} residualStd={}",
                    field, value, predicted, residualStd);
        }

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("slope", slope);
        diagnostics.put("intercept", intercept);
        diagnostics.put("predicted_value", predicted);
        diagnostics.put("prediction_error", predictionError);
        diagnostics.put("residual_std", residualStd);
        diagnostics.put("anomaly_score", score);
        return DetectionResult.of(anomaly, score, diagnostics);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.TREND;
    }

    public int getLookback() {
        return lookback;
    }
}
