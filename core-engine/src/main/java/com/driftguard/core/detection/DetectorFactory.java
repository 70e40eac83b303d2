package com.driftguard.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances for the configured
 * {@link DetectorKind}s.
 *
 * <p>
 * The configured anomaly threshold is the z-score threshold and also the IQR
 * fence multiplier. The isolation detector's threshold is fixed and the trend
 * detector uses its default lookback.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class - not instantiable
    }

    /**
     * Create a detector of the given kind.
     *
     * @param kind      the algorithm; must not be {@code null}
     * @param threshold configured anomaly threshold
     * @return a new detector
     * @throws NullPointerException     if {@code kind} is {@code null}
     * @throws IllegalArgumentException if {@code threshold} is not positive for
     *                                  a kind that uses it
     */
    public static AnomalyDetector create(DetectorKind kind, double threshold) {
        Objects.requireNonNull(kind, "DetectorKind must not be null");
        return switch (kind) {
            case ZSCORE -> new ZScoreDetector(threshold);
            case IQR -> new IqrDetector(threshold);
            case ISOLATION -> new IsolationDetector();
            case TREND -> new TrendDetector();
        };
    }

    /**
     * Create one detector per selected kind, in {@link DetectorKind}
     * declaration order.
     *
     * @param kinds     selected kinds; must not be {@code null}
     * @param threshold configured anomaly threshold
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(Collection<DetectorKind> kinds, double threshold) {
        Objects.requireNonNull(kinds, "Detector kinds must not be null");
        EnumSet<DetectorKind> ordered = kinds.isEmpty()
                ? EnumSet.noneOf(DetectorKind.class)
                : EnumSet.copyOf(kinds);
        LOG.info("Creating {} detector(s): {}", ordered.size(), ordered);
        List<AnomalyDetector> detectors = ordered.stream()
                .map(kind -> create(kind, threshold))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
