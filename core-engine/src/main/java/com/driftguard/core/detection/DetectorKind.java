package com.driftguard.core.detection;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * The closed set of anomaly detection algorithms.
 *
 * <p>
 * The configured method name ({@code zscore}, {@code iqr}, {@code isolation},
 * {@code trend} or {@code all}) is resolved once, at configuration time, by
 * {@link #parseSelection(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    ZSCORE("zscore"),
    IQR("iqr"),
    ISOLATION("isolation"),
    TREND("trend");

    /** Method name that selects every detector. */
    public static final String ALL = "all";

    private final String id;

    DetectorKind(String id) {
        this.id = id;
    }

    /**
     * @return the lowercase method name, also used as window-key suffix
     */
    public String getId() {
        return id;
    }

    /**
     * Identifier of an anomaly on a field, e.g. {@code response_time_zscore}.
     * Doubles as the detector's window key so every detector keeps its own
     * history per field.
     *
     * @param field analysed field name
     * @return the anomaly identifier
     */
    public String anomalyId(String field) {
        return field + "_" + id;
    }

    /**
     * Resolve a method name to the detectors it selects.
     *
     * @param method {@code zscore}, {@code iqr}, {@code isolation},
     *               {@code trend} or {@code all} (case-insensitive)
     * @return unmodifiable set of selected kinds, in declaration order
     * @throws NullPointerException     if {@code method} is {@code null}
     * @throws IllegalArgumentException if the method name is unknown
     */
    public static Set<DetectorKind> parseSelection(String method) {
        Objects.requireNonNull(method, "Detection method must not be null");
        String normalized = method.trim().toLowerCase(Locale.ROOT);
        if (ALL.equals(normalized)) {
            return Collections.unmodifiableSet(EnumSet.allOf(DetectorKind.class));
        }
        for (DetectorKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return Collections.unmodifiableSet(EnumSet.of(kind));
            }
        }
        throw new IllegalArgumentException("Unknown detection method: '" + method
                + "'. Supported: zscore, iqr, isolation, trend, all");
    }
}
