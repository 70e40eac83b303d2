package com.driftguard.core.reference;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable per-model reference values.
 *
 * <p>
 * Maps a model identifier to its metric columns. Column values are
 * {@link Double} when the table cell parsed as a number and the raw
 * {@link String} otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineTable implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Row used for models without a row of their own. */
    public static final String DEFAULT_MODEL = "default";

    private static final BaselineTable EMPTY = new BaselineTable(Map.of());

    private final Map<String, Map<String, Object>> rows;

    /**
     * @param rows metric values by model id; copied defensively, order kept
     */
    public BaselineTable(Map<String, Map<String, Object>> rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        rows.forEach((model, metrics) ->
                copy.put(model, Collections.unmodifiableMap(new LinkedHashMap<>(metrics))));
        this.rows = Collections.unmodifiableMap(copy);
    }

    public static BaselineTable empty() {
        return EMPTY;
    }

    /**
     * @param modelId model identifier
     * @return the model's row, or empty if the table has no such row
     */
    public Optional<Map<String, Object>> row(String modelId) {
        return Optional.ofNullable(rows.get(modelId));
    }

    /**
     * Find the reference value of a metric for a model.
     *
     * <p>
     * The model's own row is used when present, otherwise the
     * {@value #DEFAULT_MODEL} row. The metric name is reduced to its key by
     * removing {@code current_} and {@code avg_}; the column
     * {@code avg_<key>} is preferred over {@code <key>}.
     * </p>
     *
     * @param modelId    model identifier
     * @param metricName metric name as configured
     * @return the raw cell value ({@link Double} or {@link String}), or empty
     */
    public Optional<Object> lookup(String modelId, String metricName) {
        Map<String, Object> row = rows.get(modelId);
        if (row == null) {
            row = rows.getOrDefault(DEFAULT_MODEL, Map.of());
        }
        String key = metricName.replace("current_", "").replace("avg_", "");
        Object value = row.get("avg_" + key);
        if (value == null) {
            value = row.get(key);
        }
        return Optional.ofNullable(value);
    }

    public Map<String, Map<String, Object>> asMap() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineTable that))
            return false;
        return rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "BaselineTable" + rows.keySet();
    }
}
