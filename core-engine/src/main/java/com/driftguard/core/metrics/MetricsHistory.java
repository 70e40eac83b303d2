package com.driftguard.core.metrics;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolling list of per-record metric snapshots used for trend metrics.
 *
 * <p>
 * Keeps the last {@value #DEFAULT_CAPACITY} entries by default, oldest first.
 * Not thread-safe; owned by a single monitoring session.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsHistory implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final ArrayDeque<Map<String, Double>> entries = new ArrayDeque<>();

    public MetricsHistory() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of retained entries; must be at least 1
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public MetricsHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append a snapshot, evicting the oldest one at capacity.
     *
     * @param metrics metric values by name; copied
     */
    public void add(Map<String, Double> metrics) {
        Objects.requireNonNull(metrics, "metrics must not be null");
        entries.addLast(new LinkedHashMap<>(metrics));
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * @return unmodifiable snapshot of the entries, oldest first
     */
    public List<Map<String, Double>> entries() {
        List<Map<String, Double>> copy = new ArrayList<>(entries.size());
        entries.forEach(e -> copy.add(Collections.unmodifiableMap(e)));
        return Collections.unmodifiableList(copy);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "MetricsHistory{size=" + entries.size() + ", capacity=" + capacity + '}';
    }
}
