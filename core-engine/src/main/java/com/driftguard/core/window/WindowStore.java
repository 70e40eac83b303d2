package com.driftguard.core.window;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keyed, bounded history buffers of recent metric values.
 *
 * <p>
 * Each key (callers compose {@code field + "_" + detector}) owns its own FIFO
 * window of at most {@code capacity} values. A window is created empty on the
 * first observation of its key; once full, every insertion evicts the oldest
 * value.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Instances are owned by a single monitoring session and are never shared
 * between streams. Not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowStore implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Default window capacity. */
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Map<String, Deque<Double>> windows = new HashMap<>();

    public WindowStore() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of values kept per key
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public WindowStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append a value to the window of {@code key} and return the window
     * contents, oldest first, including the new value.
     *
     * @param key   window key; must not be {@code null}
     * @param value observed value
     * @return unmodifiable snapshot of the window after insertion
     */
    public List<Double> observe(String key, double value) {
        Objects.requireNonNull(key, "Window key must not be null");
        Deque<Double> window = windows.computeIfAbsent(key, k -> new ArrayDeque<>());
        window.addLast(value);
        while (window.size() > capacity) {
            window.pollFirst();
        }
        return List.copyOf(window);
    }

    /**
     * Return the current contents of a window without modifying it.
     *
     * @param key window key
     * @return unmodifiable snapshot, empty for an unseen key
     */
    public List<Double> values(String key) {
        Deque<Double> window = windows.get(key);
        return window == null ? Collections.emptyList() : List.copyOf(window);
    }

    public int size(String key) {
        Deque<Double> window = windows.get(key);
        return window == null ? 0 : window.size();
    }

    public int keyCount() {
        return windows.size();
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "WindowStore{capacity=" + capacity + ", keys=" + windows.keySet() + '}';
    }
}
