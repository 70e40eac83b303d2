package com.driftguard.core.reference;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from metric name to its {@link ThresholdRule}.
 *
 * @since 1.0.0
 */
public final class ThresholdTable implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final ThresholdTable EMPTY = new ThresholdTable(Map.of());

    private final Map<String, ThresholdRule> rules;

    /**
     * @param rules rules by metric name; copied defensively, order kept
     */
    public ThresholdTable(Map<String, ThresholdRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static ThresholdTable empty() {
        return EMPTY;
    }

    public Optional<ThresholdRule> find(String metricName) {
        return Optional.ofNullable(rules.get(metricName));
    }

    public Map<String, ThresholdRule> asMap() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdTable that))
            return false;
        return rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "ThresholdTable" + rules.keySet();
    }
}
