package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Percentile summary keyed by label ({@code p50}, {@code p90}, {@code p95},
 * {@code p99}), in ascending percentile order.
 *
 * @since 1.0.0
 */
public final class PercentileSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final PercentileSet EMPTY = new PercentileSet(Map.of());

    private final Map<String, Double> values;

    /**
     * @param values label to value; iteration order is preserved
     */
    public PercentileSet(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static PercentileSet empty() {
        return EMPTY;
    }

    /**
     * @param label percentile label, e.g. {@code p95}
     * @return the value, or empty when the label is absent
     */
    public OptionalDouble get(String label) {
        Double value = values.get(label);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * @return unmodifiable, ordered view of every percentile
     */
    public Map<String, Double> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PercentileSet that))
            return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "PercentileSet" + values;
    }
}
