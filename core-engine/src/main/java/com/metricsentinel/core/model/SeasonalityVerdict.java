package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Outcome of the hour-of-day seasonality heuristic, with the per-hour
 * coefficient of variation that supports it.
 *
 * @since 1.0.0
 */
public final class SeasonalityVerdict implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final SeasonalityVerdict NOT_SEASONAL = new SeasonalityVerdict(false, Map.of());

    private final boolean seasonal;
    private final Map<Integer, Double> hourlyCoefficientOfVariation;

    public SeasonalityVerdict(boolean seasonal, Map<Integer, Double> hourlyCoefficientOfVariation) {
        Objects.requireNonNull(hourlyCoefficientOfVariation, "hourlyCoefficientOfVariation must not be null");
        this.seasonal = seasonal;
        this.hourlyCoefficientOfVariation = Collections.unmodifiableMap(
                new TreeMap<>(hourlyCoefficientOfVariation));
    }

    /**
     * Verdict used when there is too little data to assert anything.
     */
    public static SeasonalityVerdict notSeasonal() {
        return NOT_SEASONAL;
    }

    public boolean isSeasonal() {
        return seasonal;
    }

    /**
     * @return hour of day (0-23, UTC) to CV, for buckets with at least two
     *         samples; ordered by hour
     */
    public Map<Integer, Double> getHourlyCoefficientOfVariation() {
        return hourlyCoefficientOfVariation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalityVerdict that))
            return false;
        return seasonal == that.seasonal
                && hourlyCoefficientOfVariation.equals(that.hourlyCoefficientOfVariation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seasonal, hourlyCoefficientOfVariation);
    }

    @Override
    public String toString() {
        return "SeasonalityVerdict{seasonal=" + seasonal
                + ", buckets=" + hourlyCoefficientOfVariation.size() + '}';
    }
}
