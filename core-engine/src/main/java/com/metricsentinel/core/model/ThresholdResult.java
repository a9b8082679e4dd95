package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Baseline statistics and the anomaly threshold derived from them.
 *
 * <p>
 * {@code threshold = mean + sensitivity × stddev}, computed only from a
 * baseline window that never contains the point under test. A baseline with
 * fewer than two values yields {@link #insufficient(double)}: every number is
 * zero and {@link #isSufficient()} is {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mean;
    private final double stddev;
    private final double threshold;
    private final double sensitivity;
    private final boolean sufficient;

    private ThresholdResult(double mean, double stddev, double sensitivity, boolean sufficient) {
        this.mean = mean;
        this.stddev = stddev;
        this.sensitivity = sensitivity;
        this.threshold = sufficient ? mean + sensitivity * stddev : 0.0;
        this.sufficient = sufficient;
    }

    public static ThresholdResult of(double mean, double stddev, double sensitivity) {
        return new ThresholdResult(mean, stddev, sensitivity, true);
    }

    /**
     * Sentinel returned when the baseline is too small to judge anything.
     */
    public static ThresholdResult insufficient(double sensitivity) {
        return new ThresholdResult(0.0, 0.0, sensitivity, false);
    }

    public double getMean() {
        return mean;
    }

    public double getStddev() {
        return stddev;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public boolean isSufficient() {
        return sufficient;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdResult that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stddev, that.stddev) == 0
                && Double.compare(sensitivity, that.sensitivity) == 0
                && sufficient == that.sufficient;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stddev, sensitivity, sufficient);
    }

    @Override
    public String toString() {
        return sufficient
                ? String.format("ThresholdResult{mean=%.4f, stddev=%.4f, threshold=%.4f, sensitivity=%.2f}",
                        mean, stddev, threshold, sensitivity)
                : "ThresholdResult{insufficient data}";
    }
}
