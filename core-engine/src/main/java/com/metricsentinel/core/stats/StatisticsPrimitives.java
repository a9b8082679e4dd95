package com.metricsentinel.core.stats;

import com.metricsentinel.core.error.InvalidInputException;
import com.metricsentinel.core.model.PercentileSet;
import com.metricsentinel.core.model.ThresholdResult;
import com.metricsentinel.core.model.TrendDirection;
import com.metricsentinel.core.model.TrendResult;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pure numeric functions behind every detector: baseline thresholds,
 * half-window trend comparison and percentile interpolation.
 *
 * <p>
 * None of these methods throws for "not enough data"; each returns a defined
 * default instead. {@link InvalidInputException} is reserved for arguments
 * that make no sense at all.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticsPrimitives {

    /** Half-window change, in percent, above which a trend is not stable. */
    public static final double TREND_CHANGE_PERCENT = 10.0;

    private static final double[] PERCENTILES = { 50, 90, 95, 99 };

    private StatisticsPrimitives() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Thresholds
    // ---------------------------------------------------------------

    /**
     * Compute {@code mean + sensitivity × stddev} over a baseline window.
     *
     * @param baseline    historical values, excluding the point under test
     * @param sensitivity number of standard deviations; must be finite and
     *                    {@code >= 0}
     * @return the threshold, or {@link ThresholdResult#insufficient(double)}
     *         when the baseline holds fewer than two values
     * @throws InvalidInputException if {@code sensitivity} is negative or not
     *                               finite
     */
    public static ThresholdResult computeThreshold(double[] baseline, double sensitivity) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        requireValidSensitivity(sensitivity);

        if (baseline.length < 2) {
            return ThresholdResult.insufficient(sensitivity);
        }
        double mean = mean(baseline);
        return ThresholdResult.of(mean, sampleStdDev(baseline, mean), sensitivity);
    }

    /**
     * @throws InvalidInputException if {@code sensitivity} is negative or not
     *                               finite
     */
    public static void requireValidSensitivity(double sensitivity) {
        if (!Double.isFinite(sensitivity) || sensitivity < 0) {
            throw new InvalidInputException("sensitivity must be a finite value >= 0, got: " + sensitivity);
        }
    }

    // ---------------------------------------------------------------
    // Trend
    // ---------------------------------------------------------------

    /**
     * Compare the average of the last {@code windowSize} values with the
     * average of the window before it.
     *
     * <p>
     * The older window is the {@code windowSize} values immediately before the
     * recent one, or every preceding value when fewer exist. Fewer than
     * {@code windowSize} values, or no older window at all, is classified
     * {@link TrendDirection#STABLE}. An older average of zero counts as 0 %
     * change.
     * </p>
     *
     * @param values     chronologically ordered values
     * @param windowSize size of the recent window; must be {@code >= 1}
     * @return the classification and percentage change
     * @throws InvalidInputException if {@code windowSize < 1}
     */
    public static TrendResult detectTrend(double[] values, int windowSize) {
        Objects.requireNonNull(values, "values must not be null");
        if (windowSize < 1) {
            throw new InvalidInputException("windowSize must be >= 1, got: " + windowSize);
        }

        int n = values.length;
        if (n < windowSize) {
            return TrendResult.STABLE_NO_DATA;
        }
        int recentStart = n - windowSize;
        int olderStart = Math.max(0, recentStart - windowSize);
        if (recentStart == olderStart) {
            return TrendResult.STABLE_NO_DATA;
        }

        double recentAvg = mean(Arrays.copyOfRange(values, recentStart, n));
        double olderAvg = mean(Arrays.copyOfRange(values, olderStart, recentStart));
        double change = olderAvg != 0 ? (recentAvg - olderAvg) / olderAvg * 100 : 0.0;

        if (change > TREND_CHANGE_PERCENT) {
            return new TrendResult(TrendDirection.INCREASING, change);
        }
        if (change < -TREND_CHANGE_PERCENT) {
            return new TrendResult(TrendDirection.DECREASING, change);
        }
        return new TrendResult(TrendDirection.STABLE, change);
    }

    // ---------------------------------------------------------------
    // Percentiles
    // ---------------------------------------------------------------

    /**
     * Compute p50, p90, p95 and p99 by linear interpolation over a sorted copy
     * of {@code values}.
     *
     * @param values input values, in any order; not modified
     * @return the percentile set, empty for empty input
     */
    public static PercentileSet computePercentiles(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            return PercentileSet.empty();
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        Map<String, Double> result = new LinkedHashMap<>();
        for (double p : PERCENTILES) {
            result.put("p" + (int) p, percentile(sorted, p));
        }
        return new PercentileSet(result);
    }

    /**
     * Single percentile over an already sorted array.
     *
     * @param sorted     ascending values; must not be empty
     * @param percentile in {@code [0, 100]}
     * @return interpolated value
     * @throws InvalidInputException if {@code sorted} is empty or the
     *                               percentile is out of range
     */
    public static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 0) {
            throw new InvalidInputException("cannot take a percentile of no values");
        }
        if (percentile < 0 || percentile > 100) {
            throw new InvalidInputException("percentile must be in [0, 100], got: " + percentile);
        }
        double rank = percentile / 100 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        if (rank == lower) {
            return sorted[lower];
        }
        int upper = lower + 1;
        if (upper >= sorted.length) {
            return sorted[sorted.length - 1];
        }
        double weight = rank - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    // ---------------------------------------------------------------
    // Moments
    // ---------------------------------------------------------------

    /**
     * @return arithmetic mean, or 0 for an empty array
     */
    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (Bessel's correction, divides by n − 1).
     *
     * @return the standard deviation, or 0 for fewer than two values
     */
    public static double sampleStdDev(double[] values, double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.length - 1));
    }

    /**
     * {@code stddev / mean}, with a zero mean giving a CV of zero.
     */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (mean == 0) {
            return 0.0;
        }
        return sampleStdDev(values, mean) / mean;
    }
}
