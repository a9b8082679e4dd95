package com.metricsentinel.core.stats;

import com.metricsentinel.core.error.InvalidInputException;
import com.metricsentinel.core.model.SeasonalityVerdict;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Hour-of-day seasonality gate.
 *
 * <p>
 * Values are grouped by UTC hour of day. A series is seasonal when at least
 * {@value #MIN_POPULATED_BUCKETS} hour buckets have a coefficient of variation
 * and at least 60 % of those have a CV below {@value #MAX_BUCKET_CV}: the same
 * hour looks alike from one period to the next.
 * </p>
 *
 * <p>
 * This is a heuristic, not a statistical test. Noisy series that are
 * genuinely periodic will often be reported as not seasonal.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalityAnalyzer {

    static final int MIN_POPULATED_BUCKETS = 12;
    static final double MAX_BUCKET_CV = 0.5;
    static final double MIN_CONSISTENT_SHARE = 0.6;

    private SeasonalityAnalyzer() {
        // utility class, not instantiable
    }

    /**
     * @see #analyze(double[], List, int)
     */
    public static boolean isSeasonal(double[] values, List<Instant> timestamps, int periodHours) {
        return analyze(values, timestamps, periodHours).isSeasonal();
    }

    /**
     * Run the seasonality heuristic.
     *
     * @param values      observed values
     * @param timestamps  timestamp of each value, same length as {@code values}
     * @param periodHours expected period; at least two periods of observations
     *                    are needed
     * @return the verdict; not seasonal when there are fewer than
     *         {@code 2 × periodHours} observations
     * @throws InvalidInputException if the lengths differ or
     *                               {@code periodHours < 1}
     */
    public static SeasonalityVerdict analyze(double[] values, List<Instant> timestamps, int periodHours) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        if (values.length != timestamps.size()) {
            throw new InvalidInputException("values and timestamps differ in length: "
                    + values.length + " vs " + timestamps.size());
        }
        if (periodHours < 1) {
            throw new InvalidInputException("periodHours must be >= 1, got: " + periodHours);
        }
        if (values.length < 2 * periodHours) {
            return SeasonalityVerdict.notSeasonal();
        }

        Map<Integer, List<Double>> buckets = new TreeMap<>();
        for (int i = 0; i < values.length; i++) {
            int hour = hourOfDay(timestamps.get(i));
            buckets.computeIfAbsent(hour, h -> new ArrayList<>()).add(values[i]);
        }

        Map<Integer, Double> hourlyCv = new TreeMap<>();
        for (Map.Entry<Integer, List<Double>> bucket : buckets.entrySet()) {
            if (bucket.getValue().size() > 1) {
                double[] samples = bucket.getValue().stream().mapToDouble(Double::doubleValue).toArray();
                hourlyCv.put(bucket.getKey(), StatisticsPrimitives.coefficientOfVariation(samples));
            }
        }

        boolean seasonal = false;
        if (hourlyCv.size() >= MIN_POPULATED_BUCKETS) {
            long consistent = hourlyCv.values().stream().filter(cv -> cv < MAX_BUCKET_CV).count();
            seasonal = (double) consistent / hourlyCv.size() >= MIN_CONSISTENT_SHARE;
        }
        return new SeasonalityVerdict(seasonal, hourlyCv);
    }

    /**
     * @return UTC hour of day, 0-23
     */
    public static int hourOfDay(Instant timestamp) {
        return timestamp.atZone(ZoneOffset.UTC).getHour();
    }
}
