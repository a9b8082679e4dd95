package com.metricsentinel.core.model;

import com.metricsentinel.core.error.InvalidInputException;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Named, immutable sequence of {@link TimeSeriesPoint}s for one source and
 * one {@link MetricKind}.
 *
 * <p>
 * Points are strictly ascending by timestamp. Gaps are allowed and mean
 * <em>missing</em> data: nothing in the engine zero-fills them.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String source;
    private final MetricKind metricKind;
    private final List<TimeSeriesPoint> points;

    /**
     * @param name       display name of the series
     * @param source     source identifier (service name, log group, ...)
     * @param metricKind kind of metric
     * @param points     observations, ascending by timestamp
     * @throws NullPointerException  if any argument is {@code null}
     * @throws InvalidInputException if timestamps are out of order or
     *                               duplicated
     */
    public TimeSeries(String name, String source, MetricKind metricKind, List<TimeSeriesPoint> points) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.metricKind = Objects.requireNonNull(metricKind, "metricKind must not be null");
        Objects.requireNonNull(points, "points must not be null");

        Instant previous = null;
        for (TimeSeriesPoint point : points) {
            Objects.requireNonNull(point, "points must not contain null");
            if (previous != null && !point.getTimestamp().isAfter(previous)) {
                throw new InvalidInputException("Series '" + name + "' is not strictly ascending: "
                        + point.getTimestamp() + " follows " + previous);
            }
            previous = point.getTimestamp();
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    /**
     * Convenience factory naming the series after its source and kind.
     */
    public static TimeSeries of(String source, MetricKind metricKind, List<TimeSeriesPoint> points) {
        return new TimeSeries(source + "/" + metricKind.label(), source, metricKind, points);
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    public MetricKind getMetricKind() {
        return metricKind;
    }

    /**
     * @return unmodifiable list of points
     */
    public List<TimeSeriesPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return a fresh array of the values in timestamp order
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    /**
     * @return unmodifiable list of the timestamps in order
     */
    public List<Instant> timestamps() {
        return points.stream().map(TimeSeriesPoint::getTimestamp).toList();
    }

    /**
     * Sub-series by index range, same name, source and kind.
     *
     * @param fromIndex inclusive start
     * @param toIndex   exclusive end
     * @return new series over {@code points[fromIndex, toIndex)}
     */
    public TimeSeries slice(int fromIndex, int toIndex) {
        return new TimeSeries(name, source, metricKind, points.subList(fromIndex, toIndex));
    }

    /**
     * Roll the series up into fixed-width buckets aligned to the epoch,
     * summing the values that fall into each bucket.
     *
     * <p>
     * Each bucket is stamped with its start instant. Buckets with no points are
     * omitted, so gaps stay gaps.
     * </p>
     *
     * @param bucket bucket width; must be positive
     * @return bucketed series
     * @throws InvalidInputException if {@code bucket} is not positive
     */
    public TimeSeries bucketSum(Duration bucket) {
        Objects.requireNonNull(bucket, "bucket must not be null");
        if (bucket.isZero() || bucket.isNegative()) {
            throw new InvalidInputException("bucket must be positive, got: " + bucket);
        }
        long width = bucket.toMillis();
        List<TimeSeriesPoint> rolled = new ArrayList<>();
        long currentStart = Long.MIN_VALUE;
        double sum = 0;
        for (TimeSeriesPoint point : points) {
            long start = Math.floorDiv(point.getTimestamp().toEpochMilli(), width) * width;
            if (start != currentStart) {
                if (currentStart != Long.MIN_VALUE) {
                    rolled.add(new TimeSeriesPoint(Instant.ofEpochMilli(currentStart), sum));
                }
                currentStart = start;
                sum = 0;
            }
            sum += point.getValue();
        }
        if (currentStart != Long.MIN_VALUE) {
            rolled.add(new TimeSeriesPoint(Instant.ofEpochMilli(currentStart), sum));
        }
        return new TimeSeries(name, source, metricKind, rolled);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return name.equals(that.name)
                && source.equals(that.source)
                && metricKind == that.metricKind
                && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, source, metricKind, points);
    }

    @Override
    public String toString() {
        return "TimeSeries{" +
                "name='" + name + '\'' +
                ", source='" + source + '\'' +
                ", metricKind=" + metricKind +
                ", points=" + points.size() +
                '}';
    }
}
