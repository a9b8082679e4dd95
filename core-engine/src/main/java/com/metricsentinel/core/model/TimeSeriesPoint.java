package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single timestamped observation.
 *
 * @since 1.0.0
 */
public final class TimeSeriesPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    /**
     * @param timestamp observation time; must not be {@code null}
     * @param value     observed value
     * @throws NullPointerException if {@code timestamp} is {@code null}
     */
    public TimeSeriesPoint(Instant timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "(" + timestamp + ", " + value + ")";
    }
}
