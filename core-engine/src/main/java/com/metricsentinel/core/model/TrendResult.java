package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Trend classification plus the percentage change between the older and the
 * recent window averages.
 *
 * @since 1.0.0
 */
public final class TrendResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Shared result for "not enough data to tell". */
    public static final TrendResult STABLE_NO_DATA = new TrendResult(TrendDirection.STABLE, 0.0);

    private final TrendDirection direction;
    private final double changePercent;

    public TrendResult(TrendDirection direction, double changePercent) {
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.changePercent = changePercent;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public double getChangePercent() {
        return changePercent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendResult that))
            return false;
        return direction == that.direction && Double.compare(changePercent, that.changePercent) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, changePercent);
    }

    @Override
    public String toString() {
        return String.format("%s (%+.2f%%)", direction, changePercent);
    }
}
