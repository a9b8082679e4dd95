package com.metricsentinel.core.model;

import java.util.Locale;

/**
 * Kind of metric carried by a {@link TimeSeries}.
 *
 * @since 1.0.0
 */
public enum MetricKind {

    /** Daily spend for a service. */
    COST,

    /** Error events counted per bucket for a log source. */
    ERROR_COUNT,

    /** Total events counted per bucket for a log source. */
    LOG_VOLUME,

    /** Resource utilization percentage. */
    CPU_PERCENT;

    /**
     * @return lowercase label used in alerts and logs, e.g. {@code error_count}
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
