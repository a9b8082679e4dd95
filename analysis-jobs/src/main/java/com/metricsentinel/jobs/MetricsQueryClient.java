package com.metricsentinel.jobs;

import com.metricsentinel.core.error.CollaboratorException;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;

/**
 * Source of time-series data for the analysis jobs.
 *
 * <p>
 * Implementations return points ascending by timestamp and signal gaps by
 * omitting points, never by zero-filling them. Any exception thrown here
 * causes the job to skip the affected source and continue with the others.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MetricsQueryClient {

    /**
     * Fetch one metric for one source.
     *
     * @param source     service name, log group, ...
     * @param metricKind metric to fetch
     * @param start      inclusive start of the window
     * @param end        exclusive end of the window
     * @param resolution requested bucket width
     * @return the series; never {@code null}
     * @throws CollaboratorException if the query fails
     */
    TimeSeries query(String source, MetricKind metricKind, Instant start, Instant end, Duration resolution);
}
