package com.metricsentinel.jobs.query;

import com.metricsentinel.core.error.CollaboratorException;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * A metrics store whose queries run asynchronously: a query is started, its
 * results are fetched once it has completed, and it can be cancelled while
 * still running.
 *
 * @since 1.0.0
 */
public interface AsyncQueryBackend {

    /**
     * Start a query.
     *
     * @return an identifier for the running query
     * @throws CollaboratorException if the query cannot be started
     */
    String startQuery(String source, MetricKind metricKind, Instant start, Instant end, Duration resolution);

    /**
     * Fetch the results of a started query.
     *
     * @param queryId identifier returned by {@link #startQuery}
     * @return the series once the query has completed, empty while it is
     *         still running
     * @throws CollaboratorException if the query failed or was cancelled
     */
    Optional<TimeSeries> fetchResults(String queryId);

    /**
     * Stop a running query. Called at most once, after which the id is not
     * used again.
     */
    void cancelQuery(String queryId);
}
