package com.metricsentinel.jobs.query;

import com.metricsentinel.core.error.CollaboratorException;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.TimeSeries;
import com.metricsentinel.jobs.EngineConfig;
import com.metricsentinel.jobs.MetricsQueryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link MetricsQueryClient} over an {@link AsyncQueryBackend}.
 *
 * <p>
 * Starts the query, then polls for results with exponential backoff
 * (doubling from the initial delay up to the maximum) until they arrive or
 * the timeout passes. On timeout or interruption the backend query is
 * cancelled and a {@link CollaboratorException} is thrown.
 * </p>
 *
 * @since 1.0.0
 */
public class PollingMetricsQueryClient implements MetricsQueryClient {

    private static final Logger LOG = LoggerFactory.getLogger(PollingMetricsQueryClient.class);

    private final AsyncQueryBackend backend;
    private final Duration timeout;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public PollingMetricsQueryClient(AsyncQueryBackend backend, Duration timeout, Duration initialBackoff,
            Duration maxBackoff) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.timeout = requirePositive(timeout, "timeout");
        this.initialBackoff = requirePositive(initialBackoff, "initialBackoff");
        this.maxBackoff = requirePositive(maxBackoff, "maxBackoff");
        if (initialBackoff.compareTo(maxBackoff) > 0) {
            throw new IllegalArgumentException("initialBackoff must not exceed maxBackoff");
        }
    }

    /**
     * Client using the engine's query timeout and poll backoff settings.
     */
    public static PollingMetricsQueryClient create(AsyncQueryBackend backend, EngineConfig config) {
        return new PollingMetricsQueryClient(backend, config.getQueryTimeout(),
                config.getPollInitialBackoff(), config.getPollMaxBackoff());
    }

    @Override
    public TimeSeries query(String source, MetricKind metricKind, Instant start, Instant end, Duration resolution) {
        String queryId = backend.startQuery(source, metricKind, start, end, resolution);
        LOG.debug("Started query {} for {}/{} [{}, {})", queryId, source, metricKind.label(), start, end);

        long deadline = System.nanoTime() + timeout.toNanos();
        long backoffMs = initialBackoff.toMillis();
        int polls = 0;
        try {
            while (true) {
                polls++;
                Optional<TimeSeries> result = backend.fetchResults(queryId);
                if (result.isPresent()) {
                    LOG.debug("Query {} completed after {} poll(s)", queryId, polls);
                    return result.get();
                }
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    cancelQuietly(queryId);
                    throw new CollaboratorException("Query " + queryId + " for " + source + "/"
                            + metricKind.label() + " did not complete within " + timeout.toMillis()
                            + " ms (" + polls + " poll(s))");
                }
                Thread.sleep(Math.min(backoffMs, remainingMs));
                backoffMs = Math.min(backoffMs * 2, maxBackoff.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelQuietly(queryId);
            throw new CollaboratorException("Interrupted while waiting for query " + queryId, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void cancelQuietly(String queryId) {
        try {
            backend.cancelQuery(queryId);
        } catch (RuntimeException e) {
            LOG.warn("Failed to cancel query {}: {}", queryId, e.getMessage());
        }
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }
}
