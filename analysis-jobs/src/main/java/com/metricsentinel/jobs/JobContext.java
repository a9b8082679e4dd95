package com.metricsentinel.jobs;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-run inputs supplied by the scheduler: the instant the run evaluates and
 * the timeout applied to every metrics query.
 *
 * @since 1.0.0
 */
public final class JobContext {

    private final Instant evaluationTime;
    private final Duration queryTimeout;

    private JobContext(Instant evaluationTime, Duration queryTimeout) {
        this.evaluationTime = Objects.requireNonNull(evaluationTime, "evaluationTime must not be null");
        this.queryTimeout = Objects.requireNonNull(queryTimeout, "queryTimeout must not be null");
        if (queryTimeout.isZero() || queryTimeout.isNegative()) {
            throw new IllegalArgumentException("queryTimeout must be positive, got: " + queryTimeout);
        }
    }

    public static JobContext at(Instant evaluationTime, Duration queryTimeout) {
        return new JobContext(evaluationTime, queryTimeout);
    }

    public static JobContext now(Duration queryTimeout) {
        return new JobContext(Instant.now(), queryTimeout);
    }

    public Instant getEvaluationTime() {
        return evaluationTime;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    @Override
    public String toString() {
        return "JobContext{evaluationTime=" + evaluationTime + ", queryTimeout=" + queryTimeout + '}';
    }
}
