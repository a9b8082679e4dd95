package com.metricsentinel.jobs;

import com.metricsentinel.core.error.CollaboratorException;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * What a job sees while analysing one source: the source name, the run's
 * {@link JobContext}, and a metrics query bounded by the run's timeout.
 *
 * @since 1.0.0
 */
public final class SourceContext {

    private final String source;
    private final JobContext jobContext;
    private final MetricsQueryClient queryClient;
    private final ExecutorService queryExecutor;

    SourceContext(String source, JobContext jobContext, MetricsQueryClient queryClient,
            ExecutorService queryExecutor) {
        this.source = source;
        this.jobContext = jobContext;
        this.queryClient = queryClient;
        this.queryExecutor = queryExecutor;
    }

    public String getSource() {
        return source;
    }

    public Instant getEvaluationTime() {
        return jobContext.getEvaluationTime();
    }

    /**
     * Query this source, giving up after the run's query timeout.
     *
     * @return the series returned by the collaborator
     * @throws CollaboratorException if the query fails, times out, returns
     *                               nothing or is interrupted
     */
    public TimeSeries query(MetricKind metricKind, Instant start, Instant end, Duration resolution) {
        Duration timeout = jobContext.getQueryTimeout();
        Future<TimeSeries> future = queryExecutor.submit(
                () -> queryClient.query(source, metricKind, start, end, resolution));
        try {
            TimeSeries series = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (series == null) {
                throw new CollaboratorException("Metrics query for " + source + "/" + metricKind.label()
                        + " returned no series");
            }
            return series;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorException("Metrics query for " + source + "/" + metricKind.label()
                    + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CollaboratorException ce) {
                throw ce;
            }
            throw new CollaboratorException("Metrics query for " + source + "/" + metricKind.label()
                    + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Interrupted while querying " + source, e);
        }
    }

    @Override
    public String toString() {
        return "SourceContext{source='" + source + "', " + jobContext + '}';
    }
}
