package com.metricsentinel.jobs;

import com.metricsentinel.core.detection.AnomalyDetector;
import com.metricsentinel.core.error.CollaboratorException;
import com.metricsentinel.core.model.AnomalyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared run loop for the domain jobs.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Sources share no mutable state, so each run analyses them in parallel on a
 * fixed pool of {@code min(sources, maxWorkers)} threads. Metrics queries run
 * on a separate per-run pool so they can be abandoned when they exceed the
 * caller's timeout. Both pools are shut down when the run ends.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A failing source is reported as {@link SourceStatus#FAILED} and never stops
 * the other sources. Dispatch failures are logged and counted; records are
 * not re-sent.
 * </p>
 *
 * <h3>Cancellation</h3>
 * <p>
 * Interrupting the thread that called {@link #run(JobContext)} stops the run:
 * outstanding work is cancelled and the partial result is flagged
 * {@link JobResult#isCancelled() cancelled}.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractAnalysisJob implements AnalysisJob {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractAnalysisJob.class);

    /** Default cap on concurrently analysed sources. */
    public static final int DEFAULT_MAX_WORKERS = 8;

    private final String name;
    private final List<String> sources;
    private final MetricsQueryClient queryClient;
    private final AlertDispatcher dispatcher;
    private final int maxWorkers;

    protected final AnomalyDetector detector;

    protected AbstractAnalysisJob(String name, List<String> sources, MetricsQueryClient queryClient,
            AlertDispatcher dispatcher, AnomalyDetector detector, int maxWorkers) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources must not be null"));
        this.queryClient = Objects.requireNonNull(queryClient, "queryClient must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got: " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
    }

    /**
     * Analyse one source. Called concurrently for different sources.
     *
     * @param context source name, evaluation time and bounded queries
     * @return the report; anomalies in it are dispatched by the caller
     * @throws CollaboratorException if a query fails; the source is then
     *                               reported as failed
     */
    protected abstract SourceReport analyzeSource(SourceContext context);

    @Override
    public String getName() {
        return name;
    }

    public List<String> getSources() {
        return sources;
    }

    @Override
    public final JobResult run(JobContext context) {
        Objects.requireNonNull(context, "JobContext must not be null");
        Instant startedAt = Instant.now();

        if (sources.isEmpty()) {
            LOG.warn("[{}] No sources configured – nothing to analyse", name);
            return new JobResult(name, startedAt, Instant.now(), List.of(), false);
        }

        int poolSize = Math.min(sources.size(), maxWorkers);
        LOG.info("[{}] Run started at {} for {} source(s) on {} worker(s)",
                name, context.getEvaluationTime(), sources.size(), poolSize);

        ExecutorService workers = Executors.newFixedThreadPool(poolSize, daemonThreads(name + "-worker"));
        ExecutorService queries = Executors.newCachedThreadPool(daemonThreads(name + "-query"));
        Map<String, Future<SourceReport>> pending = new LinkedHashMap<>();
        List<SourceReport> reports = new ArrayList<>();
        boolean cancelled = false;

        try {
            for (String source : sources) {
                SourceContext sourceContext = new SourceContext(source, context, queryClient, queries);
                pending.put(source, workers.submit(() -> analyzeAndDispatch(sourceContext)));
            }
            for (Map.Entry<String, Future<SourceReport>> entry : pending.entrySet()) {
                reports.add(await(entry.getKey(), entry.getValue()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
            LOG.warn("[{}] Run cancelled after {} of {} source(s)", name, reports.size(), sources.size());
        } finally {
            workers.shutdownNow();
            queries.shutdownNow();
        }

        JobResult result = new JobResult(name, startedAt, Instant.now(), reports, cancelled);
        LOG.info("[{}] Run finished: {}", name, result);
        return result;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private SourceReport await(String source, Future<SourceReport> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            LOG.error("[{}] Source [{}] aborted unexpectedly", name, source, e.getCause());
            return SourceReport.failed(source, String.valueOf(e.getCause()));
        }
    }

    private SourceReport analyzeAndDispatch(SourceContext context) {
        String source = context.getSource();
        SourceReport report;
        try {
            report = analyzeSource(context);
        } catch (CollaboratorException e) {
            LOG.warn("[{}] Skipping source [{}]: {}", name, source, e.getMessage());
            return SourceReport.failed(source, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("[{}] Analysis of source [{}] failed – continuing with remaining sources",
                    name, source, e);
            return SourceReport.failed(source, e.toString());
        }

        if (report.getStatus() == SourceStatus.INSUFFICIENT_DATA) {
            LOG.info("[{}] Source [{}]: {}", name, source, report.getMessage().orElse("insufficient data"));
            return report;
        }

        int failures = 0;
        for (AnomalyRecord record : report.getAnomalies()) {
            try {
                dispatcher.dispatch(record);
                LOG.info("[{}] Anomaly dispatched: check={} source={} kind={} severity={}",
                        name, record.getCheckName(), source, record.getKind(), record.getSeverity());
            } catch (RuntimeException e) {
                failures++;
                LOG.warn("[{}] Dispatch failed for {} – not retried: {}", name, record, e.getMessage());
            }
        }
        return failures == 0 ? report : report.withDispatchFailures(failures);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
