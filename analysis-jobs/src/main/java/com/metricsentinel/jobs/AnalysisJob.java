package com.metricsentinel.jobs;

/**
 * Entry point invoked by the external scheduler on each tick.
 *
 * <p>
 * Jobs are passive: they never schedule themselves and keep no state between
 * runs.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnalysisJob {

    /**
     * Analyse every configured source once.
     *
     * @param context evaluation time and query timeout for this run
     * @return per-source outcome; never {@code null}
     */
    JobResult run(JobContext context);

    /**
     * @return unique job name used in logs and results
     */
    String getName();
}
