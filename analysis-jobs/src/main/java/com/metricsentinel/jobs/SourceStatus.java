package com.metricsentinel.jobs;

/**
 * Outcome of analysing one source in a run.
 *
 * @since 1.0.0
 */
public enum SourceStatus {

    /** At least one check ran. */
    ANALYZED,

    /** Too little data for any check; not a failure. */
    INSUFFICIENT_DATA,

    /** A collaborator failed or timed out; the source was skipped. */
    FAILED
}
