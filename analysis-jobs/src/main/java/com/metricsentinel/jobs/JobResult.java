package com.metricsentinel.jobs;

import com.metricsentinel.core.model.AnomalyRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary of one job run: a {@link SourceReport} per source, in configured
 * source order.
 *
 * @since 1.0.0
 */
public final class JobResult {

    private final String jobName;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final List<SourceReport> reports;
    private final boolean cancelled;

    public JobResult(String jobName, Instant startedAt, Instant finishedAt, List<SourceReport> reports,
            boolean cancelled) {
        this.jobName = Objects.requireNonNull(jobName, "jobName must not be null");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        this.reports = List.copyOf(reports);
        this.cancelled = cancelled;
    }

    public String getJobName() {
        return jobName;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getElapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public List<SourceReport> getReports() {
        return reports;
    }

    /**
     * @return {@code true} if the run was interrupted before every source
     *         finished; the reports then cover only the finished sources
     */
    public boolean isCancelled() {
        return cancelled;
    }

    public Optional<SourceReport> getReport(String source) {
        return reports.stream().filter(r -> r.getSource().equals(source)).findFirst();
    }

    /**
     * @return every anomaly produced in this run, in source order
     */
    public List<AnomalyRecord> getAnomalies() {
        return reports.stream().flatMap(r -> r.getAnomalies().stream()).toList();
    }

    public List<SourceReport> getReports(SourceStatus status) {
        return reports.stream().filter(r -> r.getStatus() == status).toList();
    }

    public int getDispatchFailures() {
        return reports.stream().mapToInt(SourceReport::getDispatchFailures).sum();
    }

    @Override
    public String toString() {
        return "JobResult{" +
                "jobName='" + jobName + '\'' +
                ", sources=" + reports.size() +
                ", anomalies=" + getAnomalies().size() +
                ", failed=" + getReports(SourceStatus.FAILED).size() +
                ", dispatchFailures=" + getDispatchFailures() +
                ", cancelled=" + cancelled +
                ", elapsed=" + getElapsed() +
                '}';
    }
}
