package com.metricsentinel.jobs;

import com.metricsentinel.core.model.AnomalyRecord;
import com.metricsentinel.core.model.PercentileSet;
import com.metricsentinel.core.model.TrendResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of analysing a single source during one run.
 *
 * <p>
 * Trends and percentiles are keyed by check name ({@code daily_cost},
 * {@code error_count}, {@code log_volume}).
 * </p>
 *
 * @since 1.0.0
 */
public final class SourceReport {

    private final String source;
    private final SourceStatus status;
    private final List<AnomalyRecord> anomalies;
    private final Map<String, TrendResult> trends;
    private final Map<String, PercentileSet> percentiles;
    private final int dispatchFailures;
    private final String message;

    private SourceReport(String source, SourceStatus status, List<AnomalyRecord> anomalies,
            Map<String, TrendResult> trends, Map<String, PercentileSet> percentiles,
            int dispatchFailures, String message) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.anomalies = List.copyOf(anomalies);
        this.trends = Collections.unmodifiableMap(new LinkedHashMap<>(trends));
        this.percentiles = Collections.unmodifiableMap(new LinkedHashMap<>(percentiles));
        this.dispatchFailures = dispatchFailures;
        this.message = message;
    }

    public static SourceReport analyzed(String source, List<AnomalyRecord> anomalies,
            Map<String, TrendResult> trends, Map<String, PercentileSet> percentiles) {
        return new SourceReport(source, SourceStatus.ANALYZED, anomalies, trends, percentiles, 0, null);
    }

    public static SourceReport insufficientData(String source, String message) {
        return new SourceReport(source, SourceStatus.INSUFFICIENT_DATA, List.of(), Map.of(), Map.of(), 0,
                message);
    }

    public static SourceReport failed(String source, String message) {
        return new SourceReport(source, SourceStatus.FAILED, List.of(), Map.of(), Map.of(), 0, message);
    }

    SourceReport withDispatchFailures(int failures) {
        return new SourceReport(source, status, anomalies, trends, percentiles, failures, message);
    }

    public String getSource() {
        return source;
    }

    public SourceStatus getStatus() {
        return status;
    }

    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }

    public Map<String, TrendResult> getTrends() {
        return trends;
    }

    public Optional<TrendResult> getTrend(String checkName) {
        return Optional.ofNullable(trends.get(checkName));
    }

    public Map<String, PercentileSet> getPercentiles() {
        return percentiles;
    }

    public Optional<PercentileSet> getPercentiles(String checkName) {
        return Optional.ofNullable(percentiles.get(checkName));
    }

    public int getDispatchFailures() {
        return dispatchFailures;
    }

    /**
     * @return why the source was skipped, or empty for analysed sources
     */
    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return "SourceReport{" +
                "source='" + source + '\'' +
                ", status=" + status +
                ", anomalies=" + anomalies.size() +
                ", trends=" + trends +
                ", dispatchFailures=" + dispatchFailures +
                (message != null ? ", message='" + message + '\'' : "") +
                '}';
    }
}
