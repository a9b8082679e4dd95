package com.metricsentinel.jobs;

import com.metricsentinel.core.config.LogJobSettings;
import com.metricsentinel.core.detection.AnomalyDetector;
import com.metricsentinel.core.detection.DetectionPolicy;
import com.metricsentinel.core.model.AnomalyRecord;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.PercentileSet;
import com.metricsentinel.core.model.TimeSeries;
import com.metricsentinel.core.model.TrendResult;
import com.metricsentinel.core.stats.StatisticsPrimitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hourly error-count and log-volume analysis per log group.
 *
 * <h3>Window</h3>
 * <p>
 * The current hour is the last complete hour before the evaluation time. Both
 * series are queried over the preceding {@code lookbackHours} and rolled up
 * into hourly sums, so collaborators may return data at a finer resolution.
 * </p>
 *
 * <h3>Checks</h3>
 * <ul>
 *   <li>{@code error_count}: spikes of the current hour's errors against the
 *       trailing hours.</li>
 *   <li>{@code log_volume}: spikes and drops of the current hour's event count
 *       against the trailing hours.</li>
 * </ul>
 * <p>
 * Each check runs independently and only when its series has a value for the
 * current hour and reaches back at least {@code minBaselineHours} before it.
 * A log group where neither check could run is reported as
 * {@link SourceStatus#INSUFFICIENT_DATA}.
 * </p>
 *
 * @since 1.0.0
 */
public class LogAnomalyJob extends AbstractAnalysisJob {

    private static final Logger LOG = LoggerFactory.getLogger(LogAnomalyJob.class);

    public static final String NAME = "log-anomaly";
    public static final String CHECK_ERROR_COUNT = "error_count";
    public static final String CHECK_LOG_VOLUME = "log_volume";

    private static final Duration HOUR = Duration.ofHours(1);

    private final LogJobSettings settings;
    private final DetectionPolicy errorPolicy;
    private final DetectionPolicy volumePolicy;

    public LogAnomalyJob(LogJobSettings settings, MetricsQueryClient queryClient, AlertDispatcher dispatcher,
            AnomalyDetector detector, int maxWorkers) {
        super(NAME, Objects.requireNonNull(settings, "settings must not be null").getSources(),
                queryClient, dispatcher, detector, maxWorkers);
        this.settings = settings;
        this.errorPolicy = settings.errorPolicy();
        this.volumePolicy = settings.volumePolicy();
    }

    public DetectionPolicy getErrorPolicy() {
        return errorPolicy;
    }

    public DetectionPolicy getVolumePolicy() {
        return volumePolicy;
    }

    @Override
    protected SourceReport analyzeSource(SourceContext context) {
        String logGroup = context.getSource();
        Instant end = context.getEvaluationTime().truncatedTo(ChronoUnit.HOURS);
        Instant start = end.minus(Duration.ofHours(settings.getLookbackHours()));

        List<AnomalyRecord> anomalies = new ArrayList<>();
        Map<String, TrendResult> trends = new LinkedHashMap<>();
        Map<String, PercentileSet> percentiles = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();

        runCheck(context, CHECK_ERROR_COUNT, MetricKind.ERROR_COUNT, errorPolicy, start, end,
                anomalies, trends, percentiles, skipped);
        runCheck(context, CHECK_LOG_VOLUME, MetricKind.LOG_VOLUME, volumePolicy, start, end,
                anomalies, trends, percentiles, skipped);

        if (trends.isEmpty()) {
            return SourceReport.insufficientData(logGroup, String.join("; ", skipped));
        }
        return SourceReport.analyzed(logGroup, anomalies, trends, percentiles);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void runCheck(SourceContext context, String checkName, MetricKind kind, DetectionPolicy policy,
            Instant start, Instant end, List<AnomalyRecord> anomalies, Map<String, TrendResult> trends,
            Map<String, PercentileSet> percentiles, List<String> skipped) {
        TimeSeries hourly = context.query(kind, start, end, HOUR).bucketSum(HOUR);

        Instant currentHour = end.minus(HOUR);
        if (hourly.isEmpty() || !hourly.getPoints().get(hourly.size() - 1).getTimestamp().equals(currentHour)) {
            skipped.add(checkName + ": no data for hour " + currentHour);
            return;
        }
        Instant first = hourly.getPoints().get(0).getTimestamp();
        long spanHours = Duration.between(first, currentHour).toHours();
        if (spanHours < settings.getMinBaselineHours()) {
            skipped.add(checkName + ": only " + spanHours + " hour(s) of history, need "
                    + settings.getMinBaselineHours());
            return;
        }

        List<AnomalyRecord> found = detector.detect(hourly, policy);
        for (AnomalyRecord record : found) {
            anomalies.add(record.withCheckName(checkName));
        }
        double[] values = hourly.values();
        trends.put(checkName, StatisticsPrimitives.detectTrend(values, settings.getTrendWindow()));
        percentiles.put(checkName, StatisticsPrimitives.computePercentiles(values));

        LOG.debug("[{}] Log group [{}] {}: {} hour(s) analysed, {} anomaly(ies)",
                NAME, context.getSource(), checkName, values.length, found.size());
    }
}
