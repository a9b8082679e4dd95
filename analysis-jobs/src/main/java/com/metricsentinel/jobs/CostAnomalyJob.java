package com.metricsentinel.jobs;

import com.metricsentinel.core.config.CostJobSettings;
import com.metricsentinel.core.detection.AnomalyDetector;
import com.metricsentinel.core.detection.DetectionPolicy;
import com.metricsentinel.core.model.AnomalyRecord;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.TimeSeries;
import com.metricsentinel.core.stats.StatisticsPrimitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Daily spend analysis per service.
 *
 * <p>
 * For each configured service the job queries daily {@link MetricKind#COST}
 * over the lookback window ending at the start of the evaluation day, so only
 * complete days are judged. The newest day is tested against the days before
 * it; a trend over the last {@code trendWindow} days and a percentile summary
 * of the whole window are attached to the report.
 * </p>
 *
 * <p>
 * Services with fewer than {@code minDataPoints} days of data, or without a
 * value for the last complete day, are reported as
 * {@link SourceStatus#INSUFFICIENT_DATA} and nothing is dispatched for them.
 * A lagging series is therefore never judged on a day already evaluated.
 * </p>
 *
 * @since 1.0.0
 */
public class CostAnomalyJob extends AbstractAnalysisJob {

    private static final Logger LOG = LoggerFactory.getLogger(CostAnomalyJob.class);

    public static final String NAME = "cost-anomaly";
    public static final String CHECK_DAILY_COST = "daily_cost";

    private static final Duration RESOLUTION = Duration.ofDays(1);

    private final CostJobSettings settings;
    private final DetectionPolicy policy;

    public CostAnomalyJob(CostJobSettings settings, MetricsQueryClient queryClient, AlertDispatcher dispatcher,
            AnomalyDetector detector, int maxWorkers) {
        super(NAME, Objects.requireNonNull(settings, "settings must not be null").getSources(),
                queryClient, dispatcher, detector, maxWorkers);
        this.settings = settings;
        this.policy = settings.policy();
    }

    public DetectionPolicy getPolicy() {
        return policy;
    }

    @Override
    protected SourceReport analyzeSource(SourceContext context) {
        String service = context.getSource();
        Instant end = context.getEvaluationTime().truncatedTo(ChronoUnit.DAYS);
        Instant start = end.minus(Duration.ofDays(settings.getLookbackDays()));

        TimeSeries series = context.query(MetricKind.COST, start, end, RESOLUTION);
        if (series.size() < settings.getMinDataPoints()) {
            return SourceReport.insufficientData(service, "Only " + series.size() + " day(s) of cost data, need "
                    + settings.getMinDataPoints());
        }
        Instant lastDay = end.minus(RESOLUTION);
        Instant newest = series.getPoints().get(series.size() - 1).getTimestamp();
        if (!newest.equals(lastDay)) {
            return SourceReport.insufficientData(service, "No cost data for " + lastDay
                    + ", newest day is " + newest);
        }

        List<AnomalyRecord> anomalies = detector.detect(series, policy).stream()
                .map(r -> r.withCheckName(CHECK_DAILY_COST))
                .toList();
        double[] values = series.values();

        LOG.debug("[{}] Service [{}]: {} day(s) analysed, {} anomaly(ies)",
                NAME, service, values.length, anomalies.size());
        return SourceReport.analyzed(service, anomalies,
                Map.of(CHECK_DAILY_COST, StatisticsPrimitives.detectTrend(values, settings.getTrendWindow())),
                Map.of(CHECK_DAILY_COST, StatisticsPrimitives.computePercentiles(values)));
    }
}
