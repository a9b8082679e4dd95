package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyKind;
import com.metricsentinel.core.model.AnomalyRecord;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.model.ThresholdResult;
import com.metricsentinel.core.model.TimeSeries;
import com.metricsentinel.core.model.TimeSeriesPoint;
import com.metricsentinel.core.stats.SeasonalityAnalyzer;
import com.metricsentinel.core.stats.StatisticsPrimitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-metric spike and drop detector.
 *
 * <p>
 * The most recent {@link DetectionPolicy#getEvaluationPoints()} points are
 * evaluated against a baseline made of the points before them. A point is a
 * <b>spike</b> when it exceeds both {@code mean + sensitivity × σ} and the
 * absolute floor, and a <b>drop</b> when it falls below
 * {@code mean × dropRatio} on a baseline busy enough to make silence
 * meaningful.
 * </p>
 *
 * <h3>Seasonality</h3>
 * <p>
 * When the baseline passes the {@link SeasonalityAnalyzer} gate, a point must
 * also fall outside the range of the baseline points from the same hour of
 * day, so a regular nightly peak is not reported as a spike. Seasonality only
 * ever removes records: a point inside the whole baseline's range is never
 * reported, however tight its same-hour range is.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This detector is <strong>stateless</strong>. Each call is a pure function
 * of its arguments; continuity between runs comes only from the baseline the
 * caller supplies. One instance may be shared across threads.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    /**
     * Detect with default policy values apart from the ones given.
     *
     * @param series           series to analyse
     * @param baselineWindow   baseline points before the newest point, 0 for
     *                         all
     * @param sensitivity      standard-deviation multiplier
     * @param minAbsoluteValue absolute floor a spike must exceed
     * @return anomaly records, possibly empty
     * @throws com.metricsentinel.core.error.InvalidInputException if an
     *                                                             argument is
     *                                                             out of range
     */
    public List<AnomalyRecord> detect(TimeSeries series, int baselineWindow, double sensitivity,
            double minAbsoluteValue) {
        return detect(series, DetectionPolicy.builder()
                .baselineWindow(baselineWindow)
                .sensitivity(sensitivity)
                .minAbsoluteValue(minAbsoluteValue)
                .build());
    }

    /**
     * Detect anomalies in the newest points of {@code series}.
     *
     * @param series series to analyse; must not be {@code null}
     * @param policy tuning; must not be {@code null}
     * @return anomaly records in timestamp order; empty when the baseline is too
     *         small to judge
     */
    public List<AnomalyRecord> detect(TimeSeries series, DetectionPolicy policy) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        int n = series.size();
        int evaluationStart = Math.max(0, n - policy.getEvaluationPoints());
        int baselineStart = policy.getBaselineWindow() > 0
                ? Math.max(0, evaluationStart - policy.getBaselineWindow())
                : 0;
        TimeSeries baseline = series.slice(baselineStart, evaluationStart);

        ThresholdResult overall = StatisticsPrimitives.computeThreshold(baseline.values(),
                policy.getSensitivity());
        if (!overall.isSufficient()) {
            LOG.debug("Series [{}]: baseline of {} point(s) is too small – skipping",
                    series.getName(), baseline.size());
            return Collections.emptyList();
        }

        boolean seasonal = policy.getSeasonalityPeriodHours() > 0
                && SeasonalityAnalyzer.isSeasonal(baseline.values(), baseline.timestamps(),
                        policy.getSeasonalityPeriodHours());

        List<AnomalyRecord> records = new ArrayList<>();
        for (TimeSeriesPoint point : series.getPoints().subList(evaluationStart, n)) {
            Optional<ThresholdResult> sameHour = seasonal
                    ? sameHourThreshold(baseline, point, policy)
                    : Optional.empty();
            evaluate(series, point, overall, sameHour, policy).ifPresent(records::add);
        }
        return records;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<AnomalyRecord> evaluate(TimeSeries series, TimeSeriesPoint point,
            ThresholdResult overall, Optional<ThresholdResult> sameHour, DetectionPolicy policy) {
        double value = point.getValue();

        if (value > overall.getThreshold()
                && value > policy.getMinAbsoluteValue()
                && sameHour.map(h -> value > h.getThreshold()).orElse(true)) {
            // report against the higher of the two thresholds the value had to clear
            ThresholdResult expected = sameHour
                    .filter(h -> h.getThreshold() > overall.getThreshold())
                    .orElse(overall);
            double threshold = expected.getThreshold();
            double mean = expected.getMean();
            Severity severity = value > threshold * policy.getHighSeverityMultiplier()
                    ? Severity.HIGH
                    : Severity.MEDIUM;
            LOG.debug("Series [{}] spike: value={} threshold={} mean={} severity={}",
                    series.getName(), value, threshold, mean, severity);
            return Optional.of(record(series, point, expected, AnomalyKind.SPIKE, severity,
                    String.format("Spike: %s=%.2f above threshold %.2f (mean=%.2f, stddev=%.2f, sensitivity=%.1f)",
                            series.getMetricKind().label(), value, threshold, mean,
                            expected.getStddev(), expected.getSensitivity())));
        }

        double ratio = policy.getDropRatio();
        if (policy.isDropDetectionEnabled()
                && overall.getMean() > 0
                && overall.getMean() >= policy.getMinBaselineForDrop()
                && value < overall.getMean() * ratio
                && sameHour.map(h -> value < h.getMean() * ratio).orElse(true)) {
            // report against the lower of the two means the value had to fall under
            ThresholdResult expected = sameHour
                    .filter(h -> h.getMean() < overall.getMean())
                    .orElse(overall);
            double mean = expected.getMean();
            Severity severity = value <= 0 ? Severity.HIGH : Severity.MEDIUM;
            LOG.debug("Series [{}] drop: value={} mean={} ratio={} severity={}",
                    series.getName(), value, mean, ratio, severity);
            return Optional.of(record(series, point, expected, AnomalyKind.DROP, severity,
                    String.format("Drop: %s=%.2f below %.0f%% of mean %.2f",
                            series.getMetricKind().label(), value, ratio * 100, mean)));
        }

        return Optional.empty();
    }

    private static Optional<ThresholdResult> sameHourThreshold(TimeSeries baseline, TimeSeriesPoint point,
            DetectionPolicy policy) {
        int hour = SeasonalityAnalyzer.hourOfDay(point.getTimestamp());
        double[] sameHour = baseline.getPoints().stream()
                .filter(p -> SeasonalityAnalyzer.hourOfDay(p.getTimestamp()) == hour)
                .mapToDouble(TimeSeriesPoint::getValue)
                .toArray();
        ThresholdResult result = StatisticsPrimitives.computeThreshold(sameHour, policy.getSensitivity());
        return result.isSufficient() ? Optional.of(result) : Optional.empty();
    }

    private static AnomalyRecord record(TimeSeries series, TimeSeriesPoint point, ThresholdResult expected,
            AnomalyKind kind, Severity severity, String details) {
        return AnomalyRecord.builder()
                .metricKind(series.getMetricKind())
                .source(series.getSource())
                .timestamp(point.getTimestamp())
                .observedValue(point.getValue())
                .baselineMean(expected.getMean())
                .threshold(expected.getThreshold())
                .kind(kind)
                .severity(severity)
                .details(details)
                .build();
    }
}
