package com.metricsentinel.core.detection;

import com.metricsentinel.core.error.InvalidInputException;
import com.metricsentinel.core.model.AnomalyKind;
import com.metricsentinel.core.model.AnomalyRecord;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.model.TimeSeries;
import com.metricsentinel.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyDetector}.
 */
class AnomalyDetectorTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private final AnomalyDetector detector = new AnomalyDetector();

    @Test
    @DisplayName("Day 8 cost of 250 after a ~100/day week is a high-severity spike")
    void shouldFlagCostSpike() {
        TimeSeries series = daily("ec2", MetricKind.COST, 100, 102, 98, 101, 99, 103, 97, 250);

        List<AnomalyRecord> records = detector.detect(series, 0, 2.0, 0.0);

        assertThat(records).hasSize(1);
        AnomalyRecord record = records.get(0);
        assertThat(record.getKind()).isEqualTo(AnomalyKind.SPIKE);
        assertThat(record.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(record.getSource()).isEqualTo("ec2");
        assertThat(record.getMetricKind()).isEqualTo(MetricKind.COST);
        assertThat(record.getTimestamp()).isEqualTo(START.plus(Duration.ofDays(7)));
        assertThat(record.getObservedValue()).isEqualTo(250.0);
        assertThat(record.getBaselineMean()).isCloseTo(100.0, within(1e-9));
        assertThat(record.getThreshold()).isCloseTo(100.0 + 2.0 * Math.sqrt(28.0 / 6.0), within(1e-9));
        assertThat(record.getDetails()).contains("Spike");
    }

    @Test
    @DisplayName("A single 5-sigma spike above the absolute floor yields exactly one HIGH record")
    void shouldFlagFiveSigmaSpike() {
        // mean 10, stddev ≈ 5.345, so 37 is just over 5 σ above the mean
        TimeSeries series = daily("api", MetricKind.ERROR_COUNT, 5, 15, 5, 15, 5, 15, 5, 15, 37);

        List<AnomalyRecord> records = detector.detect(series, 0, 2.0, 30.0);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getKind()).isEqualTo(AnomalyKind.SPIKE);
        assertThat(records.get(0).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Values under the absolute floor are never spikes")
    void shouldRespectAbsoluteFloor() {
        TimeSeries series = daily("api", MetricKind.ERROR_COUNT, 0, 1, 0, 1, 0, 1, 8);

        assertThat(detector.detect(series, 0, 2.0, 10.0)).isEmpty();
        assertThat(detector.detect(series, 0, 2.0, 0.0)).hasSize(1);
    }

    @Test
    @DisplayName("The severity multiplier is taken from the policy")
    void shouldUsePolicySeverityMultiplier() {
        // threshold ≈ 104.32; 180 is above 1.5× but below 2×
        TimeSeries series = daily("ec2", MetricKind.COST, 100, 102, 98, 101, 99, 103, 97, 180);
        DetectionPolicy cost = DetectionPolicy.builder().highSeverityMultiplier(1.5).build();
        DetectionPolicy logs = DetectionPolicy.builder().highSeverityMultiplier(2.0).build();

        assertThat(detector.detect(series, cost)).singleElement()
                .extracting(AnomalyRecord::getSeverity).isEqualTo(Severity.HIGH);
        assertThat(detector.detect(series, logs)).singleElement()
                .extracting(AnomalyRecord::getSeverity).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("A flat baseline produces a finite threshold and flags any rise")
    void shouldHandleZeroVariance() {
        TimeSeries steady = daily("queue", MetricKind.LOG_VOLUME, 50, 50, 50, 50, 50, 50);
        TimeSeries rising = daily("queue", MetricKind.LOG_VOLUME, 50, 50, 50, 50, 50, 51);

        assertThat(detector.detect(steady, 0, 2.0, 0.0)).isEmpty();

        List<AnomalyRecord> records = detector.detect(rising, 0, 2.0, 0.0);
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getThreshold()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Falling below 10% of a busy baseline is a drop; falling to zero is HIGH")
    void shouldFlagDrops() {
        DetectionPolicy policy = DetectionPolicy.builder().dropRatio(0.1).minBaselineForDrop(100).build();

        List<AnomalyRecord> partial = detector.detect(
                daily("orders", MetricKind.LOG_VOLUME, 190, 210, 200, 205, 195, 5), policy);
        List<AnomalyRecord> silent = detector.detect(
                daily("orders", MetricKind.LOG_VOLUME, 190, 210, 200, 205, 195, 0), policy);

        assertThat(partial).hasSize(1);
        assertThat(partial.get(0).getKind()).isEqualTo(AnomalyKind.DROP);
        assertThat(partial.get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(silent).hasSize(1);
        assertThat(silent.get(0).getKind()).isEqualTo(AnomalyKind.DROP);
        assertThat(silent.get(0).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Naturally idle sources are not flagged for drops")
    void shouldIgnoreDropsOnQuietBaselines() {
        DetectionPolicy policy = DetectionPolicy.builder().dropRatio(0.1).minBaselineForDrop(100).build();

        assertThat(detector.detect(daily("cron", MetricKind.LOG_VOLUME, 9, 11, 10, 10, 0), policy)).isEmpty();
    }

    @Test
    @DisplayName("A drop ratio of zero disables drop detection")
    void shouldSkipDropsWhenDisabled() {
        DetectionPolicy policy = DetectionPolicy.builder().dropRatio(0).build();

        assertThat(detector.detect(daily("orders", MetricKind.ERROR_COUNT, 190, 210, 200, 0), policy)).isEmpty();
    }

    @Test
    @DisplayName("The baseline window limits how much history is used")
    void shouldLimitBaselineWindow() {
        TimeSeries series = daily("svc", MetricKind.COST, 500, 500, 10, 12, 10, 12, 40);

        assertThat(detector.detect(series, 0, 2.0, 0.0)).isEmpty();
        assertThat(detector.detect(series, 4, 2.0, 0.0)).hasSize(1);
    }

    @Test
    @DisplayName("Too small a baseline yields no records instead of an error")
    void shouldReturnEmptyForInsufficientBaseline() {
        assertThat(detector.detect(daily("svc", MetricKind.COST, 10, 1000), 0, 2.0, 0.0)).isEmpty();
        assertThat(detector.detect(daily("svc", MetricKind.COST), 0, 2.0, 0.0)).isEmpty();
    }

    @Test
    @DisplayName("Several evaluation points are each judged against the same baseline")
    void shouldEvaluateMultiplePoints() {
        DetectionPolicy policy = DetectionPolicy.builder().evaluationPoints(2).build();

        List<AnomalyRecord> records = detector.detect(
                daily("svc", MetricKind.COST, 100, 102, 98, 101, 99, 103, 97, 250, 300), policy);

        assertThat(records).hasSize(2);
        assertThat(records).extracting(AnomalyRecord::getObservedValue).containsExactly(250.0, 300.0);
        assertThat(records.get(0).getBaselineMean()).isEqualTo(records.get(1).getBaselineMean());
    }

    @Test
    @DisplayName("A recurring peak hour is judged against the same hour on previous days")
    void shouldSuppressSeasonalPeaks() {
        DetectionPolicy seasonal = DetectionPolicy.builder().seasonalityPeriodHours(24).build();
        DetectionPolicy plain = DetectionPolicy.builder().seasonalityPeriodHours(0).build();

        TimeSeries usualPeak = hourlyWithNightlyPeak(300);
        TimeSeries unusualPeak = hourlyWithNightlyPeak(400);

        assertThat(detector.detect(usualPeak, plain)).hasSize(1);
        assertThat(detector.detect(usualPeak, seasonal)).isEmpty();
        assertThat(detector.detect(unusualPeak, seasonal)).singleElement()
                .extracting(AnomalyRecord::getThreshold).isEqualTo(300.0);
    }

    @Test
    @DisplayName("A point inside the overall range is not a spike even when its same-hour history is flat")
    void shouldNotFlagSmallWiggleOnFlatSameHourHistory() {
        DetectionPolicy seasonal = DetectionPolicy.builder().seasonalityPeriodHours(24).build();
        DetectionPolicy plain = DetectionPolicy.builder().seasonalityPeriodHours(0).build();
        TimeSeries series = hourlyWithNightlyPeakThen(5, 101);

        assertThat(detector.detect(series, plain)).isEmpty();
        assertThat(detector.detect(series, seasonal)).isEmpty();
    }

    @Test
    @DisplayName("A drop against the same-hour peak alone is not reported")
    void shouldNotFlagDropOnlyAgainstSameHourMean() {
        DetectionPolicy seasonal = DetectionPolicy.builder().seasonalityPeriodHours(24).build();

        // 20 is under 10 % of the 02:00 mean of 300 but not of the overall mean of ~108
        assertThat(detector.detect(hourlyWithNightlyPeakThen(2, 20), seasonal)).isEmpty();

        List<AnomalyRecord> silent = detector.detect(hourlyWithNightlyPeakThen(2, 0), seasonal);
        assertThat(silent).hasSize(1);
        assertThat(silent.get(0).getKind()).isEqualTo(AnomalyKind.DROP);
        assertThat(silent.get(0).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("A seasonal baseline never adds a record the plain policy would not produce")
    void shouldOnlyEverSuppressWithSeasonality() {
        DetectionPolicy seasonal = DetectionPolicy.builder().seasonalityPeriodHours(24).build();
        DetectionPolicy plain = DetectionPolicy.builder().seasonalityPeriodHours(0).build();

        for (int hour : new int[] { 2, 5, 13 }) {
            for (double value : new double[] { 0, 5, 20, 99, 101, 150, 190, 250, 300, 400 }) {
                TimeSeries series = hourlyWithNightlyPeakThen(hour, value);
                List<AnomalyRecord> withSeasonality = detector.detect(series, seasonal);
                List<AnomalyRecord> without = detector.detect(series, plain);

                assertThat(withSeasonality.size())
                        .as("hour %d value %.0f", hour, value)
                        .isLessThanOrEqualTo(without.size());
                if (!withSeasonality.isEmpty()) {
                    assertThat(withSeasonality.get(0).getKind())
                            .as("hour %d value %.0f", hour, value)
                            .isEqualTo(without.get(0).getKind());
                }
            }
        }
    }

    @Test
    @DisplayName("Negative sensitivity is rejected")
    void shouldRejectNegativeSensitivity() {
        TimeSeries series = daily("svc", MetricKind.COST, 1, 2, 3);

        assertThatThrownBy(() -> detector.detect(series, 0, -1.0, 0.0))
                .isInstanceOf(InvalidInputException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TimeSeries daily(String source, MetricKind kind, double... values) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new TimeSeriesPoint(START.plus(Duration.ofDays(i)), values[i]));
        }
        return TimeSeries.of(source, kind, points);
    }

    /**
     * Three days of hourly values at 100 with a peak of 300 at 02:00 each
     * night, followed by one point at 02:00 on the fourth day.
     */
    private static TimeSeries hourlyWithNightlyPeak(double fourthNight) {
        return hourlyWithNightlyPeakThen(2, fourthNight);
    }

    /**
     * The same three days, followed by one point at {@code hourOfDay} on the
     * fourth day.
     */
    private static TimeSeries hourlyWithNightlyPeakThen(int hourOfDay, double value) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int h = 0; h < 72; h++) {
            points.add(new TimeSeriesPoint(START.plus(Duration.ofHours(h)), h % 24 == 2 ? 300 : 100));
        }
        points.add(new TimeSeriesPoint(START.plus(Duration.ofHours(72 + hourOfDay)), value));
        return TimeSeries.of("batch", MetricKind.LOG_VOLUME, points);
    }
}
