package com.metricsentinel.jobs;

import com.metricsentinel.core.config.AnalysisConfig;
import com.metricsentinel.core.config.ConfigLoader;
import com.metricsentinel.core.error.ConfigurationException;
import com.metricsentinel.core.model.AnomalyRecord;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.TimeSeries;
import com.metricsentinel.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AnalysisEngine} wiring.
 */
class AnalysisEngineTest {

    private static final Instant FIRST_DAY = Instant.parse("2024-03-01T00:00:00Z");

    private final EngineConfig engineConfig = new EngineConfig.Builder()
            .queryTimeout(Duration.ofSeconds(5))
            .maxWorkers(2)
            .build();
    private final List<AnomalyRecord> dispatched = new CopyOnWriteArrayList<>();

    @Test
    @DisplayName("Builds both jobs from the YAML settings")
    void shouldWireJobsFromConfig() {
        AnalysisConfig config = ConfigLoader.fromClasspath("engine-analysis.yml");

        AnalysisEngine engine = AnalysisEngine.create(engineConfig, config, this::flatSeries, dispatched::add);

        assertThat(engine.jobs()).extracting(AnalysisJob::getName)
                .containsExactly(CostAnomalyJob.NAME, LogAnomalyJob.NAME);
        assertThat(engine.getCostJob().getSources()).containsExactly("ec2", "rds");
        assertThat(engine.getCostJob().getPolicy().getHighSeverityMultiplier()).isEqualTo(1.5);
        assertThat(engine.getLogJob().getSources()).containsExactly("/aws/lambda/orders");
        assertThat(engine.getLogJob().getErrorPolicy().getHighSeverityMultiplier()).isEqualTo(2.0);
        assertThat(engine.getLogJob().getErrorPolicy().getMinAbsoluteValue()).isEqualTo(10.0);
        assertThat(engine.getEngineConfig()).isSameAs(engineConfig);
    }

    @Test
    @DisplayName("runCostJob analyses every configured service at the given time")
    void shouldRunCostJob() {
        AnalysisConfig config = ConfigLoader.fromClasspath("engine-analysis.yml");
        AnalysisEngine engine = AnalysisEngine.create(engineConfig, config, this::flatSeries, dispatched::add);

        JobResult result = engine.runCostJob(Instant.parse("2024-03-11T12:00:00Z"));

        assertThat(result.getReports(SourceStatus.ANALYZED)).extracting(SourceReport::getSource)
                .containsExactly("ec2", "rds");
        assertThat(result.getAnomalies()).isEmpty();
        assertThat(dispatched).isEmpty();
    }

    @Test
    @DisplayName("The bundled default settings configure no sources")
    void shouldLoadBundledDefaults() {
        AnalysisEngine engine = AnalysisEngine.create(engineConfig,
                ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE), this::flatSeries, dispatched::add);

        JobResult result = engine.runLogJob(Instant.parse("2024-03-11T12:00:00Z"));

        assertThat(result.getReports()).isEmpty();
        assertThat(engine.getLogJob().getVolumePolicy().getMinBaselineForDrop()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Invalid settings are rejected before any job is built")
    void shouldRejectInvalidConfig() {
        AnalysisConfig config = new AnalysisConfig();
        config.getCost().setSources(List.of("ec2", "ec2"));
        config.getCost().setMinDataPoints(1);

        assertThatThrownBy(() -> AnalysisEngine.create(engineConfig, config, this::flatSeries, dispatched::add))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("duplicate source 'ec2'")
                .hasMessageContaining("minDataPoints");
    }

    private TimeSeries flatSeries(String source, MetricKind kind, Instant start, Instant end, Duration resolution) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            points.add(new TimeSeriesPoint(FIRST_DAY.plus(Duration.ofDays(i)), 50.0));
        }
        return TimeSeries.of(source, kind, points);
    }
}
