package com.metricsentinel.jobs;

import com.metricsentinel.core.config.AnalysisConfig;
import com.metricsentinel.core.config.ConfigLoader;
import com.metricsentinel.core.detection.AnomalyDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Wires the analysis jobs from configuration and collaborators.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * The engine holds the collaborators handed to it and the jobs built from
 * them; it keeps no other state. The external scheduler calls
 * {@link #runCostJob(Instant)} and {@link #runLogJob(Instant)} (or
 * {@link AnalysisJob#run(JobContext)} on {@link #jobs()}) on its own cadence.
 * </p>
 *
 * <h3>Configuration</h3>
 * <p>
 * Runtime settings come from {@link EngineConfig}, detection tuning from
 * {@link AnalysisConfig}. Both are validated before any job is built.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisEngine.class);

    private final EngineConfig engineConfig;
    private final CostAnomalyJob costJob;
    private final LogAnomalyJob logJob;

    private AnalysisEngine(EngineConfig engineConfig, CostAnomalyJob costJob, LogAnomalyJob logJob) {
        this.engineConfig = engineConfig;
        this.costJob = costJob;
        this.logJob = logJob;
    }

    /**
     * Build an engine with analysis settings resolved by
     * {@link ConfigLoader#load()}.
     *
     * @throws com.metricsentinel.core.error.ConfigurationException if the
     *                                                              settings
     *                                                              are invalid
     */
    public static AnalysisEngine create(EngineConfig engineConfig, MetricsQueryClient queryClient,
            AlertDispatcher dispatcher) {
        return create(engineConfig, ConfigLoader.load(), queryClient, dispatcher);
    }

    /**
     * Build an engine from explicit settings.
     *
     * @throws com.metricsentinel.core.error.ConfigurationException if the
     *                                                              settings
     *                                                              are invalid
     */
    public static AnalysisEngine create(EngineConfig engineConfig, AnalysisConfig analysisConfig,
            MetricsQueryClient queryClient, AlertDispatcher dispatcher) {
        Objects.requireNonNull(engineConfig, "engineConfig must not be null");
        Objects.requireNonNull(analysisConfig, "analysisConfig must not be null");
        analysisConfig.validate();

        AnomalyDetector detector = new AnomalyDetector();
        CostAnomalyJob costJob = new CostAnomalyJob(analysisConfig.getCost(), queryClient, dispatcher,
                detector, engineConfig.getMaxWorkers());
        LogAnomalyJob logJob = new LogAnomalyJob(analysisConfig.getLogs(), queryClient, dispatcher,
                detector, engineConfig.getMaxWorkers());

        LOG.info("Analysis engine ready: {} cost source(s), {} log source(s), {}",
                costJob.getSources().size(), logJob.getSources().size(), engineConfig);
        return new AnalysisEngine(engineConfig, costJob, logJob);
    }

    public EngineConfig getEngineConfig() {
        return engineConfig;
    }

    public CostAnomalyJob getCostJob() {
        return costJob;
    }

    public LogAnomalyJob getLogJob() {
        return logJob;
    }

    /**
     * @return every job, in a stable order
     */
    public List<AnalysisJob> jobs() {
        return List.of(costJob, logJob);
    }

    /**
     * Run the cost job once for the given evaluation time.
     */
    public JobResult runCostJob(Instant evaluationTime) {
        return costJob.run(context(evaluationTime));
    }

    /**
     * Run the log job once for the given evaluation time.
     */
    public JobResult runLogJob(Instant evaluationTime) {
        return logJob.run(context(evaluationTime));
    }

    private JobContext context(Instant evaluationTime) {
        return JobContext.at(evaluationTime, engineConfig.getQueryTimeout());
    }
}
