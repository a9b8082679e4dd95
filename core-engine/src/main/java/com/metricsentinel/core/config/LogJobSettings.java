package com.metricsentinel.core.config;

import com.metricsentinel.core.detection.DetectionPolicy;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings for the hourly log anomaly job.
 *
 * <p>
 * Two checks run per log group, each with its own detector overrides:
 * {@code errors} (error-count spikes) and {@code volume} (event volume
 * spikes and drops).
 * </p>
 *
 * <pre>
 * logs:
 *   sources: [/aws/lambda/orders]
 *   lookbackHours: 24
 *   errors:
 *     minAbsoluteValue: 10
 *   volume:
 *     minBaselineForDrop: 100
 * </pre>
 *
 * @since 1.0.0
 */
public class LogJobSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Error-count defaults: spikes only, at least 10 errors, HIGH above 2 × threshold. */
    public static final DetectionPolicy DEFAULT_ERROR_POLICY = DetectionPolicy.builder()
            .baselineWindow(23)
            .sensitivity(2.0)
            .minAbsoluteValue(10)
            .dropRatio(0)
            .highSeverityMultiplier(2.0)
            .build();

    /** Volume defaults: spikes and drops below 10 % of a baseline averaging at least 100 events. */
    public static final DetectionPolicy DEFAULT_VOLUME_POLICY = DetectionPolicy.builder()
            .baselineWindow(23)
            .sensitivity(2.0)
            .dropRatio(0.1)
            .minBaselineForDrop(100)
            .highSeverityMultiplier(2.0)
            .build();

    private List<String> sources = new ArrayList<>();
    private int lookbackHours = 24;
    private int minBaselineHours = 23;
    private int trendWindow = 6;
    private DetectorSettings errors = new DetectorSettings();
    private DetectorSettings volume = new DetectorSettings();

    public DetectionPolicy errorPolicy() {
        return errors.toPolicy(DEFAULT_ERROR_POLICY);
    }

    public DetectionPolicy volumePolicy() {
        return volume.toPolicy(DEFAULT_VOLUME_POLICY);
    }

    void validate(List<String> errorsOut) {
        ConfigChecks.requireSources("logs", sources, errorsOut);
        if (lookbackHours < 2) {
            errorsOut.add("logs: 'lookbackHours' must be >= 2, got: " + lookbackHours);
        }
        if (minBaselineHours < 1) {
            errorsOut.add("logs: 'minBaselineHours' must be >= 1, got: " + minBaselineHours);
        }
        if (minBaselineHours >= lookbackHours) {
            errorsOut.add("logs: 'minBaselineHours' (" + minBaselineHours
                    + ") must be less than 'lookbackHours' (" + lookbackHours + ")");
        }
        if (trendWindow < 1) {
            errorsOut.add("logs: 'trendWindow' must be >= 1, got: " + trendWindow);
        }
        errors.validate("logs.errors", DEFAULT_ERROR_POLICY, errorsOut);
        volume.validate("logs.volume", DEFAULT_VOLUME_POLICY, errorsOut);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<String> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public void setSources(List<String> sources) {
        this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
    }

    public int getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(int lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public int getMinBaselineHours() {
        return minBaselineHours;
    }

    public void setMinBaselineHours(int minBaselineHours) {
        this.minBaselineHours = minBaselineHours;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public void setTrendWindow(int trendWindow) {
        this.trendWindow = trendWindow;
    }

    public DetectorSettings getErrors() {
        return errors;
    }

    public void setErrors(DetectorSettings errors) {
        this.errors = errors != null ? errors : new DetectorSettings();
    }

    public DetectorSettings getVolume() {
        return volume;
    }

    public void setVolume(DetectorSettings volume) {
        this.volume = volume != null ? volume : new DetectorSettings();
    }

    @Override
    public String toString() {
        return "LogJobSettings{" +
                "sources=" + sources +
                ", lookbackHours=" + lookbackHours +
                ", minBaselineHours=" + minBaselineHours +
                ", trendWindow=" + trendWindow +
                ", errors=" + errors +
                ", volume=" + volume +
                '}';
    }
}
