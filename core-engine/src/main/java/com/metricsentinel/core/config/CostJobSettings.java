package com.metricsentinel.core.config;

import com.metricsentinel.core.detection.DetectionPolicy;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings for the daily cost anomaly job.
 *
 * <pre>
 * cost:
 *   sources: [ec2, lambda, rds]
 *   lookbackDays: 30
 *   minDataPoints: 7
 *   detector:
 *     sensitivity: 2.0
 * </pre>
 *
 * @since 1.0.0
 */
public class CostJobSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Cost-domain defaults: spikes are HIGH above 1.5 × threshold. */
    public static final DetectionPolicy DEFAULT_POLICY = DetectionPolicy.builder()
            .sensitivity(2.0)
            .highSeverityMultiplier(1.5)
            .dropRatio(0.1)
            .minBaselineForDrop(1.0)
            .seasonalityPeriodHours(0)
            .build();

    private List<String> sources = new ArrayList<>();
    private int lookbackDays = 30;
    private int minDataPoints = 7;
    private int trendWindow = 7;
    private DetectorSettings detector = new DetectorSettings();

    /**
     * @return the effective detection policy for cost series
     */
    public DetectionPolicy policy() {
        return detector.toPolicy(DEFAULT_POLICY);
    }

    void validate(List<String> errors) {
        ConfigChecks.requireSources("cost", sources, errors);
        if (lookbackDays < 1) {
            errors.add("cost: 'lookbackDays' must be >= 1, got: " + lookbackDays);
        }
        if (minDataPoints < 2) {
            errors.add("cost: 'minDataPoints' must be >= 2, got: " + minDataPoints);
        }
        if (minDataPoints > lookbackDays) {
            errors.add("cost: 'minDataPoints' (" + minDataPoints + ") cannot exceed 'lookbackDays' ("
                    + lookbackDays + ")");
        }
        if (trendWindow < 1) {
            errors.add("cost: 'trendWindow' must be >= 1, got: " + trendWindow);
        }
        detector.validate("cost.detector", DEFAULT_POLICY, errors);
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

    public int getLookbackDays() {
        return lookbackDays;
    }

    public void setLookbackDays(int lookbackDays) {
        this.lookbackDays = lookbackDays;
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public void setMinDataPoints(int minDataPoints) {
        this.minDataPoints = minDataPoints;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public void setTrendWindow(int trendWindow) {
        this.trendWindow = trendWindow;
    }

    public DetectorSettings getDetector() {
        return detector;
    }

    public void setDetector(DetectorSettings detector) {
        this.detector = detector != null ? detector : new DetectorSettings();
    }

    @Override
    public String toString() {
        return "CostJobSettings{" +
                "sources=" + sources +
                ", lookbackDays=" + lookbackDays +
                ", minDataPoints=" + minDataPoints +
                ", trendWindow=" + trendWindow +
                ", detector=" + detector +
                '}';
    }
}
