package com.metricsentinel.core.config;

import com.metricsentinel.core.detection.DetectionPolicy;
import com.metricsentinel.core.error.InvalidInputException;

import java.io.Serializable;
import java.util.List;

/**
 * Detector overrides for one check, as written in the YAML configuration.
 *
 * <p>
 * Every field is optional. Unset fields ({@code null}) keep the value of the
 * check's own default policy, so a file only has to name what it changes:
 * </p>
 *
 * <pre>
 * errors:
 *   sensitivity: 2.5
 *   minAbsoluteValue: 20
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectorSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private Integer baselineWindow;
    private Integer evaluationPoints;
    private Double sensitivity;
    private Double minAbsoluteValue;
    private Double dropRatio;
    private Double minBaselineForDrop;
    private Double highSeverityMultiplier;
    private Integer seasonalityPeriodHours;

    /**
     * Overlay these settings on {@code defaults}.
     *
     * @param defaults the check's default policy
     * @return merged policy
     * @throws InvalidInputException if a merged value is out of range
     */
    public DetectionPolicy toPolicy(DetectionPolicy defaults) {
        DetectionPolicy.Builder b = defaults.toBuilder();
        if (baselineWindow != null) {
            b.baselineWindow(baselineWindow);
        }
        if (evaluationPoints != null) {
            b.evaluationPoints(evaluationPoints);
        }
        if (sensitivity != null) {
            b.sensitivity(sensitivity);
        }
        if (minAbsoluteValue != null) {
            b.minAbsoluteValue(minAbsoluteValue);
        }
        if (dropRatio != null) {
            b.dropRatio(dropRatio);
        }
        if (minBaselineForDrop != null) {
            b.minBaselineForDrop(minBaselineForDrop);
        }
        if (highSeverityMultiplier != null) {
            b.highSeverityMultiplier(highSeverityMultiplier);
        }
        if (seasonalityPeriodHours != null) {
            b.seasonalityPeriodHours(seasonalityPeriodHours);
        }
        return b.build();
    }

    /**
     * Record a validation error under {@code section} if the merged policy is
     * invalid.
     */
    void validate(String section, DetectionPolicy defaults, List<String> errors) {
        try {
            toPolicy(defaults);
        } catch (InvalidInputException e) {
            errors.add(section + ": " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public Integer getBaselineWindow() {
        return baselineWindow;
    }

    public void setBaselineWindow(Integer baselineWindow) {
        this.baselineWindow = baselineWindow;
    }

    public Integer getEvaluationPoints() {
        return evaluationPoints;
    }

    public void setEvaluationPoints(Integer evaluationPoints) {
        this.evaluationPoints = evaluationPoints;
    }

    public Double getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(Double sensitivity) {
        this.sensitivity = sensitivity;
    }

    public Double getMinAbsoluteValue() {
        return minAbsoluteValue;
    }

    public void setMinAbsoluteValue(Double minAbsoluteValue) {
        this.minAbsoluteValue = minAbsoluteValue;
    }

    public Double getDropRatio() {
        return dropRatio;
    }

    public void setDropRatio(Double dropRatio) {
        this.dropRatio = dropRatio;
    }

    public Double getMinBaselineForDrop() {
        return minBaselineForDrop;
    }

    public void setMinBaselineForDrop(Double minBaselineForDrop) {
        this.minBaselineForDrop = minBaselineForDrop;
    }

    public Double getHighSeverityMultiplier() {
        return highSeverityMultiplier;
    }

    public void setHighSeverityMultiplier(Double highSeverityMultiplier) {
        this.highSeverityMultiplier = highSeverityMultiplier;
    }

    public Integer getSeasonalityPeriodHours() {
        return seasonalityPeriodHours;
    }

    public void setSeasonalityPeriodHours(Integer seasonalityPeriodHours) {
        this.seasonalityPeriodHours = seasonalityPeriodHours;
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "baselineWindow=" + baselineWindow +
                ", evaluationPoints=" + evaluationPoints +
                ", sensitivity=" + sensitivity +
                ", minAbsoluteValue=" + minAbsoluteValue +
                ", dropRatio=" + dropRatio +
                ", minBaselineForDrop=" + minBaselineForDrop +
                ", highSeverityMultiplier=" + highSeverityMultiplier +
                ", seasonalityPeriodHours=" + seasonalityPeriodHours +
                '}';
    }
}
