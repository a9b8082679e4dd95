package com.metricsentinel.core.detection;

import com.metricsentinel.core.error.InvalidInputException;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable tuning for one {@link AnomalyDetector} check.
 *
 * <p>
 * Each domain check carries its own policy. In particular the
 * {@code highSeverityMultiplier} differs between cost checks ({@code 1.5})
 * and log error checks ({@code 2.0}) and is never shared implicitly.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_SENSITIVITY = 2.0;
    public static final double DEFAULT_DROP_RATIO = 0.1;
    public static final double DEFAULT_HIGH_SEVERITY_MULTIPLIER = 1.5;
    public static final int DEFAULT_SEASONALITY_PERIOD_HOURS = 24;

    /** Baseline points before the evaluation portion; 0 means all of them. */
    private final int baselineWindow;

    /** Number of most recent points evaluated against the baseline. */
    private final int evaluationPoints;

    /** Standard deviations above the mean that count as a spike. */
    private final double sensitivity;

    /** Spikes must also exceed this absolute floor. */
    private final double minAbsoluteValue;

    /** A value below {@code mean × dropRatio} is a drop; 0 disables drops. */
    private final double dropRatio;

    /** Drops are only considered when the baseline mean reaches this level. */
    private final double minBaselineForDrop;

    /** Spike severity is HIGH above {@code threshold × highSeverityMultiplier}. */
    private final double highSeverityMultiplier;

    /** Period for the seasonality gate; 0 disables it. */
    private final int seasonalityPeriodHours;

    private DetectionPolicy(Builder b) {
        this.baselineWindow = b.baselineWindow;
        this.evaluationPoints = b.evaluationPoints;
        this.sensitivity = b.sensitivity;
        this.minAbsoluteValue = b.minAbsoluteValue;
        this.dropRatio = b.dropRatio;
        this.minBaselineForDrop = b.minBaselineForDrop;
        this.highSeverityMultiplier = b.highSeverityMultiplier;
        this.seasonalityPeriodHours = b.seasonalityPeriodHours;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return policy with every default
     */
    public static DetectionPolicy defaults() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .baselineWindow(baselineWindow)
                .evaluationPoints(evaluationPoints)
                .sensitivity(sensitivity)
                .minAbsoluteValue(minAbsoluteValue)
                .dropRatio(dropRatio)
                .minBaselineForDrop(minBaselineForDrop)
                .highSeverityMultiplier(highSeverityMultiplier)
                .seasonalityPeriodHours(seasonalityPeriodHours);
    }

    public int getBaselineWindow() {
        return baselineWindow;
    }

    public int getEvaluationPoints() {
        return evaluationPoints;
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public double getMinAbsoluteValue() {
        return minAbsoluteValue;
    }

    public double getDropRatio() {
        return dropRatio;
    }

    public double getMinBaselineForDrop() {
        return minBaselineForDrop;
    }

    public double getHighSeverityMultiplier() {
        return highSeverityMultiplier;
    }

    public int getSeasonalityPeriodHours() {
        return seasonalityPeriodHours;
    }

    public boolean isDropDetectionEnabled() {
        return dropRatio > 0;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionPolicy}. {@link #build()} rejects
     * out-of-range values with {@link InvalidInputException}.
     */
    public static class Builder {
        private int baselineWindow = 0;
        private int evaluationPoints = 1;
        private double sensitivity = DEFAULT_SENSITIVITY;
        private double minAbsoluteValue = 0.0;
        private double dropRatio = DEFAULT_DROP_RATIO;
        private double minBaselineForDrop = 0.0;
        private double highSeverityMultiplier = DEFAULT_HIGH_SEVERITY_MULTIPLIER;
        private int seasonalityPeriodHours = DEFAULT_SEASONALITY_PERIOD_HOURS;

        public Builder baselineWindow(int v) {
            this.baselineWindow = v;
            return this;
        }

        public Builder evaluationPoints(int v) {
            this.evaluationPoints = v;
            return this;
        }

        public Builder sensitivity(double v) {
            this.sensitivity = v;
            return this;
        }

        public Builder minAbsoluteValue(double v) {
            this.minAbsoluteValue = v;
            return this;
        }

        public Builder dropRatio(double v) {
            this.dropRatio = v;
            return this;
        }

        public Builder minBaselineForDrop(double v) {
            this.minBaselineForDrop = v;
            return this;
        }

        public Builder highSeverityMultiplier(double v) {
            this.highSeverityMultiplier = v;
            return this;
        }

        public Builder seasonalityPeriodHours(int v) {
            this.seasonalityPeriodHours = v;
            return this;
        }

        /**
         * @return a validated policy
         * @throws InvalidInputException if any value is out of range
         */
        public DetectionPolicy build() {
            if (baselineWindow < 0) {
                throw new InvalidInputException("baselineWindow must be >= 0, got: " + baselineWindow);
            }
            if (evaluationPoints < 1) {
                throw new InvalidInputException("evaluationPoints must be >= 1, got: " + evaluationPoints);
            }
            if (!Double.isFinite(sensitivity) || sensitivity < 0) {
                throw new InvalidInputException("sensitivity must be a finite value >= 0, got: " + sensitivity);
            }
            if (!Double.isFinite(minAbsoluteValue)) {
                throw new InvalidInputException("minAbsoluteValue must be finite, got: " + minAbsoluteValue);
            }
            if (!(dropRatio >= 0 && dropRatio < 1)) {
                throw new InvalidInputException("dropRatio must be in [0, 1), got: " + dropRatio);
            }
            if (!Double.isFinite(minBaselineForDrop) || minBaselineForDrop < 0) {
                throw new InvalidInputException("minBaselineForDrop must be >= 0, got: " + minBaselineForDrop);
            }
            if (!Double.isFinite(highSeverityMultiplier) || highSeverityMultiplier < 1) {
                throw new InvalidInputException(
                        "highSeverityMultiplier must be >= 1, got: " + highSeverityMultiplier);
            }
            if (seasonalityPeriodHours < 0) {
                throw new InvalidInputException(
                        "seasonalityPeriodHours must be >= 0, got: " + seasonalityPeriodHours);
            }
            return new DetectionPolicy(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionPolicy that))
            return false;
        return baselineWindow == that.baselineWindow
                && evaluationPoints == that.evaluationPoints
                && Double.compare(sensitivity, that.sensitivity) == 0
                && Double.compare(minAbsoluteValue, that.minAbsoluteValue) == 0
                && Double.compare(dropRatio, that.dropRatio) == 0
                && Double.compare(minBaselineForDrop, that.minBaselineForDrop) == 0
                && Double.compare(highSeverityMultiplier, that.highSeverityMultiplier) == 0
                && seasonalityPeriodHours == that.seasonalityPeriodHours;
    }

    @Override
    public int hashCode() {
        return Objects.hash(baselineWindow, evaluationPoints, sensitivity, minAbsoluteValue,
                dropRatio, minBaselineForDrop, highSeverityMultiplier, seasonalityPeriodHours);
    }

    @Override
    public String toString() {
        return "DetectionPolicy{" +
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
