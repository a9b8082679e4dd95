package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Anomaly found by a detector for one evaluation point.
 *
 * <p>
 * Created per analysis run and handed straight to the alert dispatcher. The
 * engine never stores records; persistence, if any, belongs to the
 * dispatcher.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metricKind}, {@code source},
 * {@code timestamp}, {@code severity} and {@code kind} are required; omitting
 * any of them throws {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "checkName", "metricKind", "source", "timestamp", "kind", "severity",
        "observedValue", "baselineMean", "threshold", "details" })
public final class AnomalyRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Name of the check that produced the record, e.g. {@code error_count}. */
    private final String checkName;

    private final MetricKind metricKind;

    /** Service name, log group, ... */
    private final String source;

    /** Timestamp of the evaluated point. */
    private final Instant timestamp;

    private final double observedValue;
    private final double baselineMean;
    private final double threshold;
    private final Severity severity;
    private final AnomalyKind kind;

    /** Human-readable description of what was detected. */
    private final String details;

    private AnomalyRecord(Builder builder) {
        this.metricKind = Objects.requireNonNull(builder.metricKind, "metricKind must not be null");
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.checkName = builder.checkName != null ? builder.checkName : metricKind.label();
        this.observedValue = builder.observedValue;
        this.baselineMean = builder.baselineMean;
        this.threshold = builder.threshold;
        this.details = builder.details;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this record with a different check name.
     */
    public AnomalyRecord withCheckName(String checkName) {
        return toBuilder().checkName(checkName).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .checkName(checkName)
                .metricKind(metricKind)
                .source(source)
                .timestamp(timestamp)
                .observedValue(observedValue)
                .baselineMean(baselineMean)
                .threshold(threshold)
                .severity(severity)
                .kind(kind)
                .details(details);
    }

    /**
     * Fluent builder for {@link AnomalyRecord} instances.
     */
    public static class Builder {
        private String checkName;
        private MetricKind metricKind;
        private String source;
        private Instant timestamp;
        private double observedValue;
        private double baselineMean;
        private double threshold;
        private Severity severity;
        private AnomalyKind kind;
        private String details;

        public Builder checkName(String checkName) {
            this.checkName = checkName;
            return this;
        }

        public Builder metricKind(MetricKind metricKind) {
            this.metricKind = metricKind;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder observedValue(double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        public Builder baselineMean(double baselineMean) {
            this.baselineMean = baselineMean;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder kind(AnomalyKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * @return a new {@link AnomalyRecord}
         * @throws NullPointerException if a required field is missing
         */
        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }

    public String getCheckName() {
        return checkName;
    }

    public MetricKind getMetricKind() {
        return metricKind;
    }

    public String getSource() {
        return source;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getObservedValue() {
        return observedValue;
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getThreshold() {
        return threshold;
    }

    public Severity getSeverity() {
        return severity;
    }

    public AnomalyKind getKind() {
        return kind;
    }

    public String getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Objects.equals(checkName, that.checkName)
                && metricKind == that.metricKind
                && source.equals(that.source)
                && timestamp.equals(that.timestamp)
                && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkName, metricKind, source, timestamp, kind);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "checkName='" + checkName + '\'' +
                ", source='" + source + '\'' +
                ", timestamp=" + timestamp +
                ", kind=" + kind +
                ", severity=" + severity +
                ", observedValue=" + observedValue +
                ", threshold=" + threshold +
                '}';
    }
}
