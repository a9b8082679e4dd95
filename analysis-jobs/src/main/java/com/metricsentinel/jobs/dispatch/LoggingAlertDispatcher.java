package com.metricsentinel.jobs.dispatch;

import com.metricsentinel.core.model.AnomalyRecord;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.jobs.AlertDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link AlertDispatcher} that writes each record to the log as one line of
 * JSON. {@code HIGH} records are logged at WARN, the rest at INFO.
 *
 * <p>
 * Useful as the default dispatcher until a real transport is wired in, and
 * for dry runs.
 * </p>
 *
 * @since 1.0.0
 */
public class LoggingAlertDispatcher implements AlertDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertDispatcher.class);

    private final AnomalyRecordSerializer serializer;

    public LoggingAlertDispatcher() {
        this(new AnomalyRecordSerializer());
    }

    public LoggingAlertDispatcher(AnomalyRecordSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
    }

    @Override
    public void dispatch(AnomalyRecord record) {
        String json = serializer.toJson(record);
        if (record.getSeverity() == Severity.HIGH) {
            LOG.warn("ANOMALY {}", json);
        } else {
            LOG.info("ANOMALY {}", json);
        }
    }
}
