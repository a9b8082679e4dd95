package com.metricsentinel.jobs;

import com.metricsentinel.core.error.CollaboratorException;
import com.metricsentinel.core.model.AnomalyRecord;

/**
 * Receives every anomaly a job produces.
 *
 * <p>
 * Jobs call {@link #dispatch(AnomalyRecord)} exactly once per record and do
 * not retry failures; retries, persistence and delivery transport are the
 * implementation's concern.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertDispatcher {

    /**
     * @param record the anomaly to deliver
     * @throws CollaboratorException if delivery fails
     */
    void dispatch(AnomalyRecord record);
}
