package com.metricsentinel.core.model;

/**
 * Coarse anomaly tier used for downstream notification routing.
 *
 * @since 1.0.0
 */
public enum Severity {
    MEDIUM,
    HIGH
}
