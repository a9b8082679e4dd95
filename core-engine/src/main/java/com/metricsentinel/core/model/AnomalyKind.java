package com.metricsentinel.core.model;

/**
 * Whether a value was abnormally above ({@link #SPIKE}) or below
 * ({@link #DROP}) its expected range.
 *
 * @since 1.0.0
 */
public enum AnomalyKind {
    SPIKE,
    DROP
}
