package com.metricsentinel.core.model;

/**
 * Direction of a half-window trend comparison.
 *
 * @since 1.0.0
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
