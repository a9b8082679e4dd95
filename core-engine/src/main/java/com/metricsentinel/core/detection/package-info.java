/**
 * Anomaly detection over a single time series.
 *
 * <p>
 * {@link com.metricsentinel.core.detection.AnomalyDetector} combines the
 * threshold statistics and the seasonality gate from
 * {@code com.metricsentinel.core.stats}; each domain check tunes it through
 * its own {@link com.metricsentinel.core.detection.DetectionPolicy}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.detection;
