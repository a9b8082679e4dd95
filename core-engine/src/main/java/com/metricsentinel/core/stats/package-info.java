/**
 * Statistics used by the detectors: thresholds, trends, percentiles and the
 * seasonality heuristic. Everything here is static and side-effect free.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.stats;
