/**
 * Value objects for Metric Sentinel.
 *
 * <p>
 * Everything here is constructed fresh per analysis run and never outlives
 * it:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.model.TimeSeries}: ordered samples for
 * one source and metric kind</li>
 * <li>{@link com.metricsentinel.core.model.ThresholdResult},
 * {@link com.metricsentinel.core.model.TrendResult},
 * {@link com.metricsentinel.core.model.PercentileSet},
 * {@link com.metricsentinel.core.model.SeasonalityVerdict}: statistics
 * outputs</li>
 * <li>{@link com.metricsentinel.core.model.AnomalyRecord}: detector output
 * handed to the alert dispatcher</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.model;
