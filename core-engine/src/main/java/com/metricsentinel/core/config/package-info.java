/**
 * Configuration loading and validation for the analysis jobs.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.metricsentinel.core.config.ConfigLoader} into an
 * {@link com.metricsentinel.core.config.AnalysisConfig} instance. Validation
 * runs automatically after parsing and raises
 * {@link com.metricsentinel.core.error.ConfigurationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.config;
