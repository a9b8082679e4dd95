/**
 * Error taxonomy shared by the engine and the analysis jobs.
 *
 * <p>
 * Insufficient data is deliberately absent: it is never an error and is
 * expressed through default results.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.error;
