/**
 * Adapters from asynchronous metrics stores to
 * {@link com.metricsentinel.jobs.MetricsQueryClient}.
 */
package com.metricsentinel.jobs.query;
