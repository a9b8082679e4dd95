/**
 * JSON form of anomaly records and a log-backed
 * {@link com.metricsentinel.jobs.AlertDispatcher}.
 */
package com.metricsentinel.jobs.dispatch;
