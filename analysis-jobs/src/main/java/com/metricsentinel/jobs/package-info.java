/**
 * Domain analysis jobs and the collaborator contracts they run against.
 *
 * <p>
 * {@link com.metricsentinel.jobs.CostAnomalyJob} and
 * {@link com.metricsentinel.jobs.LogAnomalyJob} pull series through a
 * {@link com.metricsentinel.jobs.MetricsQueryClient}, run them through the
 * detector and hand anomalies to an
 * {@link com.metricsentinel.jobs.AlertDispatcher}.
 * {@link com.metricsentinel.jobs.AnalysisEngine} wires them together.
 * </p>
 */
package com.metricsentinel.jobs;
