/**
 * Runnable rollup job.
 *
 * <p>
 * This package wires the core aggregation engine to a concrete object store
 * (S3 or a local directory), resolves job settings from the environment and
 * reports each run as structured JSON plus Micrometer meters.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.telemetryrollup.job.RollupJob}: main entry point</li>
 * <li>{@link com.telemetryrollup.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.telemetryrollup.job.S3ObjectStore}: S3 adapter</li>
 * <li>{@link com.telemetryrollup.job.RollupMetrics}: run meters</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.telemetryrollup.job;
