/**
 * The rollup pipeline.
 *
 * <p>
 * {@link com.telemetryrollup.core.pipeline.AggregationEngine} wires the stages:
 * </p>
 * <ul>
 * <li>{@link com.telemetryrollup.core.pipeline.ObjectDiscovery}: list keys per
 * partition prefix</li>
 * <li>{@link com.telemetryrollup.core.pipeline.RecordLoader}: fetch, parse and
 * group readings by device</li>
 * <li>{@link com.telemetryrollup.core.pipeline.Aggregator}: per-device
 * statistics and anomaly counts</li>
 * <li>{@link com.telemetryrollup.core.pipeline.ResultWriter}: persist the
 * rollup document</li>
 * </ul>
 *
 * <p>
 * Per-item problems travel as {@link com.telemetryrollup.core.pipeline.ItemOutcome}
 * values and are summarised in the run result.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetryrollup.core.pipeline;
