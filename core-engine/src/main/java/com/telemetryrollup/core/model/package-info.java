/**
 * Domain model of the telemetry rollup.
 *
 * <p>
 * Inputs, intermediate groupings and outputs of a rollup run:
 * </p>
 * <ul>
 * <li>{@link com.telemetryrollup.core.model.Reading}: one parsed telemetry
 * reading</li>
 * <li>{@link com.telemetryrollup.core.model.TimeWindow}: the half-open window
 * being rolled up</li>
 * <li>{@link com.telemetryrollup.core.model.DeviceGroup}: readings grouped by
 * device</li>
 * <li>{@link com.telemetryrollup.core.model.DeviceAggregate}: per-device
 * statistics</li>
 * <li>{@link com.telemetryrollup.core.model.RollupDocument}: the persisted
 * artifact</li>
 * <li>{@link com.telemetryrollup.core.model.AggregationResult}: the structured
 * outcome returned to the caller</li>
 * </ul>
 *
 * <p>
 * All types are immutable. JSON field names are fixed through
 * {@code @JsonProperty} so that the stored layout does not depend on Java
 * naming.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetryrollup.core.model;
