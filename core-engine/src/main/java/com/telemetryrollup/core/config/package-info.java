/**
 * Configuration loading and validation for the rollup engine.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.telemetryrollup.core.config.AggregationConfigLoader} into an
 * {@link com.telemetryrollup.core.config.AggregationConfig}, validated right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetryrollup.core.config;
