/**
 * Object store abstraction the engine reads raw readings from and writes
 * rollups to.
 *
 * @since 1.0.0
 */
package com.telemetryrollup.core.store;
