/**
 * Numeric primitives: mean, population standard deviation and z-score
 * outlier counting.
 *
 * @since 1.0.0
 */
package com.telemetryrollup.core.stats;
