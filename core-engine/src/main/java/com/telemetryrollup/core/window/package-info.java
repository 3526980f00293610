/**
 * Translation between time windows and store keys.
 *
 * @since 1.0.0
 */
package com.telemetryrollup.core.window;
