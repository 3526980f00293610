/**
 * Anomaly detection over one device's readings.
 *
 * <p>
 * Detectors implement
 * {@link com.telemetryrollup.core.detection.AnomalyDetector}. The built-in
 * {@link com.telemetryrollup.core.detection.ZScoreAnomalyDetector} flags values
 * outside mean ± N × σ per channel.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetryrollup.core.detection;
