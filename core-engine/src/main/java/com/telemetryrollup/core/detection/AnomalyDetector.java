package com.telemetryrollup.core.detection;

import com.telemetryrollup.core.model.AnomalyReport;
import com.telemetryrollup.core.model.Reading;

import java.util.List;

/**
 * Contract for per-device anomaly detectors.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: each call receives the
 * complete reading set of one device for one window, so a single instance can
 * be shared by all worker threads of a run.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate one device's readings.
     *
     * @param readings the device's readings for the window; must not be
     *                 {@code null}
     * @return flagged counts per channel
     */
    AnomalyReport detect(List<Reading> readings);

    /**
     * @return short name of the detection method, used in logs
     */
    String getName();
}
