package com.telemetryrollup.job;

import com.telemetryrollup.core.model.AggregationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters describing rollup runs.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code rollup.runs} - runs, tagged {@code outcome=success|failure}</li>
 *   <li>{@code rollup.run.duration} - wall-clock time of a run</li>
 *   <li>{@code rollup.devices} - device aggregates written</li>
 *   <li>{@code rollup.objects.discovered} - reading objects listed</li>
 *   <li>{@code rollup.objects.failed} - reading objects skipped</li>
 *   <li>{@code rollup.prefixes.failed} - partition listings that failed</li>
 *   <li>{@code rollup.anomalies} - anomalies flagged across all devices</li>
 * </ul>
 */
public class RollupMetrics {

    private final Counter successfulRuns;
    private final Counter failedRuns;
    private final Timer runDuration;
    private final Counter devices;
    private final Counter discoveredObjects;
    private final Counter failedObjects;
    private final Counter failedPrefixes;
    private final Counter anomalies;

    public RollupMetrics(MeterRegistry registry) {
        this.successfulRuns = Counter.builder("rollup.runs")
                .description("Rollup runs by outcome")
                .tag("outcome", "success")
                .register(registry);
        this.failedRuns = Counter.builder("rollup.runs")
                .description("Rollup runs by outcome")
                .tag("outcome", "failure")
                .register(registry);
        this.runDuration = Timer.builder("rollup.run.duration")
                .description("Wall-clock time of one rollup run")
                .register(registry);
        this.devices = Counter.builder("rollup.devices")
                .description("Device aggregates written")
                .register(registry);
        this.discoveredObjects = Counter.builder("rollup.objects.discovered")
                .description("Reading objects listed under the window's partitions")
                .register(registry);
        this.failedObjects = Counter.builder("rollup.objects.failed")
                .description("Reading objects skipped because they could not be fetched or parsed")
                .register(registry);
        this.failedPrefixes = Counter.builder("rollup.prefixes.failed")
                .description("Partition prefixes whose listing failed")
                .register(registry);
        this.anomalies = Counter.builder("rollup.anomalies")
                .description("Anomalies flagged across all devices")
                .register(registry);
    }

    /**
     * @param result  outcome of the run
     * @param elapsed wall-clock duration of the run
     */
    public void record(AggregationResult result, Duration elapsed) {
        runDuration.record(elapsed);
        if (!result.isSuccess()) {
            failedRuns.increment();
            return;
        }
        successfulRuns.increment();
        devices.increment(result.getAggregationCount());
        discoveredObjects.increment(result.getDiscoveredObjects());
        failedObjects.increment(result.getFailedObjects());
        failedPrefixes.increment(result.getFailedPrefixes());
        anomalies.increment(result.getAnomalyCount());
    }
}
