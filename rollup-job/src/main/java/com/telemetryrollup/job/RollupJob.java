package com.telemetryrollup.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.telemetryrollup.core.config.AggregationConfig;
import com.telemetryrollup.core.config.AggregationConfigLoader;
import com.telemetryrollup.core.json.JsonSupport;
import com.telemetryrollup.core.model.AggregationResult;
import com.telemetryrollup.core.pipeline.AggregationEngine;
import com.telemetryrollup.core.store.FileSystemObjectStore;
import com.telemetryrollup.core.store.ObjectStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point of the telemetry rollup job.
 *
 * <h3>Run</h3>
 *
 * <pre>
 *   JobConfig (env + args)
 *     → AggregationConfig (ROLLUP_CONFIG_PATH / classpath rollup.yml)
 *     → ObjectStore (S3 bucket or local directory)
 *     → AggregationEngine.invoke(start, end)
 *     → result JSON on the log, metrics, exit status
 * </pre>
 *
 * <h3>Exit status</h3>
 * <p>
 * {@code 0} when the rollup was written, {@code 1} when the run failed.
 * Configuration errors are thrown before any store access.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollupJob {

    private static final Logger LOG = LoggerFactory.getLogger(RollupJob.class);

    private RollupJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment().withArgs(args);
        LOG.info("Starting telemetry rollup with config: {}", config);
        AggregationConfig aggregationConfig = loadAggregationConfig(config);
        LOG.info("Aggregation config: {}", aggregationConfig);

        // 2. Run against the configured store
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RollupMetrics metrics = new RollupMetrics(registry);
        AggregationResult result;
        if (config.getStoreType() == JobConfig.StoreType.S3) {
            try (S3Client s3 = S3Client.builder().region(Region.of(config.getAwsRegion())).build()) {
                result = execute(config, aggregationConfig,
                        new S3ObjectStore(s3, config.getS3Bucket()), Clock.systemUTC(), metrics);
            }
        } else {
            result = execute(config, aggregationConfig,
                    new FileSystemObjectStore(config.getStoreRoot()), Clock.systemUTC(), metrics);
        }

        // 3. Report
        LOG.info("Run metrics:\n{}", registry.getMetersAsString());
        if (!result.isSuccess()) {
            System.exit(1);
        }
    }

    // ---------------------------------------------------------------
    // Run (extracted for testability)
    // ---------------------------------------------------------------

    /**
     * Roll up the configured window once.
     *
     * @return the run outcome; never {@code null}
     */
    static AggregationResult execute(JobConfig config, AggregationConfig aggregationConfig,
            ObjectStore store, Clock clock, RollupMetrics metrics) {
        long startNanos = System.nanoTime();
        AggregationResult result;
        try (AggregationEngine engine = new AggregationEngine(store, aggregationConfig, clock)) {
            result = engine.invoke(config.getWindowStart(), config.getWindowEnd());
        }
        metrics.record(result, Duration.ofNanos(System.nanoTime() - startNanos));

        if (result.isSuccess()) {
            LOG.info("Rollup result: {}", toJson(result));
        } else {
            LOG.error("Rollup result: {}", toJson(result));
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static AggregationConfig loadAggregationConfig(JobConfig config) {
        String path = config.getRollupConfigPath();
        if (path != null && !path.isBlank()) {
            return AggregationConfigLoader.fromFile(path);
        }
        return AggregationConfigLoader.load();
    }

    static String toJson(AggregationResult result) {
        try {
            return JsonSupport.objectMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rollup result", e);
        }
    }
}
