package com.telemetryrollup.core.pipeline;

import com.telemetryrollup.core.config.AggregationConfig;
import com.telemetryrollup.core.detection.AnomalyDetector;
import com.telemetryrollup.core.detection.ZScoreAnomalyDetector;
import com.telemetryrollup.core.model.AggregationResult;
import com.telemetryrollup.core.model.DeviceAggregate;
import com.telemetryrollup.core.model.DeviceGroup;
import com.telemetryrollup.core.model.RollupDocument;
import com.telemetryrollup.core.model.TimeWindow;
import com.telemetryrollup.core.store.ObjectStore;
import com.telemetryrollup.core.window.WindowKeyPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one rollup of a time window end to end.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   WindowKeyPlanner   → partition prefixes
 *     → ObjectDiscovery  → object keys
 *     → RecordLoader     → readings grouped by device
 *     → Aggregator (+ AnomalyDetector), one task per device
 *     → ResultWriter     → rollup document at a key derived from the window end
 * </pre>
 *
 * <h3>Failure policy</h3>
 * <p>
 * Listing, fetch and parse failures are absorbed per item and counted in the
 * result. Only the final write can fail a run. {@link #run(TimeWindow)} lets
 * that failure propagate; {@link #invoke(Instant, Instant)} turns it into a
 * {@link AggregationResult.Status#FAILURE} result.
 * </p>
 *
 * <h3>Threads</h3>
 * <p>
 * The engine owns a fixed pool of {@code fetchParallelism} threads used for
 * listing, fetching and per-device aggregation. Runs share no mutable state,
 * so a single engine may run several windows in sequence. Close the engine to
 * release the pool.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationEngine.class);

    private final WindowKeyPlanner planner;
    private final ObjectDiscovery discovery;
    private final RecordLoader loader;
    private final Aggregator aggregator;
    private final ResultWriter writer;
    private final Clock clock;
    private final int windowHours;
    private final ExecutorService executor;

    /**
     * @param store  object store holding readings and receiving rollups
     * @param config validated engine configuration
     * @param clock  time source for default windows and timestamps
     */
    public AggregationEngine(ObjectStore store, AggregationConfig config, Clock clock) {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        config.validate();

        this.executor = Executors.newFixedThreadPool(config.getFetchParallelism(), workerThreadFactory());
        this.windowHours = config.getWindowHours();
        this.planner = new WindowKeyPlanner(config.getInputRoot(), config.getOutputRoot());
        this.discovery = new ObjectDiscovery(store, executor);
        this.loader = new RecordLoader(store, new ReadingParser(config.getChannels()), executor);

        AnomalyDetector detector = new ZScoreAnomalyDetector(config.getChannels(), config.getZscoreThreshold());
        this.aggregator = new Aggregator(config.getChannels(), config.getHighQualityThreshold(),
                config.getLowQualityThreshold(), detector, clock);
        this.writer = new ResultWriter(store, planner, clock);
    }

    /**
     * Invocation entry point. Both bounds {@code null} selects the
     * {@code windowHours} preceding now; otherwise both must be given.
     * Never throws: every fatal error becomes a failure result.
     *
     * @param start window start, or {@code null}
     * @param end   window end, or {@code null}
     * @return the run outcome
     */
    public AggregationResult invoke(Instant start, Instant end) {
        TimeWindow window;
        try {
            window = resolveWindow(start, end);
        } catch (IllegalArgumentException e) {
            LOG.error("Rejected rollup invocation: {}", e.getMessage());
            return AggregationResult.failure(null, e.getMessage());
        }
        try {
            return run(window);
        } catch (RuntimeException e) {
            LOG.error("Rollup of window {} failed", window, e);
            return AggregationResult.failure(window, e.getMessage());
        }
    }

    /**
     * Roll up {@code window}.
     *
     * @param window the window
     * @return a success result
     * @throws com.telemetryrollup.core.store.ObjectStoreException if the rollup
     *                                                             cannot be written
     */
    public AggregationResult run(TimeWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        long startNanos = System.nanoTime();
        LOG.info("Starting rollup of window {}", window);

        List<String> prefixes = planner.partitionPrefixes(window);
        DiscoveryReport discovered = discovery.discover(prefixes);
        LoadReport loaded = discovered.isEmpty() ? LoadReport.empty() : loader.load(discovered.getKeys());
        List<DeviceAggregate> aggregates = aggregateDevices(loaded.getDeviceGroup(), window);

        RollupDocument document = writer.assemble(aggregates, window, discovered, loaded);
        String key = writer.write(document, window);
        AggregationResult result = AggregationResult.success(document, key, window);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        int failures = discovered.getFailures().size() + loaded.getFailures().size();
        if (failures > 0) {
            LOG.warn("Rollup of window {} completed in {} ms with {} skipped input(s): "
                            + "{} prefix listing failure(s), {} object failure(s)",
                    window, durationMs, failures, discovered.getFailures().size(), loaded.getFailures().size());
        } else {
            LOG.info("Rollup of window {} completed in {} ms", window, durationMs);
        }
        LOG.info("Rollup summary: {}", result);
        return result;
    }

    /**
     * @param start window start, or {@code null}
     * @param end   window end, or {@code null}
     * @return the explicit window, or the default window ending now
     * @throws IllegalArgumentException if exactly one bound is given or the
     *                                  bounds are out of order
     */
    public TimeWindow resolveWindow(Instant start, Instant end) {
        if (start == null && end == null) {
            return TimeWindow.precedingHours(clock.instant(), windowHours);
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window start and end must be given together");
        }
        return new TimeWindow(start, end);
    }

    private List<DeviceAggregate> aggregateDevices(DeviceGroup group, TimeWindow window) {
        if (group.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<DeviceAggregate>> tasks = group.asMap().entrySet().stream()
                .map(entry -> CompletableFuture.supplyAsync(
                        () -> aggregator.aggregate(entry.getKey(), entry.getValue(), window), executor))
                .toList();
        try {
            return tasks.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Device aggregation failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "rollup-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
