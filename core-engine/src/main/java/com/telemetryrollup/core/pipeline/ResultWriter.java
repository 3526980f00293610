package com.telemetryrollup.core.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.telemetryrollup.core.json.JsonSupport;
import com.telemetryrollup.core.model.DeviceAggregate;
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

/**
 * Assembles the {@link RollupDocument} of a run and persists it.
 *
 * <p>
 * The document is written once, as the last step of a run, under
 * {@link WindowKeyPlanner#rollupKey(Instant)}. Rerunning a window overwrites
 * the earlier document. A failed write is not retried here; the
 * {@link com.telemetryrollup.core.store.ObjectStoreException} reaches the
 * caller.
 * </p>
 *
 * @since 1.0.0
 */
public class ResultWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);

    static final String CONTENT_TYPE = "application/json";

    private final ObjectStore store;
    private final WindowKeyPlanner planner;
    private final Clock clock;
    private final ObjectWriter writer = JsonSupport.objectMapper().writerWithDefaultPrettyPrinter();

    public ResultWriter(ObjectStore store, WindowKeyPlanner planner, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Build the rollup document of a run.
     *
     * @param aggregates per-device aggregates, in output order
     * @param window     processed window
     * @param discovery  discovery outcome, for failure bookkeeping
     * @param load       load outcome, for failure bookkeeping
     * @return the document
     */
    public RollupDocument assemble(List<DeviceAggregate> aggregates, TimeWindow window,
            DiscoveryReport discovery, LoadReport load) {
        Instant processedAt = clock.instant();
        return new RollupDocument(
                aggregates,
                new RollupDocument.SummaryStats(window, processedAt),
                new RollupDocument.Metadata(
                        aggregates.size(),
                        processedAt,
                        discovery.getKeys().size(),
                        discovery.getFailures().size(),
                        load.getFailures().size()));
    }

    /**
     * Build and persist a document with no recorded input failures.
     *
     * @return the key written
     */
    public String write(List<DeviceAggregate> aggregates, TimeWindow window) {
        return write(assemble(aggregates, window, DiscoveryReport.empty(), LoadReport.empty()), window);
    }

    /**
     * @param document the document to persist
     * @param window   processed window; its end determines the key
     * @return the key written
     * @throws com.telemetryrollup.core.store.ObjectStoreException if the write fails
     */
    public String write(RollupDocument document, TimeWindow window) {
        String key = planner.rollupKey(window.getEnd());
        byte[] body = serialize(document);
        store.put(key, body, CONTENT_TYPE);
        LOG.info("Stored rollup of {} device(s) at {}", document.getAggregations().size(), key);
        return key;
    }

    /**
     * @param document the document
     * @return pretty-printed UTF-8 JSON
     */
    public byte[] serialize(RollupDocument document) {
        try {
            return writer.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rollup document", e);
        }
    }
}
