package com.telemetryrollup.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The per-window artifact persisted by the rollup run.
 *
 * <p>
 * Serialized to JSON with the top-level fields {@code aggregations},
 * {@code summary_stats} and {@code metadata}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"aggregations", "summary_stats", "metadata"})
public final class RollupDocument {

    private final List<DeviceAggregate> aggregations;
    private final SummaryStats summaryStats;
    private final Metadata metadata;

    public RollupDocument(List<DeviceAggregate> aggregations, SummaryStats summaryStats, Metadata metadata) {
        this.aggregations = List.copyOf(Objects.requireNonNull(aggregations, "aggregations must not be null"));
        this.summaryStats = Objects.requireNonNull(summaryStats, "summaryStats must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
    }

    @JsonProperty("aggregations")
    public List<DeviceAggregate> getAggregations() {
        return aggregations;
    }

    @JsonProperty("summary_stats")
    public SummaryStats getSummaryStats() {
        return summaryStats;
    }

    @JsonProperty("metadata")
    public Metadata getMetadata() {
        return metadata;
    }

    /**
     * Window description and processing time of a run.
     */
    @JsonPropertyOrder({"processing_window", "processed_timestamp"})
    public static final class SummaryStats {

        private final ProcessingWindow processingWindow;
        private final Instant processedAt;

        public SummaryStats(TimeWindow window, Instant processedAt) {
            this.processingWindow = new ProcessingWindow(window);
            this.processedAt = Objects.requireNonNull(processedAt, "processedAt must not be null");
        }

        @JsonProperty("processing_window")
        public ProcessingWindow getProcessingWindow() {
            return processingWindow;
        }

        @JsonProperty("processed_timestamp")
        public Instant getProcessedAt() {
            return processedAt;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof SummaryStats that))
                return false;
            return processingWindow.equals(that.processingWindow) && processedAt.equals(that.processedAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(processingWindow, processedAt);
        }
    }

    @JsonPropertyOrder({"start_time", "end_time", "duration_hours"})
    public static final class ProcessingWindow {

        private final TimeWindow window;

        ProcessingWindow(TimeWindow window) {
            this.window = Objects.requireNonNull(window, "window must not be null");
        }

        @JsonProperty("start_time")
        public Instant getStart() {
            return window.getStart();
        }

        @JsonProperty("end_time")
        public Instant getEnd() {
            return window.getEnd();
        }

        @JsonProperty("duration_hours")
        public double getDurationHours() {
            return window.durationHours();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ProcessingWindow that))
                return false;
            return window.equals(that.window);
        }

        @Override
        public int hashCode() {
            return window.hashCode();
        }
    }

    /**
     * Run bookkeeping. The failure counters make skipped input visible even
     * though the run itself succeeded.
     */
    @JsonPropertyOrder({
            "total_sensors", "processing_timestamp", "discovered_objects",
            "failed_prefixes", "failed_objects"})
    public static final class Metadata {

        private final int deviceCount;
        private final Instant processedAt;
        private final int discoveredObjects;
        private final int failedPrefixes;
        private final int failedObjects;

        public Metadata(int deviceCount, Instant processedAt,
                int discoveredObjects, int failedPrefixes, int failedObjects) {
            this.deviceCount = deviceCount;
            this.processedAt = Objects.requireNonNull(processedAt, "processedAt must not be null");
            this.discoveredObjects = discoveredObjects;
            this.failedPrefixes = failedPrefixes;
            this.failedObjects = failedObjects;
        }

        @JsonProperty("total_sensors")
        public int getDeviceCount() {
            return deviceCount;
        }

        @JsonProperty("processing_timestamp")
        public Instant getProcessedAt() {
            return processedAt;
        }

        @JsonProperty("discovered_objects")
        public int getDiscoveredObjects() {
            return discoveredObjects;
        }

        @JsonProperty("failed_prefixes")
        public int getFailedPrefixes() {
            return failedPrefixes;
        }

        @JsonProperty("failed_objects")
        public int getFailedObjects() {
            return failedObjects;
        }
    }
}
