package com.telemetryrollup.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Structured outcome of one rollup invocation.
 *
 * <p>
 * A successful run carries the processed window, counts and the key of the
 * written rollup. A failed run carries only the window (when known) and the
 * error message.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "status", "processed_window", "aggregation_count", "summary_stats", "rollup_key",
        "discovered_objects", "failed_prefixes", "failed_objects", "anomaly_count", "error"})
public final class AggregationResult {

    public enum Status {
        @JsonProperty("success")
        SUCCESS,
        @JsonProperty("failure")
        FAILURE
    }

    private final Status status;
    private final TimeWindow processedWindow;
    private final Integer aggregationCount;
    private final RollupDocument.SummaryStats summaryStats;
    private final String rollupKey;
    private final Integer discoveredObjects;
    private final Integer failedPrefixes;
    private final Integer failedObjects;
    private final Integer anomalyCount;
    private final String error;

    private AggregationResult(Status status, TimeWindow processedWindow, Integer aggregationCount,
            RollupDocument.SummaryStats summaryStats, String rollupKey, Integer discoveredObjects,
            Integer failedPrefixes, Integer failedObjects, Integer anomalyCount, String error) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.processedWindow = processedWindow;
        this.aggregationCount = aggregationCount;
        this.summaryStats = summaryStats;
        this.rollupKey = rollupKey;
        this.discoveredObjects = discoveredObjects;
        this.failedPrefixes = failedPrefixes;
        this.failedObjects = failedObjects;
        this.anomalyCount = anomalyCount;
        this.error = error;
    }

    /**
     * @param document the persisted rollup
     * @param key      the key it was written under
     * @param window   the processed window
     * @return a success result summarising {@code document}
     */
    public static AggregationResult success(RollupDocument document, String key, TimeWindow window) {
        RollupDocument.Metadata metadata = document.getMetadata();
        int anomalies = document.getAggregations().stream()
                .mapToInt(aggregate -> aggregate.getAnomalies().getTotal())
                .sum();
        return new AggregationResult(Status.SUCCESS, window, document.getAggregations().size(),
                document.getSummaryStats(), key, metadata.getDiscoveredObjects(),
                metadata.getFailedPrefixes(), metadata.getFailedObjects(), anomalies, null);
    }

    /**
     * @param window the window that was being processed, or {@code null} if it
     *               could not be resolved
     * @param error  failure description
     * @return a failure result
     */
    public static AggregationResult failure(TimeWindow window, String error) {
        return new AggregationResult(Status.FAILURE, window, null, null, null,
                null, null, null, null, error);
    }

    @JsonProperty("status")
    public Status getStatus() {
        return status;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    @JsonProperty("processed_window")
    public TimeWindow getProcessedWindow() {
        return processedWindow;
    }

    @JsonProperty("aggregation_count")
    public Integer getAggregationCount() {
        return aggregationCount;
    }

    @JsonProperty("summary_stats")
    public RollupDocument.SummaryStats getSummaryStats() {
        return summaryStats;
    }

    @JsonProperty("rollup_key")
    public String getRollupKey() {
        return rollupKey;
    }

    @JsonProperty("discovered_objects")
    public Integer getDiscoveredObjects() {
        return discoveredObjects;
    }

    @JsonProperty("failed_prefixes")
    public Integer getFailedPrefixes() {
        return failedPrefixes;
    }

    @JsonProperty("failed_objects")
    public Integer getFailedObjects() {
        return failedObjects;
    }

    @JsonProperty("anomaly_count")
    public Integer getAnomalyCount() {
        return anomalyCount;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        if (status == Status.FAILURE) {
            return "AggregationResult{status=FAILURE, window=" + processedWindow + ", error='" + error + "'}";
        }
        return "AggregationResult{" +
                "status=" + status +
                ", window=" + processedWindow +
                ", aggregations=" + aggregationCount +
                ", rollupKey='" + rollupKey + '\'' +
                ", discovered=" + discoveredObjects +
                ", failedPrefixes=" + failedPrefixes +
                ", failedObjects=" + failedObjects +
                ", anomalies=" + anomalyCount +
                '}';
    }
}
