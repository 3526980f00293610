package com.telemetryrollup.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rolled-up statistics of one device over one window.
 *
 * <p>
 * One instance is built per device per run and written into the rollup
 * document; it is never mutated afterwards.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code deviceId}, {@code window},
 * {@code quality}, {@code anomalies} and {@code processedAt} are required;
 * omitting any of them throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({
        "sensor_id", "aggregation_window", "record_count", "channels",
        "data_quality", "anomaly_detection", "processed_timestamp"})
public final class DeviceAggregate {

    private final String deviceId;
    private final TimeWindow window;
    private final int recordCount;
    private final Map<String, ChannelStats> channels;
    private final QualitySummary quality;
    private final AnomalyReport anomalies;
    private final Instant processedAt;

    private DeviceAggregate(Builder builder) {
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId must not be null");
        this.window = Objects.requireNonNull(builder.window, "window must not be null");
        this.recordCount = builder.recordCount;
        this.channels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.channels));
        this.quality = Objects.requireNonNull(builder.quality, "quality must not be null");
        this.anomalies = Objects.requireNonNull(builder.anomalies, "anomalies must not be null");
        this.processedAt = Objects.requireNonNull(builder.processedAt, "processedAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DeviceAggregate}.
     */
    public static class Builder {
        private String deviceId;
        private TimeWindow window;
        private int recordCount;
        private final Map<String, ChannelStats> channels = new LinkedHashMap<>();
        private QualitySummary quality;
        private AnomalyReport anomalies;
        private Instant processedAt;

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder window(TimeWindow window) {
            this.window = window;
            return this;
        }

        public Builder recordCount(int recordCount) {
            this.recordCount = recordCount;
            return this;
        }

        public Builder channel(String name, ChannelStats stats) {
            this.channels.put(name, stats);
            return this;
        }

        public Builder quality(QualitySummary quality) {
            this.quality = quality;
            return this;
        }

        public Builder anomalies(AnomalyReport anomalies) {
            this.anomalies = anomalies;
            return this;
        }

        public Builder processedAt(Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }

        public DeviceAggregate build() {
            return new DeviceAggregate(this);
        }
    }

    @JsonProperty("sensor_id")
    public String getDeviceId() {
        return deviceId;
    }

    @JsonProperty("aggregation_window")
    public TimeWindow getWindow() {
        return window;
    }

    @JsonProperty("record_count")
    public int getRecordCount() {
        return recordCount;
    }

    /**
     * @return unmodifiable map of the channels present in at least one reading
     */
    @JsonProperty("channels")
    public Map<String, ChannelStats> getChannels() {
        return channels;
    }

    @JsonProperty("data_quality")
    public QualitySummary getQuality() {
        return quality;
    }

    @JsonProperty("anomaly_detection")
    public AnomalyReport getAnomalies() {
        return anomalies;
    }

    @JsonProperty("processed_timestamp")
    public Instant getProcessedAt() {
        return processedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeviceAggregate that))
            return false;
        return recordCount == that.recordCount
                && deviceId.equals(that.deviceId)
                && window.equals(that.window)
                && channels.equals(that.channels)
                && quality.equals(that.quality)
                && anomalies.equals(that.anomalies)
                && processedAt.equals(that.processedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, window, recordCount, channels, quality, anomalies, processedAt);
    }

    @Override
    public String toString() {
        return "DeviceAggregate{" +
                "deviceId='" + deviceId + '\'' +
                ", window=" + window +
                ", recordCount=" + recordCount +
                ", channels=" + channels.keySet() +
                ", anomalies=" + anomalies.getTotal() +
                '}';
    }
}
