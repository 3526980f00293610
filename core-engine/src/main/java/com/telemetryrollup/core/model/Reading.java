package com.telemetryrollup.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single validated telemetry reading produced by the ingest stage.
 *
 * <p>
 * Only the fields the rollup needs are kept: the originating device, the
 * numeric channels, the optional reading timestamp and the quality score
 * assigned at ingest. Anything else in the stored object is discarded while
 * parsing.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable, safe to share between worker threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class Reading {

    private final String deviceId;
    private final Map<String, Double> channels;
    private final Instant timestamp;
    private final double qualityScore;

    /**
     * @param deviceId     originating device; must not be {@code null}
     * @param channels     channel name to value; copied, must not be {@code null}
     * @param timestamp    reading time, or {@code null} when the producer omitted it
     * @param qualityScore ingest quality score in {@code [0, 1]}
     */
    public Reading(String deviceId, Map<String, Double> channels, Instant timestamp, double qualityScore) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        this.channels = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(channels, "channels must not be null")));
        this.timestamp = timestamp;
        this.qualityScore = qualityScore;
    }

    public String getDeviceId() {
        return deviceId;
    }

    /**
     * @return unmodifiable channel map, in the order the channels were parsed
     */
    public Map<String, Double> getChannels() {
        return channels;
    }

    /**
     * @param channel channel name
     * @return the channel value, or empty if this reading does not carry it
     */
    public Optional<Double> channel(String channel) {
        return Optional.ofNullable(channels.get(channel));
    }

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public double getQualityScore() {
        return qualityScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Reading that))
            return false;
        return Double.compare(qualityScore, that.qualityScore) == 0
                && deviceId.equals(that.deviceId)
                && channels.equals(that.channels)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, channels, timestamp, qualityScore);
    }

    @Override
    public String toString() {
        return "Reading{" +
                "deviceId='" + deviceId + '\'' +
                ", channels=" + channels +
                ", timestamp=" + timestamp +
                ", qualityScore=" + qualityScore +
                '}';
    }
}
