package com.telemetryrollup.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Number of flagged values per channel for one device, plus their sum.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"per_channel", "total_anomalies"})
public final class AnomalyReport {

    private final Map<String, Integer> perChannel;
    private final int total;

    /**
     * @param perChannel flagged count per channel; copied, iteration order kept
     */
    public AnomalyReport(Map<String, Integer> perChannel) {
        Objects.requireNonNull(perChannel, "perChannel must not be null");
        this.perChannel = Collections.unmodifiableMap(new LinkedHashMap<>(perChannel));
        this.total = perChannel.values().stream().mapToInt(Integer::intValue).sum();
    }

    public static AnomalyReport empty() {
        return new AnomalyReport(Map.of());
    }

    @JsonProperty("per_channel")
    public Map<String, Integer> getPerChannel() {
        return perChannel;
    }

    @JsonProperty("total_anomalies")
    public int getTotal() {
        return total;
    }

    /**
     * @param channel channel name
     * @return flagged count for the channel, 0 if it was not evaluated
     */
    public int countFor(String channel) {
        return perChannel.getOrDefault(channel, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyReport that))
            return false;
        return perChannel.equals(that.perChannel);
    }

    @Override
    public int hashCode() {
        return perChannel.hashCode();
    }

    @Override
    public String toString() {
        return "AnomalyReport{perChannel=" + perChannel + ", total=" + total + '}';
    }
}
