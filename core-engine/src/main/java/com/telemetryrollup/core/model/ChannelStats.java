package com.telemetryrollup.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Summary statistics of one numeric channel over a device's readings.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"avg", "min", "max", "std"})
public final class ChannelStats {

    private final double avg;
    private final double min;
    private final double max;
    private final double std;

    public ChannelStats(double avg, double min, double max, double std) {
        this.avg = avg;
        this.min = min;
        this.max = max;
        this.std = std;
    }

    @JsonProperty("avg")
    public double getAvg() {
        return avg;
    }

    @JsonProperty("min")
    public double getMin() {
        return min;
    }

    @JsonProperty("max")
    public double getMax() {
        return max;
    }

    /** Population standard deviation. */
    @JsonProperty("std")
    public double getStd() {
        return std;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChannelStats that))
            return false;
        return Double.compare(avg, that.avg) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && Double.compare(std, that.std) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(avg, min, max, std);
    }

    @Override
    public String toString() {
        return "ChannelStats{avg=" + avg + ", min=" + min + ", max=" + max + ", std=" + std + '}';
    }
}
