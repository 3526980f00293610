package com.telemetryrollup.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time interval {@code [start, end)} over which readings are rolled up.
 *
 * <p>
 * Instances are immutable. The constructor enforces {@code start < end}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"start_time", "end_time"})
public final class TimeWindow {

    private final Instant start;
    private final Instant end;

    /**
     * @param start inclusive lower bound; must not be {@code null}
     * @param end   exclusive upper bound; must not be {@code null}
     * @throws NullPointerException     if either bound is {@code null}
     * @throws IllegalArgumentException if {@code start} is not before {@code end}
     */
    public TimeWindow(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "Window start must not be null");
        this.end = Objects.requireNonNull(end, "Window end must not be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException(
                    "Window start must be before end, got: [" + start + ", " + end + ")");
        }
    }

    /**
     * Window of {@code hours} length ending at {@code end}.
     *
     * @param end   exclusive upper bound
     * @param hours window length in hours; must be &gt; 0
     * @return the window {@code [end - hours, end)}
     */
    public static TimeWindow precedingHours(Instant end, int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours must be > 0, got: " + hours);
        }
        return new TimeWindow(end.minus(Duration.ofHours(hours)), end);
    }

    @JsonProperty("start_time")
    public Instant getStart() {
        return start;
    }

    @JsonProperty("end_time")
    public Instant getEnd() {
        return end;
    }

    /**
     * @return window length expressed in (possibly fractional) hours
     */
    public double durationHours() {
        return Duration.between(start, end).toMillis() / 3_600_000.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeWindow that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
