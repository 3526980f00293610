package com.telemetryrollup.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Aggregate view of the ingest quality scores of one device's readings.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"avg_score", "high_quality_count", "low_quality_count"})
public final class QualitySummary {

    private final double avgScore;
    private final int highQualityCount;
    private final int lowQualityCount;

    public QualitySummary(double avgScore, int highQualityCount, int lowQualityCount) {
        this.avgScore = avgScore;
        this.highQualityCount = highQualityCount;
        this.lowQualityCount = lowQualityCount;
    }

    @JsonProperty("avg_score")
    public double getAvgScore() {
        return avgScore;
    }

    /** Readings scoring strictly above the high-quality threshold. */
    @JsonProperty("high_quality_count")
    public int getHighQualityCount() {
        return highQualityCount;
    }

    /** Readings scoring strictly below the low-quality threshold. */
    @JsonProperty("low_quality_count")
    public int getLowQualityCount() {
        return lowQualityCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QualitySummary that))
            return false;
        return Double.compare(avgScore, that.avgScore) == 0
                && highQualityCount == that.highQualityCount
                && lowQualityCount == that.lowQualityCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(avgScore, highQualityCount, lowQualityCount);
    }

    @Override
    public String toString() {
        return "QualitySummary{avgScore=" + avgScore
                + ", high=" + highQualityCount
                + ", low=" + lowQualityCount + '}';
    }
}
