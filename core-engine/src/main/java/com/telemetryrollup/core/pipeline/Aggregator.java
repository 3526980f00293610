package com.telemetryrollup.core.pipeline;

import com.telemetryrollup.core.detection.AnomalyDetector;
import com.telemetryrollup.core.model.ChannelStats;
import com.telemetryrollup.core.model.DeviceAggregate;
import com.telemetryrollup.core.model.QualitySummary;
import com.telemetryrollup.core.model.Reading;
import com.telemetryrollup.core.model.TimeWindow;
import com.telemetryrollup.core.stats.StatMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the {@link DeviceAggregate} of one device.
 *
 * <p>
 * Readings may carry different channel sets. Each configured channel is
 * summarised over the readings that carry it; a channel no reading carries is
 * omitted rather than zero-filled. The record count and the quality summary
 * always cover every reading of the device.
 * </p>
 *
 * <p>
 * Stateless apart from its configuration; safe to call from several threads.
 * </p>
 *
 * @since 1.0.0
 */
public class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    private final List<String> channels;
    private final double highQualityThreshold;
    private final double lowQualityThreshold;
    private final AnomalyDetector detector;
    private final Clock clock;

    /**
     * @param channels             channel names, in output order
     * @param highQualityThreshold scores strictly above count as high quality
     * @param lowQualityThreshold  scores strictly below count as low quality
     * @param detector             anomaly detector applied to each device
     * @param clock                source of {@code processedAt}
     */
    public Aggregator(List<String> channels, double highQualityThreshold, double lowQualityThreshold,
            AnomalyDetector detector, Clock clock) {
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels must not be null"));
        this.highQualityThreshold = highQualityThreshold;
        this.lowQualityThreshold = lowQualityThreshold;
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param deviceId device id
     * @param readings the device's readings; must not be empty
     * @param window   the window being rolled up
     * @return the device aggregate
     * @throws IllegalArgumentException if {@code readings} is empty
     */
    public DeviceAggregate aggregate(String deviceId, List<Reading> readings, TimeWindow window) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        Objects.requireNonNull(readings, "readings must not be null");
        if (readings.isEmpty()) {
            throw new IllegalArgumentException("No readings to aggregate for device " + deviceId);
        }

        DeviceAggregate.Builder builder = DeviceAggregate.builder()
                .deviceId(deviceId)
                .window(window)
                .recordCount(readings.size());

        for (String channel : channels) {
            List<Double> values = valuesOf(channel, readings);
            if (!values.isEmpty()) {
                builder.channel(channel, channelStats(values));
            }
        }

        DeviceAggregate aggregate = builder
                .quality(qualitySummary(readings))
                .anomalies(detector.detect(readings))
                .processedAt(clock.instant())
                .build();

        LOG.debug("Aggregated device {}: {} reading(s), channels={}, anomalies={}",
                deviceId, readings.size(), aggregate.getChannels().keySet(), aggregate.getAnomalies().getTotal());
        return aggregate;
    }

    static ChannelStats channelStats(List<Double> values) {
        return new ChannelStats(
                StatMath.mean(values),
                StatMath.min(values),
                StatMath.max(values),
                StatMath.populationStdDev(values));
    }

    private QualitySummary qualitySummary(List<Reading> readings) {
        List<Double> scores = new ArrayList<>(readings.size());
        int high = 0;
        int low = 0;
        for (Reading reading : readings) {
            double score = reading.getQualityScore();
            scores.add(score);
            if (score > highQualityThreshold) {
                high++;
            } else if (score < lowQualityThreshold) {
                low++;
            }
        }
        return new QualitySummary(StatMath.mean(scores), high, low);
    }

    private static List<Double> valuesOf(String channel, List<Reading> readings) {
        List<Double> values = new ArrayList<>();
        for (Reading reading : readings) {
            reading.channel(channel).ifPresent(values::add);
        }
        return values;
    }
}
