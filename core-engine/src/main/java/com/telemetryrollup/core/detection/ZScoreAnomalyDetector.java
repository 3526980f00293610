package com.telemetryrollup.core.detection;

import com.telemetryrollup.core.model.AnomalyReport;
import com.telemetryrollup.core.model.Reading;
import com.telemetryrollup.core.stats.StatMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Z-score outlier detector.
 *
 * <p>
 * For every configured channel independently, collects the values of the
 * readings that carry the channel and counts those deviating from the
 * channel mean by more than {@code threshold × σ} (population σ).
 * </p>
 *
 * <h3>Small series</h3>
 * <p>
 * A channel with fewer than two values has σ = 0 and therefore never flags.
 * Channels that no reading carries are left out of the report.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreAnomalyDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreAnomalyDetector.class);

    private final List<String> channels;
    private final double threshold;

    /**
     * @param channels  channel names to evaluate, in report order
     * @param threshold number of standard deviations; must be &gt; 0
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public ZScoreAnomalyDetector(List<String> channels, double threshold) {
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels must not be null"));
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public AnomalyReport detect(List<Reading> readings) {
        Objects.requireNonNull(readings, "readings must not be null");

        Map<String, Integer> perChannel = new LinkedHashMap<>();
        for (String channel : channels) {
            List<Double> values = new ArrayList<>();
            for (Reading reading : readings) {
                reading.channel(channel).ifPresent(values::add);
            }
            if (values.isEmpty()) {
                continue;
            }
            int flagged = StatMath.zScoreOutliers(values, threshold);
            if (flagged > 0) {
                LOG.debug("Channel '{}' flagged {} of {} value(s) beyond {}σ",
                        channel, flagged, values.size(), threshold);
            }
            perChannel.put(channel, flagged);
        }
        return new AnomalyReport(perChannel);
    }

    @Override
    public String getName() {
        return "zscore";
    }

    public double getThreshold() {
        return threshold;
    }
}
