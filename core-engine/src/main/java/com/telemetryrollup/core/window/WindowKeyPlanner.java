package com.telemetryrollup.core.window;

import com.telemetryrollup.core.model.TimeWindow;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps a {@link TimeWindow} onto the hour-partitioned key layout of the store.
 *
 * <p>
 * Raw readings live under {@code <inputRoot>/YYYY/MM/DD/hour=HH/...} and
 * rollups are written to
 * {@code <outputRoot>/YYYY/MM/DD/hour=HH/aggregated-YYYYMMDD-HHMMSS.json}.
 * All dates are UTC.
 * </p>
 *
 * <h3>Granularity</h3>
 * <p>
 * Partitions are one hour wide. Every hour bucket touched by the window is
 * listed, from the bucket containing {@code start} through the bucket
 * containing {@code end}, so a sub-hour window still covers whole hours.
 * Readings are not re-filtered by their own timestamp afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowKeyPlanner {

    private static final DateTimeFormatter PARTITION_FORMAT =
            DateTimeFormatter.ofPattern("yyyy/MM/dd/'hour='HH").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter ROLLUP_STAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final String inputRoot;
    private final String outputRoot;

    public WindowKeyPlanner() {
        this("sensor-data", "aggregated-data");
    }

    /**
     * @param inputRoot  top-level prefix of raw readings, without trailing slash
     * @param outputRoot top-level prefix of rollups, without trailing slash
     */
    public WindowKeyPlanner(String inputRoot, String outputRoot) {
        this.inputRoot = trimSlashes(Objects.requireNonNull(inputRoot, "inputRoot must not be null"));
        this.outputRoot = trimSlashes(Objects.requireNonNull(outputRoot, "outputRoot must not be null"));
    }

    /**
     * @param window the window to cover; must not be {@code null}
     * @return one prefix per touched hour, chronological, never empty
     */
    public List<String> partitionPrefixes(TimeWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        Instant lastBucket = window.getEnd().truncatedTo(ChronoUnit.HOURS);
        List<String> prefixes = new ArrayList<>();
        for (Instant bucket = window.getStart().truncatedTo(ChronoUnit.HOURS);
                !bucket.isAfter(lastBucket);
                bucket = bucket.plus(1, ChronoUnit.HOURS)) {
            prefixes.add(inputRoot + "/" + PARTITION_FORMAT.format(bucket) + "/");
        }
        return prefixes;
    }

    /**
     * Key of the rollup for a window. Depends only on {@code windowEnd}, so a
     * rerun of the same window overwrites the previous rollup.
     *
     * @param windowEnd exclusive end of the window
     * @return the rollup object key
     */
    public String rollupKey(Instant windowEnd) {
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        return outputRoot + "/" + PARTITION_FORMAT.format(windowEnd)
                + "/aggregated-" + ROLLUP_STAMP_FORMAT.format(windowEnd) + ".json";
    }

    private static String trimSlashes(String root) {
        String trimmed = root.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Key root must not be blank");
        }
        return trimmed;
    }
}
