package com.telemetryrollup.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tuning of the rollup engine, loaded from YAML.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * inputRoot: sensor-data
 * outputRoot: aggregated-data
 * channels: [temperature, humidity]
 * zscoreThreshold: 2.0
 * highQualityThreshold: 0.8
 * lowQualityThreshold: 0.5
 * fetchParallelism: 8
 * windowHours: 1
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationConfig {

    private String inputRoot = "sensor-data";
    private String outputRoot = "aggregated-data";
    private List<String> channels = new ArrayList<>(List.of("temperature", "humidity"));
    private double zscoreThreshold = 2.0;
    private double highQualityThreshold = 0.8;
    private double lowQualityThreshold = 0.5;
    private int fetchParallelism = 8;
    private int windowHours = 1;

    /**
     * @return configuration with every value at its default
     */
    public static AggregationConfig defaults() {
        return new AggregationConfig();
    }

    /**
     * Validate every value, collecting all problems into one exception.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (inputRoot == null || inputRoot.isBlank()) {
            errors.add("'inputRoot' is required");
        }
        if (outputRoot == null || outputRoot.isBlank()) {
            errors.add("'outputRoot' is required");
        }
        if (channels == null || channels.isEmpty()) {
            errors.add("'channels' must list at least one channel");
        } else if (channels.stream().anyMatch(c -> c == null || c.isBlank())) {
            errors.add("'channels' must not contain blank names");
        } else if (channels.stream().distinct().count() != channels.size()) {
            errors.add("'channels' must not contain duplicates");
        }
        if (zscoreThreshold <= 0) {
            errors.add("'zscoreThreshold' must be > 0, got: " + zscoreThreshold);
        }
        if (lowQualityThreshold < 0 || highQualityThreshold > 1 || lowQualityThreshold > highQualityThreshold) {
            errors.add("quality thresholds must satisfy 0 <= low <= high <= 1, got: low="
                    + lowQualityThreshold + ", high=" + highQualityThreshold);
        }
        if (fetchParallelism < 1) {
            errors.add("'fetchParallelism' must be >= 1, got: " + fetchParallelism);
        }
        if (windowHours < 1) {
            errors.add("'windowHours' must be >= 1, got: " + windowHours);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Aggregation configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (setters used by SnakeYAML)
    // ---------------------------------------------------------------

    public String getInputRoot() {
        return inputRoot;
    }

    public void setInputRoot(String inputRoot) {
        this.inputRoot = inputRoot;
    }

    public String getOutputRoot() {
        return outputRoot;
    }

    public void setOutputRoot(String outputRoot) {
        this.outputRoot = outputRoot;
    }

    /**
     * @return unmodifiable list of channel names
     */
    public List<String> getChannels() {
        return channels != null ? Collections.unmodifiableList(channels) : List.of();
    }

    public void setChannels(List<String> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : null;
    }

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public double getHighQualityThreshold() {
        return highQualityThreshold;
    }

    public void setHighQualityThreshold(double highQualityThreshold) {
        this.highQualityThreshold = highQualityThreshold;
    }

    public double getLowQualityThreshold() {
        return lowQualityThreshold;
    }

    public void setLowQualityThreshold(double lowQualityThreshold) {
        this.lowQualityThreshold = lowQualityThreshold;
    }

    public int getFetchParallelism() {
        return fetchParallelism;
    }

    public void setFetchParallelism(int fetchParallelism) {
        this.fetchParallelism = fetchParallelism;
    }

    public int getWindowHours() {
        return windowHours;
    }

    public void setWindowHours(int windowHours) {
        this.windowHours = windowHours;
    }

    @Override
    public String toString() {
        return "AggregationConfig{" +
                "inputRoot='" + inputRoot + '\'' +
                ", outputRoot='" + outputRoot + '\'' +
                ", channels=" + channels +
                ", zscoreThreshold=" + zscoreThreshold +
                ", highQualityThreshold=" + highQualityThreshold +
                ", lowQualityThreshold=" + lowQualityThreshold +
                ", fetchParallelism=" + fetchParallelism +
                ", windowHours=" + windowHours +
                '}';
    }
}
