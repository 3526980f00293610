package com.telemetryrollup.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.telemetryrollup.core.json.JsonSupport;
import com.telemetryrollup.core.model.AnomalyReport;
import com.telemetryrollup.core.model.ChannelStats;
import com.telemetryrollup.core.model.DeviceAggregate;
import com.telemetryrollup.core.model.QualitySummary;
import com.telemetryrollup.core.model.TimeWindow;
import com.telemetryrollup.core.store.ObjectStoreException;
import com.telemetryrollup.core.support.InMemoryObjectStore;
import com.telemetryrollup.core.window.WindowKeyPlanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ResultWriter}.
 */
class ResultWriterTest {

    private static final Instant NOW = Instant.parse("2026-02-09T14:00:07Z");
    private static final TimeWindow WINDOW = new TimeWindow(
            Instant.parse("2026-02-09T13:00:00Z"), Instant.parse("2026-02-09T14:00:00Z"));
    private static final String EXPECTED_KEY = "aggregated-data/2026/02/09/hour=14/aggregated-20260209-140000.json";

    private final InMemoryObjectStore store = new InMemoryObjectStore();
    private final ResultWriter writer =
            new ResultWriter(store, new WindowKeyPlanner(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("writing the same window twice stores identical bytes under the same key")
    void idempotentWrite() {
        List<DeviceAggregate> aggregates = List.of(aggregate("temp_001"), aggregate("temp_002"));

        String first = writer.write(aggregates, WINDOW);
        String firstBody = store.getString(first).orElseThrow();
        String second = writer.write(aggregates, WINDOW);

        assertThat(second).isEqualTo(first).isEqualTo(EXPECTED_KEY);
        assertThat(store.getString(second)).contains(firstBody);
        assertThat(store.putCount()).isEqualTo(2);
        assertThat(store.keys()).containsExactly(EXPECTED_KEY);
        assertThat(store.contentType(EXPECTED_KEY)).contains("application/json");
    }

    @Test
    @DisplayName("document uses the stable field names")
    void documentLayout() throws Exception {
        String key = writer.write(List.of(aggregate("temp_001")), WINDOW);
        JsonNode root = JsonSupport.objectMapper().readTree(store.getString(key).orElseThrow());

        assertThat(root.fieldNames()).toIterable().containsExactly("aggregations", "summary_stats", "metadata");

        JsonNode summary = root.get("summary_stats");
        assertThat(summary.at("/processing_window/start_time").asText()).isEqualTo("2026-02-09T13:00:00Z");
        assertThat(summary.at("/processing_window/duration_hours").asDouble()).isEqualTo(1.0);
        assertThat(summary.get("processed_timestamp").asText()).isEqualTo("2026-02-09T14:00:07Z");
        assertThat(root.at("/metadata/total_sensors").asInt()).isEqualTo(1);

        JsonNode aggregate = root.get("aggregations").get(0);
        assertThat(aggregate.get("sensor_id").asText()).isEqualTo("temp_001");
        assertThat(aggregate.at("/aggregation_window/end_time").asText()).isEqualTo("2026-02-09T14:00:00Z");
        assertThat(aggregate.get("record_count").asInt()).isEqualTo(3);
        assertThat(aggregate.at("/channels/temperature/std").asDouble()).isEqualTo(0.5);
        assertThat(aggregate.at("/data_quality/high_quality_count").asInt()).isEqualTo(2);
        assertThat(aggregate.at("/anomaly_detection/per_channel/temperature").asInt()).isZero();
        assertThat(aggregate.at("/anomaly_detection/total_anomalies").asInt()).isZero();
    }

    @Test
    @DisplayName("a failed put propagates")
    void persistenceFailurePropagates() {
        store.failWrites(true);
        List<DeviceAggregate> aggregates = List.of(aggregate("temp_001"));

        assertThatThrownBy(() -> writer.write(aggregates, WINDOW))
                .isInstanceOf(ObjectStoreException.class)
                .hasMessageContaining("simulated");
        assertThat(store.keys()).isEmpty();
    }

    private static DeviceAggregate aggregate(String deviceId) {
        return DeviceAggregate.builder()
                .deviceId(deviceId)
                .window(WINDOW)
                .recordCount(3)
                .channel("temperature", new ChannelStats(21.0, 20.5, 21.5, 0.5))
                .quality(new QualitySummary(0.85, 2, 0))
                .anomalies(new AnomalyReport(Map.of("temperature", 0)))
                .processedAt(NOW)
                .build();
    }
}
