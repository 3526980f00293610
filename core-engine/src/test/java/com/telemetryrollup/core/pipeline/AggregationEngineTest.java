package com.telemetryrollup.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.telemetryrollup.core.config.AggregationConfig;
import com.telemetryrollup.core.json.JsonSupport;
import com.telemetryrollup.core.model.AggregationResult;
import com.telemetryrollup.core.model.TimeWindow;
import com.telemetryrollup.core.store.ObjectStoreException;
import com.telemetryrollup.core.support.InMemoryObjectStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.telemetryrollup.core.support.ReadingFixtures.objectKey;
import static com.telemetryrollup.core.support.ReadingFixtures.readingJson;
import static com.telemetryrollup.core.support.ReadingFixtures.temperatureOnlyJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests of {@link AggregationEngine} against an in-memory store.
 */
class AggregationEngineTest {

    private static final String HOUR_13 = "sensor-data/2026/02/09/hour=13/";
    private static final Instant NOW = Instant.parse("2026-02-09T14:00:00Z");
    private static final Instant START = Instant.parse("2026-02-09T13:00:00Z");
    private static final String ROLLUP_KEY = "aggregated-data/2026/02/09/hour=14/aggregated-20260209-140000.json";

    private InMemoryObjectStore store;
    private AggregationEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        AggregationConfig config = AggregationConfig.defaults();
        config.setFetchParallelism(3);
        engine = new AggregationEngine(store, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    // -------------------------------------------------------------------------
    // Scenarios
    // -------------------------------------------------------------------------

    @Test
    @DisplayName("a single temperature spike is flagged and the humidity series is not")
    void singleSpikeFlagged() throws Exception {
        double[] temperatures = {20, 21, 20, 21, 20, 21, 20, 95};
        double[] humidities = {40, 42, 41, 40, 42, 41, 40, 41};
        for (int i = 0; i < temperatures.length; i++) {
            store.putString(objectKey(HOUR_13, "temp_001", i),
                    readingJson("temp_001", temperatures[i], humidities[i], 0.9));
        }

        AggregationResult result = engine.invoke(START, NOW);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAggregationCount()).isEqualTo(1);
        assertThat(result.getAnomalyCount()).isEqualTo(1);
        assertThat(result.getDiscoveredObjects()).isEqualTo(8);
        assertThat(result.getRollupKey()).isEqualTo(ROLLUP_KEY);

        JsonNode device = rollup().get("aggregations").get(0);
        assertThat(device.get("sensor_id").asText()).isEqualTo("temp_001");
        assertThat(device.get("record_count").asInt()).isEqualTo(8);
        assertThat(device.at("/channels/temperature/max").asDouble()).isEqualTo(95.0);
        assertThat(device.at("/channels/temperature/avg").asDouble()).isEqualTo(29.75, within(1e-9));
        assertThat(device.at("/anomaly_detection/per_channel/temperature").asInt()).isEqualTo(1);
        assertThat(device.at("/anomaly_detection/per_channel/humidity").asInt()).isZero();
        assertThat(device.at("/anomaly_detection/total_anomalies").asInt()).isEqualTo(1);
        assertThat(device.at("/data_quality/high_quality_count").asInt()).isEqualTo(8);
    }

    @Test
    @DisplayName("an empty window still writes a rollup with no aggregations")
    void emptyWindow() throws Exception {
        AggregationResult result = engine.invoke(START, NOW);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAggregationCount()).isZero();
        assertThat(result.getDiscoveredObjects()).isZero();
        assertThat(result.getAnomalyCount()).isZero();

        JsonNode rollup = rollup();
        assertThat(rollup.get("aggregations").isArray()).isTrue();
        assertThat(rollup.get("aggregations").size()).isZero();
        assertThat(rollup.at("/metadata/total_sensors").asInt()).isZero();
    }

    @Test
    @DisplayName("a malformed object is skipped and the rest are aggregated")
    void malformedObjectSkipped() throws Exception {
        for (int i = 0; i < 4; i++) {
            store.putString(objectKey(HOUR_13, "hum_002", i), readingJson("hum_002", 18 + i, 55, 0.7));
        }
        store.putString(objectKey(HOUR_13, "hum_002", 4), "{\"sensor_id\": \"hum_002\", \"temperature\": ");

        AggregationResult result = engine.invoke(START, NOW);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDiscoveredObjects()).isEqualTo(5);
        assertThat(result.getFailedObjects()).isEqualTo(1);

        JsonNode rollup = rollup();
        assertThat(rollup.at("/aggregations/0/record_count").asInt()).isEqualTo(4);
        assertThat(rollup.at("/metadata/failed_objects").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("a device reporting only temperature gets no humidity statistics")
    void temperatureOnlyDevice() throws Exception {
        store.putString(objectKey(HOUR_13, "t_only", 0), temperatureOnlyJson("t_only", 10));
        store.putString(objectKey(HOUR_13, "t_only", 1), temperatureOnlyJson("t_only", 14));
        store.putString(objectKey(HOUR_13, "both", 0), readingJson("both", 22, 50, 0.9));

        AggregationResult result = engine.invoke(START, NOW);

        assertThat(result.getAggregationCount()).isEqualTo(2);
        JsonNode aggregations = rollup().get("aggregations");
        assertThat(aggregations.get(0).get("sensor_id").asText()).isEqualTo("both");
        JsonNode temperatureOnly = aggregations.get(1);
        assertThat(temperatureOnly.get("sensor_id").asText()).isEqualTo("t_only");
        assertThat(temperatureOnly.get("channels").has("humidity")).isFalse();
        assertThat(temperatureOnly.at("/channels/temperature/avg").asDouble()).isEqualTo(12.0);
    }

    // -------------------------------------------------------------------------
    // Failures
    // -------------------------------------------------------------------------

    @Test
    @DisplayName("a failed listing is counted and the run still succeeds")
    void listingFailureAbsorbed() {
        store.putString(objectKey("sensor-data/2026/02/09/hour=14/", "late", 0), readingJson("late", 20, 40, 0.9));
        store.failListing(HOUR_13);

        AggregationResult result = engine.invoke(START, NOW);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFailedPrefixes()).isEqualTo(1);
        assertThat(result.getAggregationCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("a failed write fails the run")
    void persistenceFailure() {
        store.putString(objectKey(HOUR_13, "temp_001", 0), readingJson("temp_001", 20, 40, 0.9));
        store.failWrites(true);
        TimeWindow window = new TimeWindow(START, NOW);

        assertThatThrownBy(() -> engine.run(window)).isInstanceOf(ObjectStoreException.class);

        AggregationResult result = engine.invoke(START, NOW);
        assertThat(result.getStatus()).isEqualTo(AggregationResult.Status.FAILURE);
        assertThat(result.getProcessedWindow()).isEqualTo(window);
        assertThat(result.getError()).contains("simulated write rejection");
        assertThat(result.getRollupKey()).isNull();
        assertThat(store.keys()).doesNotContain(ROLLUP_KEY);
    }

    // -------------------------------------------------------------------------
    // Window resolution
    // -------------------------------------------------------------------------

    @Test
    @DisplayName("no bounds selects the hour preceding now")
    void defaultWindow() {
        AggregationResult result = engine.invoke(null, null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProcessedWindow()).isEqualTo(new TimeWindow(START, NOW));
        assertThat(result.getRollupKey()).isEqualTo(ROLLUP_KEY);
    }

    @Test
    @DisplayName("a single bound is rejected without touching the store")
    void singleBoundRejected() {
        AggregationResult result = engine.invoke(START, null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getProcessedWindow()).isNull();
        assertThat(result.getError()).contains("together");
        assertThat(store.putCount()).isZero();
    }

    @Test
    @DisplayName("reversed bounds are rejected")
    void reversedBoundsRejected() {
        AggregationResult result = engine.invoke(NOW, START);

        assertThat(result.getStatus()).isEqualTo(AggregationResult.Status.FAILURE);
        assertThat(store.putCount()).isZero();
    }

    @Test
    @DisplayName("rerunning a window overwrites the same rollup")
    void rerunOverwrites() {
        store.putString(objectKey(HOUR_13, "temp_001", 0), readingJson("temp_001", 20, 40, 0.9));

        String first = engine.invoke(START, NOW).getRollupKey();
        String firstBody = store.getString(first).orElseThrow();
        String second = engine.invoke(START, NOW).getRollupKey();

        assertThat(second).isEqualTo(first);
        assertThat(store.getString(second)).contains(firstBody);
    }

    private JsonNode rollup() throws Exception {
        return JsonSupport.objectMapper().readTree(store.getString(ROLLUP_KEY).orElseThrow());
    }
}
