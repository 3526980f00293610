package com.telemetryrollup.core.pipeline;

import com.telemetryrollup.core.model.DeviceGroup;
import com.telemetryrollup.core.model.ItemFailure;
import com.telemetryrollup.core.model.Reading;
import com.telemetryrollup.core.support.InMemoryObjectStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.telemetryrollup.core.support.ReadingFixtures.objectKey;
import static com.telemetryrollup.core.support.ReadingFixtures.readingJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link RecordLoader}.
 */
class RecordLoaderTest {

    private static final String H13 = "sensor-data/2026/02/09/hour=13/";

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final InMemoryObjectStore store = new InMemoryObjectStore();
    private final RecordLoader loader = new RecordLoader(
            store, new ReadingParser(List.of("temperature", "humidity")), executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("groups readings by device, keeping discovery order")
    void groupsByDevice() {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            String device = i % 3 == 0 ? "hum_002" : "temp_001";
            String key = objectKey(H13, device, i);
            store.putString(key, readingJson(device, i, 40, 0.9));
            keys.add(key);
        }

        LoadReport report = loader.load(keys);
        DeviceGroup group = report.getDeviceGroup();

        assertThat(group.deviceIds()).containsExactly("hum_002", "temp_001");
        assertThat(group.readingsFor("hum_002")).hasSize(10);
        assertThat(group.readingsFor("temp_001")).hasSize(20);
        List<Double> temps = group.readingsFor("temp_001").stream()
                .map(r -> r.channel("temperature").orElseThrow())
                .toList();
        assertThat(temps).isSorted();
        assertThat(report.getFailures()).isEmpty();
        assertThat(report.getAttempted()).isEqualTo(30);
    }

    @Test
    @DisplayName("fetch and parse failures are skipped and reported")
    void skipsFailures() {
        String good = objectKey(H13, "temp_001", 1);
        String unreadable = objectKey(H13, "temp_001", 2);
        String malformed = objectKey(H13, "temp_001", 3);
        String missing = objectKey(H13, "temp_001", 4);
        store.putString(good, readingJson("temp_001", 20, 40, 0.9))
                .putString(unreadable, readingJson("temp_001", 21, 41, 0.9))
                .putString(malformed, "{not json");
        store.failReading(unreadable);

        LoadReport report = loader.load(List.of(good, unreadable, malformed, missing));

        assertThat(report.getLoaded()).isEqualTo(1);
        assertThat(report.getFailures())
                .extracting(ItemFailure::getKey, ItemFailure::getStage)
                .containsExactly(
                        tuple(unreadable, ItemFailure.Stage.FETCH),
                        tuple(malformed, ItemFailure.Stage.PARSE),
                        tuple(missing, ItemFailure.Stage.FETCH));
    }

    @Test
    @DisplayName("an exception thrown while parsing is reported as a parse failure")
    void parserExceptionIsParseFailure() {
        String ok = objectKey(H13, "temp_001", 1);
        String poisoned = objectKey(H13, "temp_001", 2);
        store.putString(ok, readingJson("temp_001", 20, 40, 0.9))
                .putString(poisoned, readingJson("temp_001", 21, 41, 0.9));
        ReadingParser throwingParser = new ReadingParser(List.of("temperature", "humidity")) {
            @Override
            public ItemOutcome<Reading> parse(String key, byte[] body) {
                if (key.equals(poisoned)) {
                    throw new IllegalStateException("parser blew up");
                }
                return super.parse(key, body);
            }
        };
        RecordLoader throwingLoader = new RecordLoader(store, throwingParser, executor);

        LoadReport report = throwingLoader.load(List.of(ok, poisoned));

        assertThat(report.getLoaded()).isEqualTo(1);
        assertThat(report.getFailures())
                .extracting(ItemFailure::getKey, ItemFailure::getStage, ItemFailure::getReason)
                .containsExactly(tuple(poisoned, ItemFailure.Stage.PARSE, "parser blew up"));
    }

    @Test
    @DisplayName("a device whose objects all fail does not appear")
    void deviceWithoutReadingsIsAbsent() {
        String ok = objectKey(H13, "temp_001", 1);
        String bad = objectKey(H13, "broken_9", 1);
        store.putString(ok, readingJson("temp_001", 20, 40, 0.9))
                .putString(bad, "{\"sensor_id\":\"broken_9\",\"temperature\":\"n/a\"}");

        DeviceGroup group = loader.load(List.of(ok, bad)).getDeviceGroup();

        assertThat(group.deviceIds()).containsExactly("temp_001");
        assertThat(group.readingsFor("broken_9")).isEmpty();
    }

    @Test
    @DisplayName("no keys loads nothing")
    void emptyInput() {
        LoadReport report = loader.load(List.of());
        assertThat(report.getDeviceGroup().isEmpty()).isTrue();
        assertThat(report.getAttempted()).isZero();
    }

    @Test
    @DisplayName("loaded readings are immutable")
    void groupIsImmutable() {
        String key = objectKey(H13, "temp_001", 1);
        store.putString(key, readingJson("temp_001", 20, 40, 0.9));
        List<Reading> readings = loader.load(List.of(key)).getDeviceGroup().readingsFor("temp_001");

        assertThatThrownBy(() -> readings.add(readings.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
