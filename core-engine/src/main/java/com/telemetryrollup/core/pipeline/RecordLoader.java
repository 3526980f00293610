package com.telemetryrollup.core.pipeline;

import com.telemetryrollup.core.model.DeviceGroup;
import com.telemetryrollup.core.model.ItemFailure;
import com.telemetryrollup.core.model.Reading;
import com.telemetryrollup.core.store.ObjectStore;
import com.telemetryrollup.core.store.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fetches and parses discovered objects and groups the readings by device.
 *
 * <p>
 * Objects are fetched and parsed concurrently on the supplied executor.
 * Outcomes are merged in key order on the calling thread, so each device's
 * readings keep discovery order regardless of completion order.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A fetch error ({@link ItemFailure.Stage#FETCH}) or a parse error
 * ({@link ItemFailure.Stage#PARSE}) skips that object only. An unexpected
 * exception is attributed to the step that raised it. A device whose
 * objects all failed does not appear in the resulting {@link DeviceGroup}.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RecordLoader.class);

    private final ObjectStore store;
    private final ReadingParser parser;
    private final Executor executor;

    public RecordLoader(ObjectStore store, ReadingParser parser, Executor executor) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * @param keys object keys to load, in discovery order
     * @return grouped readings and per-object failures
     */
    public LoadReport load(List<String> keys) {
        Objects.requireNonNull(keys, "keys must not be null");
        if (keys.isEmpty()) {
            return LoadReport.empty();
        }

        List<CompletableFuture<ItemOutcome<Reading>>> tasks = keys.stream()
                .map(key -> CompletableFuture.supplyAsync(() -> loadOne(key), executor)
                        .exceptionally(error -> fetchFailed(key, Failures.rootMessage(error))))
                .toList();

        DeviceGroup.Builder group = DeviceGroup.builder();
        List<ItemFailure> failures = new ArrayList<>();
        for (CompletableFuture<ItemOutcome<Reading>> task : tasks) {
            ItemOutcome<Reading> outcome = task.join();
            outcome.value().ifPresent(group::add);
            outcome.failure().ifPresent(failures::add);
        }

        LoadReport report = new LoadReport(group.build(), failures, keys.size());
        LOG.info("Loaded {} of {} object(s) for {} device(s), {} skipped",
                report.getLoaded(), keys.size(), report.getDeviceGroup().deviceCount(), failures.size());
        return report;
    }

    private ItemOutcome<Reading> loadOne(String key) {
        byte[] body;
        try {
            body = store.get(key);
        } catch (ObjectStoreException e) {
            return fetchFailed(key, Failures.rootMessage(e));
        }
        ItemOutcome<Reading> outcome;
        try {
            outcome = parser.parse(key, body);
        } catch (RuntimeException e) {
            outcome = ItemOutcome.failure(
                    new ItemFailure(ItemFailure.Stage.PARSE, key, Failures.rootMessage(e)));
        }
        outcome.failure().ifPresent(failure ->
                LOG.warn("Failed to parse object {}: {}", key, failure.getReason()));
        return outcome;
    }

    private static ItemOutcome<Reading> fetchFailed(String key, String reason) {
        LOG.warn("Failed to fetch object {}: {}", key, reason);
        return ItemOutcome.failure(new ItemFailure(ItemFailure.Stage.FETCH, key, reason));
    }
}
