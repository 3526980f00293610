package com.telemetryrollup.core.pipeline;

import com.telemetryrollup.core.model.ItemFailure;
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
 * Lists the object keys under each partition prefix of a window.
 *
 * <p>
 * Prefixes are listed concurrently on the supplied executor and merged back
 * in prefix order. A prefix that cannot be listed is logged, reported as a
 * {@link ItemFailure.Stage#LIST} failure and contributes no keys; the other
 * prefixes are unaffected.
 * </p>
 *
 * @since 1.0.0
 */
public class ObjectDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectDiscovery.class);

    private final ObjectStore store;
    private final Executor executor;

    public ObjectDiscovery(ObjectStore store, Executor executor) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * @param prefixes partition prefixes, in the order keys should be returned
     * @return discovered keys and per-prefix failures
     */
    public DiscoveryReport discover(List<String> prefixes) {
        Objects.requireNonNull(prefixes, "prefixes must not be null");

        List<CompletableFuture<ItemOutcome<List<String>>>> tasks = prefixes.stream()
                .map(prefix -> CompletableFuture.supplyAsync(() -> listPrefix(prefix), executor)
                        .exceptionally(error -> failedPrefix(prefix, error)))
                .toList();

        List<String> keys = new ArrayList<>();
        List<ItemFailure> failures = new ArrayList<>();
        for (CompletableFuture<ItemOutcome<List<String>>> task : tasks) {
            ItemOutcome<List<String>> outcome = task.join();
            outcome.value().ifPresent(keys::addAll);
            outcome.failure().ifPresent(failures::add);
        }

        if (keys.isEmpty()) {
            LOG.warn("No objects found under {} prefix(es)", prefixes.size());
        } else {
            LOG.info("Discovered {} object(s) under {} prefix(es)", keys.size(), prefixes.size());
        }
        return new DiscoveryReport(keys, failures);
    }

    private ItemOutcome<List<String>> listPrefix(String prefix) {
        try {
            List<String> keys = store.list(prefix);
            LOG.debug("Prefix {} holds {} object(s)", prefix, keys.size());
            return ItemOutcome.success(keys);
        } catch (ObjectStoreException e) {
            return failedPrefix(prefix, e);
        }
    }

    private ItemOutcome<List<String>> failedPrefix(String prefix, Throwable error) {
        String reason = Failures.rootMessage(error);
        LOG.warn("Failed to list objects with prefix {}: {}", prefix, reason);
        return ItemOutcome.failure(new ItemFailure(ItemFailure.Stage.LIST, prefix, reason));
    }
}
