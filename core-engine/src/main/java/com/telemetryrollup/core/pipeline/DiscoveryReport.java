package com.telemetryrollup.core.pipeline;

import com.telemetryrollup.core.model.ItemFailure;

import java.util.List;
import java.util.Objects;

/**
 * Keys found for a window plus the prefixes that could not be listed.
 *
 * @since 1.0.0
 */
public final class DiscoveryReport {

    private final List<String> keys;
    private final List<ItemFailure> failures;

    public DiscoveryReport(List<String> keys, List<ItemFailure> failures) {
        this.keys = List.copyOf(Objects.requireNonNull(keys, "keys must not be null"));
        this.failures = List.copyOf(Objects.requireNonNull(failures, "failures must not be null"));
    }

    public static DiscoveryReport empty() {
        return new DiscoveryReport(List.of(), List.of());
    }

    /**
     * @return discovered keys, in prefix order then listing order
     */
    public List<String> getKeys() {
        return keys;
    }

    public List<ItemFailure> getFailures() {
        return failures;
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public String toString() {
        return "DiscoveryReport{keys=" + keys.size() + ", failedPrefixes=" + failures.size() + '}';
    }
}
