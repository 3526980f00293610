package com.telemetryrollup.core.pipeline;

import com.telemetryrollup.core.model.ItemFailure;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one input item: either a value or the reason it was
 * skipped. Lets the pipeline carry per-item failures as data.
 *
 * @param <T> value type
 */
public final class ItemOutcome<T> {

    private final T value;
    private final ItemFailure failure;

    private ItemOutcome(T value, ItemFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> ItemOutcome<T> success(T value) {
        return new ItemOutcome<>(Objects.requireNonNull(value, "value must not be null"), null);
    }

    public static <T> ItemOutcome<T> failure(ItemFailure failure) {
        return new ItemOutcome<>(null, Objects.requireNonNull(failure, "failure must not be null"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<ItemFailure> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ItemOutcome{" + value + '}' : "ItemOutcome{failed: " + failure + '}';
    }
}
