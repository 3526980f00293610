package com.telemetryrollup.core.model;

import java.util.Objects;

/**
 * A single input item that was skipped during a run.
 *
 * @since 1.0.0
 */
public final class ItemFailure {

    /** Pipeline stage at which the item was dropped. */
    public enum Stage {
        LIST,
        FETCH,
        PARSE
    }

    private final Stage stage;
    private final String key;
    private final String reason;

    /**
     * @param stage  stage that failed
     * @param key    prefix (for {@link Stage#LIST}) or object key
     * @param reason human-readable cause
     */
    public ItemFailure(Stage stage, String key, String reason) {
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.reason = reason != null ? reason : "unknown";
    }

    public Stage getStage() {
        return stage;
    }

    public String getKey() {
        return key;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ItemFailure that))
            return false;
        return stage == that.stage && key.equals(that.key) && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, key, reason);
    }

    @Override
    public String toString() {
        return stage + " " + key + ": " + reason;
    }
}
