package com.telemetryrollup.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Readings of one run grouped by device id.
 *
 * <p>
 * Devices iterate in id order; each device's list keeps the order in which
 * its readings were discovered. Instances are immutable and built once per
 * run through {@link Builder}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeviceGroup {

    private final Map<String, List<Reading>> readingsByDevice;

    private DeviceGroup(Map<String, List<Reading>> readingsByDevice) {
        TreeMap<String, List<Reading>> copy = new TreeMap<>();
        readingsByDevice.forEach((device, readings) -> copy.put(device, List.copyOf(readings)));
        this.readingsByDevice = Collections.unmodifiableMap(copy);
    }

    public static DeviceGroup empty() {
        return new DeviceGroup(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> deviceIds() {
        return readingsByDevice.keySet();
    }

    /**
     * @param deviceId device id
     * @return the device's readings, empty if the device has none
     */
    public List<Reading> readingsFor(String deviceId) {
        return readingsByDevice.getOrDefault(deviceId, List.of());
    }

    public Map<String, List<Reading>> asMap() {
        return readingsByDevice;
    }

    public int deviceCount() {
        return readingsByDevice.size();
    }

    public int readingCount() {
        return readingsByDevice.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return readingsByDevice.isEmpty();
    }

    /**
     * Append-only accumulator. Not thread-safe; callers merge from one thread.
     */
    public static class Builder {
        private final Map<String, List<Reading>> buckets = new TreeMap<>();

        public Builder add(Reading reading) {
            Objects.requireNonNull(reading, "reading must not be null");
            buckets.computeIfAbsent(reading.getDeviceId(), id -> new ArrayList<>()).add(reading);
            return this;
        }

        public DeviceGroup build() {
            return new DeviceGroup(buckets);
        }
    }

    @Override
    public String toString() {
        return "DeviceGroup{devices=" + readingsByDevice.keySet() + ", readings=" + readingCount() + '}';
    }
}
