package com.telemetryrollup.core.pipeline;

import com.telemetryrollup.core.model.DeviceGroup;
import com.telemetryrollup.core.model.ItemFailure;

import java.util.List;
import java.util.Objects;

/**
 * Readings loaded for a window, grouped by device, plus the objects that were
 * skipped.
 *
 * @since 1.0.0
 */
public final class LoadReport {

    private final DeviceGroup deviceGroup;
    private final List<ItemFailure> failures;
    private final int attempted;

    public LoadReport(DeviceGroup deviceGroup, List<ItemFailure> failures, int attempted) {
        this.deviceGroup = Objects.requireNonNull(deviceGroup, "deviceGroup must not be null");
        this.failures = List.copyOf(Objects.requireNonNull(failures, "failures must not be null"));
        this.attempted = attempted;
    }

    public static LoadReport empty() {
        return new LoadReport(DeviceGroup.empty(), List.of(), 0);
    }

    public DeviceGroup getDeviceGroup() {
        return deviceGroup;
    }

    public List<ItemFailure> getFailures() {
        return failures;
    }

    public int getAttempted() {
        return attempted;
    }

    public int getLoaded() {
        return deviceGroup.readingCount();
    }

    @Override
    public String toString() {
        return "LoadReport{attempted=" + attempted
                + ", loaded=" + getLoaded()
                + ", failed=" + failures.size()
                + ", devices=" + deviceGroup.deviceCount() + '}';
    }
}
