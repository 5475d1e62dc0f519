package com.metricsentinel.collectors.api;

/**
 * Which optional sections a {@link SnapshotSource} should fill in.
 */
public record SnapshotScope(boolean includeNetwork, boolean includeProcesses, boolean diskUsageOnly) {
    public static SnapshotScope defaults() {
        return new SnapshotScope(true, false, true);
    }
}
