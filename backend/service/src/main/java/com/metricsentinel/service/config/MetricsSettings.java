package com.metricsentinel.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metricsentinel.collectors.api.SnapshotScope;

public record MetricsSettings(
        @JsonProperty("include_network") Boolean includeNetwork,
        @JsonProperty("include_processes") Boolean includeProcesses,
        @JsonProperty("disk_usage_only") Boolean diskUsageOnly
) {
    public MetricsSettings {
        SnapshotScope defaults = SnapshotScope.defaults();
        includeNetwork = includeNetwork == null ? defaults.includeNetwork() : includeNetwork;
        includeProcesses = includeProcesses == null ? defaults.includeProcesses() : includeProcesses;
        diskUsageOnly = diskUsageOnly == null ? defaults.diskUsageOnly() : diskUsageOnly;
    }

    public static MetricsSettings defaults() {
        return new MetricsSettings(null, null, null);
    }

    public SnapshotScope toScope() {
        return new SnapshotScope(includeNetwork, includeProcesses, diskUsageOnly);
    }
}
