package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One timestamped set of host readings. Sections the source could not (or was told not to) read are null.
 */
public record MetricSnapshot(
        Instant timestamp,
        String hostname,
        CpuStats cpu,
        MemoryStats memory,
        SwapStats swap,
        @JsonProperty("disk") List<DiskUsage> disks,
        NetworkCounters network,
        @JsonProperty("top_processes") List<ProcessStats> topProcesses
) {
    public static final String DISK_MOUNT_PREFIX = "disk_percent:";

    public MetricSnapshot {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(hostname, "hostname is required");
        disks = disks == null ? List.of() : List.copyOf(disks);
        topProcesses = topProcesses == null ? null : List.copyOf(topProcesses);
    }

    /**
     * Named percentage readings. {@code disk_percent} is the fullest mount; each mount also appears as
     * {@code disk_percent:<mountpoint>}.
     */
    @JsonIgnore
    public Map<String, Double> readings() {
        Map<String, Double> readings = new LinkedHashMap<>();
        if (cpu != null) {
            readings.put("cpu_percent", cpu.percent());
        }
        if (memory != null) {
            readings.put("memory_percent", memory.percent());
        }
        if (!disks.isEmpty()) {
            readings.put("disk_percent", disks.stream().mapToDouble(DiskUsage::percent).max().orElse(0.0));
            for (DiskUsage disk : disks) {
                readings.put(DISK_MOUNT_PREFIX + disk.mountpoint(), disk.percent());
            }
        }
        if (swap != null) {
            readings.put("swap_percent", swap.percent());
        }
        return Collections.unmodifiableMap(readings);
    }
}
