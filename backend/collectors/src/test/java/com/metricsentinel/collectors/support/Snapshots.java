package com.metricsentinel.collectors.support;

import com.metricsentinel.core.model.CpuStats;
import com.metricsentinel.core.model.DiskUsage;
import com.metricsentinel.core.model.MemoryStats;
import com.metricsentinel.core.model.MetricSnapshot;
import com.metricsentinel.core.model.SwapStats;

import java.time.Instant;
import java.util.List;

public final class Snapshots {
    private Snapshots() {
    }

    public static MetricSnapshot cpuOnly(Instant at, double cpuPercent) {
        return new MetricSnapshot(at, "host-a", CpuStats.ofPercent(cpuPercent), null, null, null, null, null);
    }

    public static MetricSnapshot full(Instant at, double cpu, double memory, double disk, double swap) {
        return new MetricSnapshot(
                at,
                "host-a",
                new CpuStats(cpu, 4, 8, null),
                new MemoryStats(1000, 1000 - (long) (memory * 10), memory, (long) (memory * 10), 1000 - (long) (memory * 10)),
                new SwapStats(1000, (long) (swap * 10), 1000 - (long) (swap * 10), swap),
                List.of(new DiskUsage("/dev/sda1", "/", "ext4", 1000, (long) (disk * 10), 1000 - (long) (disk * 10), disk)),
                null,
                null
        );
    }
}
