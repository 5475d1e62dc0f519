package com.metricsentinel.core.model;

import java.util.Objects;

public record DiskUsage(
        String device,
        String mountpoint,
        String fstype,
        long total,
        long used,
        long free,
        double percent
) {
    public DiskUsage {
        Objects.requireNonNull(mountpoint, "mountpoint is required");
    }

    public static DiskUsage fromTotals(String device, String mountpoint, String fstype, long total, long free) {
        long used = Math.max(0, total - free);
        double percent = total <= 0 ? 0.0 : used * 100.0 / total;
        return new DiskUsage(device, mountpoint, fstype, total, used, free, percent);
    }
}
