package com.metricsentinel.core.model;

public record MemoryStats(long total, long available, double percent, long used, long free) {
    public static MemoryStats fromTotals(long total, long free) {
        long used = Math.max(0, total - free);
        double percent = total <= 0 ? 0.0 : used * 100.0 / total;
        return new MemoryStats(total, free, percent, used, free);
    }
}
