package com.metricsentinel.core.model;

public record SwapStats(long total, long used, long free, double percent) {
    public static SwapStats fromTotals(long total, long free) {
        long used = Math.max(0, total - free);
        double percent = total <= 0 ? 0.0 : used * 100.0 / total;
        return new SwapStats(total, used, free, percent);
    }
}
