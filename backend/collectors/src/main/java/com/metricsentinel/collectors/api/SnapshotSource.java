package com.metricsentinel.collectors.api;

import com.metricsentinel.core.model.MetricSnapshot;

import java.time.Instant;

public interface SnapshotSource {
    String name();

    /**
     * Reads the host counters once. May block briefly on I/O.
     *
     * @throws SnapshotException when the readings are unavailable; the caller abandons the cycle
     */
    MetricSnapshot sample(Instant at, SnapshotScope scope) throws SnapshotException;
}
