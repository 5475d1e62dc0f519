package com.metricsentinel.collectors.delivery;

import com.metricsentinel.core.model.AlertCandidate;
import com.metricsentinel.core.model.MetricSnapshot;

import java.util.List;

/**
 * Request body accepted by the ingestion service's {@code /ingest} route.
 */
public record IngestPayload(String hostname, MetricSnapshot metrics, List<AlertCandidate> alerts) {
    public IngestPayload {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    public static IngestPayload of(MetricSnapshot snapshot, List<AlertCandidate> firedAlerts) {
        return new IngestPayload(snapshot.hostname(), snapshot, firedAlerts);
    }
}
