package com.metricsentinel.service.runtime;

import com.metricsentinel.collectors.alerts.AlertDeduplicator;
import com.metricsentinel.collectors.alerts.AlertState;
import com.metricsentinel.collectors.alerts.ThresholdEvaluator;
import com.metricsentinel.collectors.api.SnapshotSource;
import com.metricsentinel.collectors.delivery.DeliveryClient;
import com.metricsentinel.collectors.notify.Notifier;
import com.metricsentinel.core.bus.EventBus;
import com.metricsentinel.service.config.AgentConfig;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Collaborators owned by the collection loop and handed to every cycle. {@code alertState} lives here, and only
 * here, for the life of the process.
 */
public record CycleContext(
        SnapshotSource source,
        ThresholdEvaluator evaluator,
        AlertDeduplicator deduplicator,
        AlertState alertState,
        DeliveryClient deliveryClient,
        Function<AgentConfig, List<Notifier>> notifiers,
        EventBus eventBus,
        Clock clock
) {
    public CycleContext {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(evaluator, "evaluator is required");
        Objects.requireNonNull(deduplicator, "deduplicator is required");
        Objects.requireNonNull(alertState, "alertState is required");
        Objects.requireNonNull(deliveryClient, "deliveryClient is required");
        Objects.requireNonNull(notifiers, "notifiers is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
