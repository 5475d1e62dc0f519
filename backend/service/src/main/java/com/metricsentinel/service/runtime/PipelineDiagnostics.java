package com.metricsentinel.service.runtime;

import com.metricsentinel.core.bus.EventBus;
import com.metricsentinel.core.events.AlertFired;
import com.metricsentinel.core.events.CycleCompleted;
import com.metricsentinel.core.events.DeliveryCompleted;
import com.metricsentinel.core.events.Event;
import com.metricsentinel.core.events.TickSkipped;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * Counts what the pipeline did, from the events it publishes. Nothing here is persisted.
 */
public final class PipelineDiagnostics {
    private static final Logger LOGGER = Logger.getLogger(PipelineDiagnostics.class.getName());

    private final Clock clock;
    private final Instant startedAt;
    private final LongAdder eventsTotal = new LongAdder();
    private final LongAdder cyclesCompleted = new LongAdder();
    private final LongAdder cyclesFailed = new LongAdder();
    private final LongAdder ticksSkipped = new LongAdder();
    private final LongAdder alertsFired = new LongAdder();
    private final LongAdder deliveriesSucceeded = new LongAdder();
    private final LongAdder deliveriesFailed = new LongAdder();
    private final LongAdder deliveryAttempts = new LongAdder();
    private final AtomicReference<DeliveryCompleted> lastDelivery = new AtomicReference<>();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    public PipelineDiagnostics(EventBus eventBus, Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        eventBus.subscribe(Event.class, event -> eventsTotal.increment());
        eventBus.subscribe(CycleCompleted.class, this::onCycleCompleted);
        eventBus.subscribe(TickSkipped.class, event -> ticksSkipped.increment());
        eventBus.subscribe(AlertFired.class, event -> alertsFired.increment());
        eventBus.subscribe(DeliveryCompleted.class, this::onDeliveryCompleted);
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("uptimeSeconds", Duration.between(startedAt, clock.instant()).getSeconds());
        metrics.put("eventsTotal", eventsTotal.sum());
        metrics.put("cyclesCompleted", cyclesCompleted.sum());
        metrics.put("cyclesFailed", cyclesFailed.sum());
        metrics.put("ticksSkipped", ticksSkipped.sum());
        metrics.put("alertsFired", alertsFired.sum());
        metrics.put("deliveriesSucceeded", deliveriesSucceeded.sum());
        metrics.put("deliveriesFailed", deliveriesFailed.sum());
        metrics.put("deliveryAttempts", deliveryAttempts.sum());
        DeliveryCompleted delivery = lastDelivery.get();
        if (delivery != null) {
            metrics.put("lastDeliveryAt", delivery.timestamp().toString());
            metrics.put("lastDeliverySuccess", delivery.success());
        }
        String error = lastError.get();
        if (error != null) {
            metrics.put("lastError", error);
        }
        return metrics;
    }

    public String summary() {
        return "Pipeline diagnostics " + snapshot();
    }

    private void onCycleCompleted(CycleCompleted event) {
        cyclesCompleted.increment();
        if (!event.success()) {
            cyclesFailed.increment();
            if (event.error() != null) {
                lastError.set(event.error());
            }
        }
        LOGGER.fine(this::summary);
    }

    private void onDeliveryCompleted(DeliveryCompleted event) {
        deliveryAttempts.add(event.attempts());
        if (event.success()) {
            deliveriesSucceeded.increment();
        } else {
            deliveriesFailed.increment();
        }
        lastDelivery.set(event);
    }
}
