package com.metricsentinel.service.runtime;

import com.metricsentinel.collectors.api.SnapshotException;
import com.metricsentinel.collectors.delivery.DeliveryOutcome;
import com.metricsentinel.collectors.notify.Notifiers;
import com.metricsentinel.core.events.AlertFired;
import com.metricsentinel.core.events.ConfigReloaded;
import com.metricsentinel.core.events.CycleCompleted;
import com.metricsentinel.core.events.CycleStarted;
import com.metricsentinel.core.events.DeliveryCompleted;
import com.metricsentinel.core.events.TickSkipped;
import com.metricsentinel.core.model.AlertCandidate;
import com.metricsentinel.core.model.MetricSnapshot;
import com.metricsentinel.service.config.AgentConfig;
import com.metricsentinel.service.config.ConfigHolder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives sample, evaluate, filter, notify and deliver on a fixed interval.
 * <p>
 * A timer thread fires ticks; a single worker thread runs cycles. A tick that arrives while a cycle is still in
 * flight is skipped, never queued, so at most one cycle touches the alert state at a time. Every cycle failure is
 * contained and logged. {@link #shutdown()} stops new ticks, lets the in-flight cycle finish within a grace period
 * and interrupts it after that.
 */
public class CollectionLoop {
    private static final Logger LOGGER = Logger.getLogger(CollectionLoop.class.getName());

    private final ConfigHolder config;
    private final CycleContext context;
    private final Duration intervalUnit;
    private final Duration shutdownGrace;
    private final ScheduledExecutorService timerExecutor =
            Executors.newSingleThreadScheduledExecutor(named("metric-sentinel-timer"));
    private final ExecutorService cycleExecutor = Executors.newSingleThreadExecutor(named("metric-sentinel-cycle"));
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicBoolean stopping = new AtomicBoolean();
    private final AtomicLong cycleCounter = new AtomicLong();

    private ScheduledFuture<?> ticker;
    private int scheduledIntervalSeconds;

    public CollectionLoop(ConfigHolder config, CycleContext context) {
        this(config, context, Duration.ofSeconds(1), Duration.ofSeconds(10));
    }

    CollectionLoop(ConfigHolder config, CycleContext context, Duration intervalUnit, Duration shutdownGrace) {
        this.config = config;
        this.context = context;
        this.intervalUnit = intervalUnit;
        this.shutdownGrace = shutdownGrace;
        context.eventBus().subscribe(ConfigReloaded.class, this::onConfigReloaded);
    }

    public synchronized void start() {
        if (stopping.get()) {
            throw new IllegalStateException("Collection loop has been shut down");
        }
        if (ticker != null) {
            return;
        }
        int intervalSeconds = config.current().intervalSeconds();
        schedule(intervalSeconds, 0);
        LOGGER.info("Collection loop started with interval " + intervalSeconds + "s");
    }

    /**
     * Runs one cycle on the calling thread. Refuses to run while another cycle is in flight.
     */
    public CycleResult runOnce() {
        if (!inFlight.compareAndSet(false, true)) {
            return CycleResult.failure(cycleCounter.get(), "Another cycle is in progress");
        }
        try {
            return runCycle();
        } finally {
            inFlight.set(false);
        }
    }

    public void shutdown() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (ticker != null) {
                ticker.cancel(false);
            }
        }
        timerExecutor.shutdown();
        cycleExecutor.shutdown();
        try {
            if (!cycleExecutor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning("In-flight cycle still running after " + shutdownGrace.toMillis()
                        + "ms; interrupting it");
                cycleExecutor.shutdownNow();
                cycleExecutor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
            }
            timerExecutor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            cycleExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Collection loop stopped after " + cycleCounter.get() + " cycle(s)");
    }

    public boolean isCycleInFlight() {
        return inFlight.get();
    }

    public long cyclesStarted() {
        return cycleCounter.get();
    }

    private void schedule(int intervalSeconds, long initialDelayMillis) {
        long periodMillis = Math.max(1, intervalUnit.multipliedBy(intervalSeconds).toMillis());
        ticker = timerExecutor.scheduleAtFixedRate(this::onTick, initialDelayMillis, periodMillis, TimeUnit.MILLISECONDS);
        scheduledIntervalSeconds = intervalSeconds;
    }

    private void onTick() {
        try {
            if (stopping.get()) {
                return;
            }
            if (!inFlight.compareAndSet(false, true)) {
                long running = cycleCounter.get();
                LOGGER.warning("Cycle " + running + " still running; skipping this tick");
                context.eventBus().publish(new TickSkipped(context.clock().instant(), running));
                return;
            }
            try {
                cycleExecutor.execute(() -> {
                    try {
                        runCycle();
                    } finally {
                        inFlight.set(false);
                    }
                });
            } catch (RejectedExecutionException e) {
                inFlight.set(false);
            }
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the periodic task
            LOGGER.log(Level.SEVERE, "Tick handling failed", e);
        }
    }

    private CycleResult runCycle() {
        long cycle = cycleCounter.incrementAndGet();
        AgentConfig cfg = config.current();
        Instant startedAt = context.clock().instant();
        context.eventBus().publish(new CycleStarted(startedAt, cycle));

        CycleResult result;
        try {
            result = executeCycle(cycle, cfg, startedAt);
        } catch (SnapshotException e) {
            LOGGER.log(Level.WARNING, "Cycle " + cycle + " aborted: sampling from "
                    + context.source().name() + " failed", e);
            result = CycleResult.failure(cycle, "Sampling failed: " + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Cycle " + cycle + " failed", e);
            result = CycleResult.failure(cycle, "Cycle failed: " + e);
        }

        long durationMillis = Duration.between(startedAt, context.clock().instant()).toMillis();
        context.eventBus().publish(new CycleCompleted(
                context.clock().instant(),
                cycle,
                result.success(),
                durationMillis,
                result.alertsFired(),
                result.success() ? null : result.message()
        ));
        return result;
    }

    private CycleResult executeCycle(long cycle, AgentConfig cfg, Instant startedAt) throws SnapshotException {
        MetricSnapshot snapshot = context.source().sample(startedAt, cfg.metrics().toScope());

        List<AlertCandidate> candidates = List.of();
        List<AlertCandidate> fired = List.of();
        if (cfg.alerts().enabled()) {
            candidates = context.evaluator().evaluate(snapshot, cfg.thresholds());
            Duration cooldown = cfg.alerts().cooldown();
            fired = context.deduplicator().filter(candidates, context.alertState(), snapshot.timestamp(), cooldown);
            context.deduplicator().prune(context.alertState(), cfg.thresholds().bounds().keySet());
            for (AlertCandidate alert : fired) {
                context.eventBus().publish(new AlertFired(
                        context.clock().instant(), alert.key(), alert.value(), alert.threshold(), snapshot.hostname()));
            }
            if (!fired.isEmpty()) {
                Notifiers.dispatch(context.notifiers().apply(cfg), fired, snapshot.hostname());
            }
        }

        DeliveryOutcome outcome = context.deliveryClient().send(snapshot, fired, cfg.endpoint().toEndpointConfig());
        context.eventBus().publish(new DeliveryCompleted(
                context.clock().instant(),
                outcome.success(),
                outcome.attempts(),
                outcome.lastStatus(),
                outcome.error()
        ));

        int candidateCount = candidates.size();
        int firedCount = fired.size();
        LOGGER.fine(() -> "Cycle " + cycle + ": " + candidateCount + " candidate(s), " + firedCount
                + " fired, delivery " + (outcome.success() ? "ok" : "failed") + " in " + outcome.attempts()
                + " attempt(s)");
        return CycleResult.delivered(cycle, candidateCount, firedCount, outcome);
    }

    private synchronized void onConfigReloaded(ConfigReloaded event) {
        if (stopping.get() || ticker == null || event.intervalSeconds() == scheduledIntervalSeconds) {
            return;
        }
        ticker.cancel(false);
        long delayMillis = intervalUnit.multipliedBy(event.intervalSeconds()).toMillis();
        schedule(event.intervalSeconds(), delayMillis);
        LOGGER.info("Collection interval changed to " + event.intervalSeconds() + "s");
    }

    private static ThreadFactory named(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(false);
            return thread;
        };
    }
}
