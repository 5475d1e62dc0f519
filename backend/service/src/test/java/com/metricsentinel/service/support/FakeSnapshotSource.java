package com.metricsentinel.service.support;

import com.metricsentinel.collectors.api.SnapshotException;
import com.metricsentinel.collectors.api.SnapshotScope;
import com.metricsentinel.collectors.api.SnapshotSource;
import com.metricsentinel.core.model.CpuStats;
import com.metricsentinel.core.model.MetricSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Returns a CPU-only snapshot at a fixed percentage. Can be told to fail once or to block until released.
 */
public class FakeSnapshotSource implements SnapshotSource {
    private final double cpuPercent;
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final AtomicInteger concurrent = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();
    private final List<SnapshotScope> scopes = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch gate;
    private final CountDownLatch entered = new CountDownLatch(1);

    public FakeSnapshotSource(double cpuPercent) {
        this.cpuPercent = cpuPercent;
    }

    public FakeSnapshotSource failNext(int times) {
        failuresLeft.set(times);
        return this;
    }

    public FakeSnapshotSource blockUntil(CountDownLatch release) {
        this.gate = release;
        return this;
    }

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public MetricSnapshot sample(Instant at, SnapshotScope scope) throws SnapshotException {
        int running = concurrent.incrementAndGet();
        maxConcurrent.accumulateAndGet(running, Math::max);
        try {
            scopes.add(scope);
            entered.countDown();
            CountDownLatch release = gate;
            if (release != null) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SnapshotException("interrupted while sampling", e);
                }
            }
            if (failuresLeft.getAndUpdate(left -> Math.max(0, left - 1)) > 0) {
                throw new SnapshotException("counters unavailable");
            }
            return new MetricSnapshot(at, "host-a", CpuStats.ofPercent(cpuPercent), null, null, null, null, null);
        } finally {
            concurrent.decrementAndGet();
        }
    }

    public CountDownLatch entered() {
        return entered;
    }

    public int maxConcurrent() {
        return maxConcurrent.get();
    }

    public List<SnapshotScope> scopes() {
        return List.copyOf(scopes);
    }
}
