package com.metricsentinel.collectors.alerts;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last-fired time per alert key. Only {@link AlertDeduplicator} mutates it; reads and writes go through one lock
 * so the check-then-record step stays atomic even if cycles ever run on more than one worker.
 */
public final class AlertState {
    private final Map<String, Instant> lastFired = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public Optional<Instant> lastFired(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(lastFired.get(key));
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Instant> snapshot() {
        lock.lock();
        try {
            return Map.copyOf(lastFired);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return lastFired.size();
        } finally {
            lock.unlock();
        }
    }

    boolean fireIfDue(String key, Instant now, Duration cooldown) {
        lock.lock();
        try {
            Instant previous = lastFired.get(key);
            if (previous != null && Duration.between(previous, now).compareTo(cooldown) < 0) {
                return false;
            }
            lastFired.put(key, now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    int retainOnly(Set<String> activeKeys) {
        lock.lock();
        try {
            int before = lastFired.size();
            lastFired.keySet().retainAll(activeKeys);
            return before - lastFired.size();
        } finally {
            lock.unlock();
        }
    }
}
