package com.metricsentinel.collectors.alerts;

import com.metricsentinel.core.model.AlertCandidate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Lets a candidate through only when its key has never fired or its last firing is at least one cooldown old.
 * Suppressed candidates are dropped and leave the state untouched, so the window always runs from the last
 * fired alert.
 */
public final class AlertDeduplicator {
    private static final Logger LOGGER = Logger.getLogger(AlertDeduplicator.class.getName());

    public List<AlertCandidate> filter(List<AlertCandidate> candidates, AlertState state, Instant now, Duration cooldown) {
        Objects.requireNonNull(state, "state is required");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative: " + cooldown);
        }
        List<AlertCandidate> fired = new ArrayList<>();
        for (AlertCandidate candidate : candidates) {
            if (state.fireIfDue(candidate.key(), now, cooldown)) {
                fired.add(candidate);
            } else {
                LOGGER.fine(() -> "Suppressed alert within cooldown: " + candidate.describe()
                        + " (last fired " + state.lastFired(candidate.key()).orElse(null) + ")");
            }
        }
        return List.copyOf(fired);
    }

    /**
     * Forgets keys that no longer have a threshold. Keys still configured keep their last-fired time whatever the
     * cooldown, so a later, longer cooldown is still measured from the real last firing.
     */
    public int prune(AlertState state, Collection<String> activeKeys) {
        int removed = state.retainOnly(Set.copyOf(activeKeys));
        if (removed > 0) {
            LOGGER.fine(() -> "Dropped alert state for " + removed + " key(s) without a threshold");
        }
        return removed;
    }
}
