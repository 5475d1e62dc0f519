package com.metricsentinel.core.bus;

import com.metricsentinel.core.events.CycleStarted;
import com.metricsentinel.core.events.Event;
import com.metricsentinel.core.events.TickSkipped;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(CycleStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(CycleStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new CycleStarted(NOW, 1));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger cycleHits = new AtomicInteger();
        AtomicInteger skipHits = new AtomicInteger();

        bus.subscribe(CycleStarted.class, event -> cycleHits.incrementAndGet());
        bus.subscribe(TickSkipped.class, event -> skipHits.incrementAndGet());

        bus.publish(new CycleStarted(NOW, 1));
        bus.publish(new TickSkipped(NOW, 1));
        bus.publish(new TickSkipped(NOW, 1));

        assertEquals(1, cycleHits.get());
        assertEquals(2, skipHits.get());
    }

    @Test
    void wildcardSubscribersSeeEveryEventAfterTypedOnes() {
        EventBus bus = new EventBus();
        List<String> seen = new ArrayList<>();

        bus.subscribe(Event.class, event -> seen.add("any:" + event.type()));
        bus.subscribe(CycleStarted.class, event -> seen.add("typed:" + event.type()));

        bus.publish(new CycleStarted(NOW, 7));
        bus.publish(new TickSkipped(NOW, 7));

        assertEquals(List.of("typed:CycleStarted", "any:CycleStarted", "any:TickSkipped"), seen);
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(CycleStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(CycleStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new CycleStarted(NOW, 3));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }
}
