package com.switchyard.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory pub/sub for dispatch, circuit and routing events.
 * <p>
 * Subscribers register a filter: one source (a channel, circuit or the orchestrator),
 * an event-type prefix such as {@code "circuit."}, or everything. The bus also keeps a
 * bounded tail of the most recent events for late readers such as the status API.
 * A subscriber that throws is logged and skipped; delivery to the rest continues.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int DEFAULT_RETAINED = 200;

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final Deque<SwitchyardEvent> retained = new ArrayDeque<>();
    private final int retainedLimit;

    public EventBus(int retainedLimit) {
        this.retainedLimit = Math.max(0, retainedLimit);
    }

    public EventBus() {
        this(DEFAULT_RETAINED);
    }

    public void publish(SwitchyardEvent event) {
        log.debug("Event {} from {}", event.eventType(), event.source());
        retain(event);
        for (Registration registration : registrations) {
            if (registration.filter().test(event)) {
                deliver(registration, event);
            }
        }
    }

    /** Events from one source only. */
    public Subscription subscribe(String source, Consumer<SwitchyardEvent> consumer) {
        return register("source " + source, e -> source.equals(e.source()), consumer);
    }

    /** Events whose type starts with {@code prefix}, from any source. */
    public Subscription subscribeToType(String prefix, Consumer<SwitchyardEvent> consumer) {
        return register("type " + prefix + "*", e -> e.eventType().startsWith(prefix), consumer);
    }

    public Subscription subscribeAll(Consumer<SwitchyardEvent> consumer) {
        return register("all events", e -> true, consumer);
    }

    public int subscriberCount() {
        return registrations.size();
    }

    /**
     * Most recent retained events, oldest first.
     *
     * @param source only events from this source, or null for all
     */
    public List<SwitchyardEvent> recent(String source, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        var out = new ArrayList<SwitchyardEvent>();
        synchronized (retained) {
            Iterator<SwitchyardEvent> newestFirst = retained.descendingIterator();
            while (newestFirst.hasNext() && out.size() < limit) {
                SwitchyardEvent event = newestFirst.next();
                if (source == null || source.equals(event.source())) {
                    out.add(event);
                }
            }
        }
        Collections.reverse(out);
        return out;
    }

    public List<SwitchyardEvent> recent(int limit) {
        return recent(null, limit);
    }

    /** Cancels a subscription. Calling it twice is harmless. */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(String label, Predicate<SwitchyardEvent> filter, Consumer<SwitchyardEvent> consumer) {
        var registration = new Registration(label, filter, consumer);
        registrations.add(registration);
        log.debug("Subscribed to {}", label);
        return () -> registrations.remove(registration);
    }

    private void retain(SwitchyardEvent event) {
        if (retainedLimit == 0) {
            return;
        }
        synchronized (retained) {
            retained.addLast(event);
            if (retained.size() > retainedLimit) {
                retained.removeFirst();
            }
        }
    }

    private static void deliver(Registration registration, SwitchyardEvent event) {
        try {
            registration.consumer().accept(event);
        } catch (Exception e) {
            log.warn("Subscriber to {} failed on {}: {}", registration.label(), event.eventType(), e.getMessage(), e);
        }
    }

    private record Registration(String label, Predicate<SwitchyardEvent> filter, Consumer<SwitchyardEvent> consumer) {}
}
