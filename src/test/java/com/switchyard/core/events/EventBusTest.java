package com.switchyard.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to subscribers of its source")
        void deliversToSourceSubscriber() {
            List<SwitchyardEvent> received = new ArrayList<>();
            eventBus.subscribe("cad", received::add);

            var event = SwitchyardEvent.of("task.completed", "cad", "cad-000001", Map.of("command", "get_bom"));
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver events from other sources")
        void skipsOtherSources() {
            List<SwitchyardEvent> received = new ArrayList<>();
            eventBus.subscribe("trading", received::add);

            eventBus.publish(SwitchyardEvent.of("task.completed", "cad", "cad-000001", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers events in publish order")
        void preservesOrder() {
            List<SwitchyardEvent> received = new ArrayList<>();
            eventBus.subscribe("x", received::add);

            eventBus.publish(SwitchyardEvent.of("circuit.open", "x", null, Map.of()));
            eventBus.publish(SwitchyardEvent.of("circuit.half_open", "x", null, Map.of()));
            eventBus.publish(SwitchyardEvent.of("circuit.closed", "x", null, Map.of()));

            assertEquals(List.of("circuit.open", "circuit.half_open", "circuit.closed"),
                    received.stream().map(SwitchyardEvent::eventType).toList());
        }
    }

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("global and source subscribers both receive the event")
        void bothReceive() {
            List<SwitchyardEvent> global = new ArrayList<>();
            List<SwitchyardEvent> scoped = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("cad", scoped::add);

            eventBus.publish(SwitchyardEvent.of("task.submitted", "cad", "cad-000001", Map.of()));
            eventBus.publish(SwitchyardEvent.of("task.submitted", "trading", "trading-000002", Map.of()));

            assertEquals(2, global.size());
            assertEquals(1, scoped.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe and isolation")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<SwitchyardEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("cad", received::add);

            eventBus.publish(SwitchyardEvent.of("task.submitted", "cad", "cad-000001", Map.of()));
            subscription.unsubscribe();
            eventBus.publish(SwitchyardEvent.of("task.completed", "cad", "cad-000001", Map.of()));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void subscriberExceptionIsolated() {
            List<SwitchyardEvent> received = new ArrayList<>();
            eventBus.subscribe("cad", e -> { throw new IllegalStateException("boom"); });
            eventBus.subscribe("cad", received::add);

            assertDoesNotThrow(() -> eventBus.publish(SwitchyardEvent.of("task.failed", "cad", "cad-000001", Map.of())));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("concurrent publishers deliver every event")
        void concurrentPublish() throws Exception {
            List<SwitchyardEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);
            var done = new CountDownLatch(4);

            for (int t = 0; t < 4; t++) {
                String source = "ch-" + t;
                new Thread(() -> {
                    for (int i = 0; i < 50; i++) {
                        eventBus.publish(SwitchyardEvent.of("task.submitted", source, null, Map.of()));
                    }
                    done.countDown();
                }).start();
            }

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(200, received.size());
        }
    }

    @Nested
    @DisplayName("type subscription")
    class TypeSubscriptionTests {

        @Test
        @DisplayName("delivers only events whose type has the prefix")
        void prefixFilter() {
            List<SwitchyardEvent> circuits = new ArrayList<>();
            eventBus.subscribeToType("circuit.", circuits::add);

            eventBus.publish(SwitchyardEvent.of("circuit.open", "trading", null, Map.of()));
            eventBus.publish(SwitchyardEvent.of("task.failed", "cad", "cad-000001", Map.of()));
            eventBus.publish(SwitchyardEvent.of("circuit.rejected", "cad", null, Map.of()));

            assertEquals(List.of("circuit.open", "circuit.rejected"),
                    circuits.stream().map(SwitchyardEvent::eventType).toList());
        }

        @Test
        @DisplayName("subscriber count follows subscribe and unsubscribe")
        void subscriberCount() {
            var a = eventBus.subscribeToType("task.", e -> { });
            eventBus.subscribeAll(e -> { });
            assertEquals(2, eventBus.subscriberCount());

            a.unsubscribe();
            a.unsubscribe();
            assertEquals(1, eventBus.subscriberCount());
        }
    }

    @Nested
    @DisplayName("retained tail")
    class RetainedTailTests {

        @Test
        @DisplayName("recent events are returned oldest first, newest kept")
        void recentOrder() {
            for (int i = 1; i <= 5; i++) {
                eventBus.publish(SwitchyardEvent.of("task.submitted", "cad", "cad-00000" + i, Map.of()));
            }

            assertEquals(List.of("cad-000004", "cad-000005"),
                    eventBus.recent(2).stream().map(SwitchyardEvent::subjectId).toList());
            assertTrue(eventBus.recent(0).isEmpty());
        }

        @Test
        @DisplayName("recent can be narrowed to one source")
        void recentBySource() {
            eventBus.publish(SwitchyardEvent.of("task.submitted", "cad", "cad-000001", Map.of()));
            eventBus.publish(SwitchyardEvent.of("route.completed", "orchestrator", "req-1", Map.of()));
            eventBus.publish(SwitchyardEvent.of("task.completed", "cad", "cad-000001", Map.of()));

            assertEquals(List.of("task.submitted", "task.completed"),
                    eventBus.recent("cad", 10).stream().map(SwitchyardEvent::eventType).toList());
        }

        @Test
        @DisplayName("the tail is bounded")
        void bounded() {
            var small = new EventBus(3);
            for (int i = 0; i < 10; i++) {
                small.publish(SwitchyardEvent.of("task.submitted", "cad", "t" + i, Map.of()));
            }

            assertEquals(List.of("t7", "t8", "t9"),
                    small.recent(100).stream().map(SwitchyardEvent::subjectId).toList());
        }

        @Test
        @DisplayName("events are retained without any subscriber")
        void retainedWithoutSubscribers() {
            eventBus.publish(SwitchyardEvent.of("circuit.closed", "desktop", null, Map.of()));
            assertEquals(1, eventBus.recent(10).size());
        }
    }
}
