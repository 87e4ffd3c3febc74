package com.switchyard.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the dispatch layer. Streamed by the status API and retained in the bus tail.
 *
 * @param eventType event type (e.g. "task.completed", "circuit.open", "route.completed")
 * @param source    channel, circuit or category name the event belongs to
 * @param subjectId task id or request id this event relates to (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SwitchyardEvent(
    String eventType,
    String source,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static SwitchyardEvent of(String eventType, String source, String subjectId,
                                     Map<String, Object> payload) {
        return new SwitchyardEvent(eventType, source, subjectId, payload, Instant.now());
    }
}
