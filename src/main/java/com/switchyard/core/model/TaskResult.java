package com.switchyard.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of routing one request.
 *
 * @param agent     category that handled (or was meant to handle) the request
 * @param success   whether the handler produced an output
 * @param output    handler output (null on failure)
 * @param error     error message on failure, otherwise null
 * @param metadata  review outcome, fallback info and similar annotations
 * @param timestamp when the result was produced
 */
public record TaskResult(
    AgentCategory agent,
    boolean success,
    Object output,
    String error,
    Map<String, Object> metadata,
    Instant timestamp
) {
    public TaskResult {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static TaskResult succeeded(AgentCategory agent, Object output, Map<String, Object> metadata) {
        return new TaskResult(agent, true, output, null, metadata, Instant.now());
    }

    public static TaskResult failed(AgentCategory agent, String error, Map<String, Object> metadata) {
        return new TaskResult(agent, false, null, error, metadata, Instant.now());
    }

    /** Copy of this result with extra metadata merged in. */
    public TaskResult withMetadata(Map<String, Object> extra) {
        var merged = new LinkedHashMap<String, Object>(metadata);
        merged.putAll(extra);
        return new TaskResult(agent, success, output, error, merged, timestamp);
    }
}
