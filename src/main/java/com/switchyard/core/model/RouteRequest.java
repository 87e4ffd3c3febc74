package com.switchyard.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound request to the orchestrator.
 *
 * @param message           free-text request
 * @param context           caller-supplied context, never null; values may be null
 * @param preferredCategory explicit category override (nullable)
 * @param requireReview     whether the result must pass through the inspector
 */
public record RouteRequest(
    String message,
    Map<String, Object> context,
    AgentCategory preferredCategory,
    boolean requireReview
) {
    public RouteRequest {
        message = message == null ? "" : message;
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static RouteRequest of(String message) {
        return new RouteRequest(message, Map.of(), null, false);
    }
}
