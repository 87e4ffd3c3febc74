package com.switchyard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.switchyard.core.model.RoutingDecision;
import com.switchyard.core.model.TaskResult;

import java.time.Instant;
import java.util.Map;

/**
 * Outbound JSON for POST /api/v1/route.
 */
public record RouteResponse(
    String agent,
    boolean success,
    Object output,
    String error,
    Map<String, Object> metadata,
    Instant timestamp,
    @JsonProperty("compute_tier") String computeTier,
    String model
) {
    static RouteResponse from(TaskResult result, RoutingDecision decision) {
        return new RouteResponse(result.agent().value(), result.success(), result.output(), result.error(),
                result.metadata(), result.timestamp(), decision.tier().name(), decision.model());
    }
}
