package com.switchyard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/route.
 *
 * @param message        free-text request
 * @param context        optional handler context
 * @param category       preferred category; nullable, classified from the message when absent
 * @param requireReview  pass a successful result through the inspector
 */
public record RouteApiRequest(
    String message,
    Map<String, Object> context,
    String category,
    @JsonProperty("require_review") boolean requireReview
) {}
