package com.switchyard.core.model;

/**
 * Compute profile chosen for a generative request.
 *
 * @param domain      caller-declared domain the decision was made for
 * @param tier        classified complexity
 * @param provider    model provider id (e.g. "anthropic", "openai")
 * @param model       model id
 * @param maxTokens   output token budget
 * @param temperature sampling temperature
 * @param reason      human-readable justification
 */
public record RoutingDecision(
    String domain,
    ComplexityTier tier,
    String provider,
    String model,
    int maxTokens,
    double temperature,
    String reason
) {}
