package com.switchyard.core.router;

import com.switchyard.core.model.ComplexityTier;

import java.util.Locale;
import java.util.Map;

/**
 * Compute profiles per complexity tier, with domain-specific variants for the tiers
 * where the domain changes the best choice.
 */
public final class ModelCatalog {

    public record ComputeProfile(
            String provider,
            String model,
            int maxTokens,
            double temperature,
            String description
    ) {}

    public static final ComputeProfile FAST = new ComputeProfile(
            "openai", "gpt-4o-mini", 1024, 0.6, "Cheapest and fastest");

    public static final ComputeProfile GENERAL = new ComputeProfile(
            "openai", "gpt-4o", 2048, 0.7, "General reasoning");

    public static final ComputeProfile REASONING = new ComputeProfile(
            "anthropic", "claude-sonnet-4-20250514", 8192, 0.3, "Full power for complex work");

    public static final ComputeProfile ENGINEERING = new ComputeProfile(
            "anthropic", "claude-sonnet-4-20250514", 8192, 0.2, "Best spatial/code, low temperature for precision");

    public static final ComputeProfile MARKET_ANALYSIS = new ComputeProfile(
            "openai", "gpt-4o", 4096, 0.7, "Best general reasoning for market analysis");

    private static final Map<ComplexityTier, ComputeProfile> BY_TIER = Map.of(
            ComplexityTier.SIMPLE, FAST,
            ComplexityTier.MODERATE, GENERAL,
            ComplexityTier.COMPLEX, REASONING
    );

    private ModelCatalog() {}

    public static ComputeProfile profileFor(ComplexityTier tier, String domain) {
        if (tier == ComplexityTier.SIMPLE || domain == null) {
            return BY_TIER.get(tier);
        }
        return switch (domain.toLowerCase(Locale.ROOT)) {
            case "cad" -> ENGINEERING;
            case "trading" -> tier == ComplexityTier.COMPLEX ? MARKET_ANALYSIS : GENERAL;
            default -> BY_TIER.get(tier);
        };
    }
}
