package com.switchyard.core.model;

/**
 * Coarse complexity classification used to pick a compute profile.
 */
public enum ComplexityTier {
    SIMPLE,
    MODERATE,
    COMPLEX
}
