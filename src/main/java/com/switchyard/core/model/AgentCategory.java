package com.switchyard.core.model;

import java.util.Locale;

/**
 * Handler categories the orchestrator can route a request to.
 */
public enum AgentCategory {
    TRADING("trading"),
    CAD("cad"),
    SKETCH("sketch"),
    WORK("work"),
    INSPECTOR("inspector"),
    SYSTEM("system"),
    GENERAL("general");

    private final String value;

    AgentCategory(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a category from its wire value or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if no category matches
     */
    public static AgentCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Category must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown agent category: " + value);
    }
}
