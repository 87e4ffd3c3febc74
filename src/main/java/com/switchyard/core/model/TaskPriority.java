package com.switchyard.core.model;

/**
 * Priority of a queued task. Declaration order is ascending; higher runs first.
 */
public enum TaskPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
