package com.switchyard.core.model;

/**
 * Lifecycle of a task submitted to a dispatch channel.
 */
public enum QueuedTaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
