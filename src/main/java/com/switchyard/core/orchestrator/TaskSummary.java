package com.switchyard.core.orchestrator;

import java.time.Instant;

/**
 * History entry returned by {@link Orchestrator#getTaskHistory(int)}.
 */
public record TaskSummary(
    String agent,
    boolean success,
    String error,
    Instant timestamp
) {}
