package com.switchyard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Switchyard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(String requestId, String category) {
        MDC.put("requestId", requestId);
        MDC.put("category", category);
    }

    public static void setTask(String channel, String taskId) {
        MDC.put("channel", channel);
        MDC.put("taskId", taskId);
    }

    public static void setCircuit(String circuit) {
        MDC.put("circuit", circuit);
    }

    public static void clearCircuit() {
        MDC.remove("circuit");
    }

    public static void clearTask() {
        MDC.remove("channel");
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("category");
        MDC.remove("channel");
        MDC.remove("taskId");
        MDC.remove("circuit");
    }
}
