package com.wayfinder.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Wayfinder-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setTask(String sessionId, String taskType) {
        MDC.put("sessionId", sessionId);
        MDC.put("taskType", taskType);
    }

    public static void setTool(String sessionId, String toolName) {
        MDC.put("sessionId", sessionId);
        MDC.put("toolName", toolName);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("taskType");
        MDC.remove("toolName");
    }
}
