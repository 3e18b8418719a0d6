package com.tandem.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tandem-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setActor(long userId) {
        MDC.put("actor", "user_" + userId);
    }

    public static void setProject(long projectId) {
        MDC.put("projectId", String.valueOf(projectId));
    }

    public static void setTask(long projectId, long taskId) {
        MDC.put("projectId", String.valueOf(projectId));
        MDC.put("taskId", String.valueOf(taskId));
    }

    public static void setSession(String sessionId) {
        if (sessionId != null) {
            MDC.put("sessionId", sessionId);
        }
    }

    public static void clear() {
        MDC.remove("actor");
        MDC.remove("projectId");
        MDC.remove("taskId");
        MDC.remove("sessionId");
    }
}
