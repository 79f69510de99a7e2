package com.locus.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing worker-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorker(String agentId, String workspaceId) {
        MDC.put("agentId", agentId);
        MDC.put("workspaceId", workspaceId);
    }

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void setSandbox(String sandboxName) {
        MDC.put("sandbox", sandboxName);
    }

    public static void clearSandbox() {
        MDC.remove("sandbox");
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("workspaceId");
        MDC.remove("taskId");
        MDC.remove("sandbox");
    }
}
