package com.hivemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Hivemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMission(String missionId) {
        putOrRemove("missionId", missionId);
    }

    public static void setAgent(String missionId, String agentId, String role) {
        putOrRemove("missionId", missionId);
        putOrRemove("agentId", agentId);
        putOrRemove("role", role);
    }

    public static void setTask(String taskId) {
        putOrRemove("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("missionId");
        MDC.remove("agentId");
        MDC.remove("role");
        MDC.remove("taskId");
    }

    private static void putOrRemove(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
