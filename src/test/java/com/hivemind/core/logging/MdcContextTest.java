package com.hivemind.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setMission puts missionId in MDC")
    void setMission() {
        MdcContext.setMission("HVMD-2026-0001");
        assertEquals("HVMD-2026-0001", MDC.get("missionId"));
    }

    @Test
    @DisplayName("setAgent puts missionId, agentId and role in MDC")
    void setAgent() {
        MdcContext.setAgent("HVMD-2026-0001", "developer-2", "developer");
        assertEquals("HVMD-2026-0001", MDC.get("missionId"));
        assertEquals("developer-2", MDC.get("agentId"));
        assertEquals("developer", MDC.get("role"));
    }

    @Test
    @DisplayName("setTask with null removes the key")
    void setTaskNull() {
        MdcContext.setTask("3fa9c2d1");
        assertEquals("3fa9c2d1", MDC.get("taskId"));
        MdcContext.setTask(null);
        assertNull(MDC.get("taskId"));
    }

    @Test
    @DisplayName("clear removes all hivemind MDC keys")
    void clear() {
        MdcContext.setAgent("HVMD-2026-0001", "developer", "developer");
        MdcContext.setTask("3fa9c2d1");
        MdcContext.clear();
        assertNull(MDC.get("missionId"));
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("role"));
        assertNull(MDC.get("taskId"));
    }
}
