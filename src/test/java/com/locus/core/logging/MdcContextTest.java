package com.locus.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void taskAndSandboxKeysCanBeClearedIndependently() {
        MdcContext.setWorker("agent-1", "ws-1");
        MdcContext.setTask("task-1");
        MdcContext.setSandbox("locus-app-1");

        MdcContext.clearTask();
        MdcContext.clearSandbox();

        assertEquals("agent-1", MDC.get("agentId"));
        assertEquals("ws-1", MDC.get("workspaceId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("sandbox"));
    }

    @Test
    void clearRemovesOnlyWorkerKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setWorker("agent-1", "ws-1");
        MdcContext.setTask("task-1");

        MdcContext.clear();

        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("taskId"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
