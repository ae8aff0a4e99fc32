package com.strategist.core.logging;

import com.strategist.core.model.WorkflowStage;
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
    @DisplayName("setPlan puts planId in MDC")
    void setPlan() {
        MdcContext.setPlan("PLAN-2026-0001");
        assertEquals("PLAN-2026-0001", MDC.get("planId"));
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("setStage puts planId and the lowercase stage in MDC")
    void setStage() {
        MdcContext.setStage("PLAN-2026-0001", WorkflowStage.MISSION_MAP);
        assertEquals("PLAN-2026-0001", MDC.get("planId"));
        assertEquals("mission_map", MDC.get("stage"));
    }

    @Test
    @DisplayName("clearStage keeps the plan id")
    void clearStage() {
        MdcContext.setStage("PLAN-2026-0001", WorkflowStage.DECOMPOSITION);
        MdcContext.clearStage();
        assertEquals("PLAN-2026-0001", MDC.get("planId"));
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("clear removes all planner MDC keys")
    void clear() {
        MdcContext.setStage("PLAN-2026-0001", WorkflowStage.TASK_GRAPH);
        MdcContext.clear();
        assertNull(MDC.get("planId"));
        assertNull(MDC.get("stage"));
    }
}
