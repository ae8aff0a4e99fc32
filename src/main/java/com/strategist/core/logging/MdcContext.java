package com.strategist.core.logging;

import com.strategist.core.model.WorkflowStage;
import org.slf4j.MDC;

import java.util.Locale;

/**
 * Utility for managing planner MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String PLAN_ID = "planId";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setPlan(String planId) {
        MDC.put(PLAN_ID, planId);
    }

    public static void setStage(String planId, WorkflowStage stage) {
        MDC.put(PLAN_ID, planId);
        MDC.put(STAGE, stage.name().toLowerCase(Locale.ROOT));
    }

    public static void clearStage() {
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(PLAN_ID);
        MDC.remove(STAGE);
    }
}
