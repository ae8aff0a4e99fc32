package com.strategist.core.model;

import java.util.Locale;

/**
 * Stages of the planning workflow, in execution order.
 */
public enum WorkflowStage {
    ANALYSIS,
    DECOMPOSITION,
    TASK_GRAPH,
    MISSION_MAP,
    COMPLETE;

    /** The stage after this one; {@code COMPLETE} has no successor and returns itself. */
    public WorkflowStage next() {
        return this == COMPLETE ? COMPLETE : values()[ordinal() + 1];
    }

    public boolean isAfter(WorkflowStage other) {
        return ordinal() > other.ordinal();
    }

    /** Accepts "task_graph", "task-graph" or "TASK_GRAPH". */
    public static WorkflowStage fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
