package com.strategist.core.model;

import java.io.Serializable;

/**
 * Accumulated results of a (possibly partial) planning run.
 *
 * @param stage         last stage whose output is present ({@code COMPLETE} after a mission map)
 * @param analysis      the analysis the run used, after refinement
 * @param decomposition phase decomposition; nullable if the run started from a supplied task graph
 * @param taskGraph     task graph; nullable before {@code TASK_GRAPH}
 * @param missionMap    mission map; nullable before {@code MISSION_MAP}
 * @param nextStage     stage a continuation call would run next; nullable when complete
 */
public record StrategyPlan(
    WorkflowStage stage,
    AnalysisResult analysis,
    DecompositionResult decomposition,
    TaskGraphResult taskGraph,
    MissionMapResult missionMap,
    WorkflowStage nextStage
) implements Serializable {

    public boolean complete() {
        return stage == WorkflowStage.COMPLETE;
    }
}
