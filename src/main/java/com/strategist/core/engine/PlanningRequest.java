package com.strategist.core.engine;

import com.strategist.core.model.AnalysisResult;
import com.strategist.core.model.DecompositionResult;
import com.strategist.core.model.TaskGraphResult;
import com.strategist.core.model.WorkflowStage;

import java.io.Serializable;

/**
 * Input to a staged planning run.
 *
 * @param analysis      required
 * @param decomposition a decomposition from an earlier run; nullable
 * @param taskGraph     a task graph from an earlier run; nullable
 * @param targetStage   last stage to run; {@code null} means {@link WorkflowStage#COMPLETE}
 */
public record PlanningRequest(
    AnalysisResult analysis,
    DecompositionResult decomposition,
    TaskGraphResult taskGraph,
    WorkflowStage targetStage
) implements Serializable {

    public static PlanningRequest of(AnalysisResult analysis) {
        return new PlanningRequest(analysis, null, null, WorkflowStage.COMPLETE);
    }

    public PlanningRequest upTo(WorkflowStage stage) {
        return new PlanningRequest(analysis, decomposition, taskGraph, stage);
    }

    public WorkflowStage effectiveTarget() {
        return targetStage == null ? WorkflowStage.COMPLETE : targetStage;
    }
}
