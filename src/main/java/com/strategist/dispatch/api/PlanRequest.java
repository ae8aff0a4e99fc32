package com.strategist.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strategist.core.engine.PlanningRequest;
import com.strategist.core.model.AnalysisResult;
import com.strategist.core.model.DecompositionResult;
import com.strategist.core.model.TaskGraphResult;
import com.strategist.core.model.WorkflowStage;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/plans.
 *
 * @param domain               project domain; nullable, falls back to the default template
 * @param complexity           complexity label; nullable
 * @param keywords             keywords from the project description
 * @param technologyStack      technology hints
 * @param patterns             project patterns
 * @param implicitRequirements inferred requirements
 * @param stage                last stage to run; nullable, defaults to COMPLETE
 * @param decomposition        decomposition from an earlier call; nullable
 * @param taskGraph            task graph from an earlier call; nullable
 */
public record PlanRequest(
    String domain,
    String complexity,
    List<String> keywords,
    @JsonProperty("technology_stack") List<String> technologyStack,
    List<String> patterns,
    @JsonProperty("implicit_requirements") List<String> implicitRequirements,
    String stage,
    DecompositionResult decomposition,
    @JsonProperty("task_graph") TaskGraphResult taskGraph
) {

    /**
     * @throws IllegalArgumentException if {@code stage} is not a workflow stage
     */
    public PlanningRequest toPlanningRequest() {
        var analysis = new AnalysisResult(domain, complexity, keywords, technologyStack, patterns, implicitRequirements);
        WorkflowStage target = stage == null || stage.isBlank() ? WorkflowStage.COMPLETE : WorkflowStage.fromLabel(stage);
        return new PlanningRequest(analysis, decomposition, taskGraph, target);
    }
}
