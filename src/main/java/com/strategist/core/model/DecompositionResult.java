package com.strategist.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output of phase decomposition.
 *
 * @param templateName           phase template that produced the phases
 * @param phases                 phases in template order
 * @param totalEstimatedDuration duration along the critical path (e.g. "3.1 weeks")
 * @param criticalPath           phase IDs on the longest duration-weighted path
 * @param parallelOpportunities  groups of phases that can proceed concurrently
 * @param priorityPhases         phase IDs the domain prioritises
 */
public record DecompositionResult(
    String templateName,
    List<Phase> phases,
    String totalEstimatedDuration,
    List<String> criticalPath,
    List<List<String>> parallelOpportunities,
    List<String> priorityPhases
) implements Serializable {

    public DecompositionResult {
        phases = phases == null ? List.of() : List.copyOf(phases);
        criticalPath = criticalPath == null ? List.of() : List.copyOf(criticalPath);
        parallelOpportunities = parallelOpportunities == null ? List.of()
                : parallelOpportunities.stream().map(List::copyOf).toList();
        priorityPhases = priorityPhases == null ? List.of() : List.copyOf(priorityPhases);
    }

    public static DecompositionResult empty(String templateName) {
        return new DecompositionResult(templateName, List.of(), "0 days", List.of(), List.of(), List.of());
    }
}
