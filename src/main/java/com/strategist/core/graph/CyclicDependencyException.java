package com.strategist.core.graph;

import java.util.List;

/**
 * Thrown when a phase or task graph contains a dependency cycle.
 * The offending IDs are the nodes that could not be ordered.
 */
public class CyclicDependencyException extends PlanValidationException {

    public CyclicDependencyException(String kind, List<String> cycleIds) {
        super("Dependency cycle among " + kind + "s: " + cycleIds, cycleIds);
    }
}
