package com.strategist.core.model;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A coarse project stage within a decomposition.
 *
 * @param id                unique phase identifier (e.g. "design")
 * @param name              display name, also used to resolve the phase type
 * @param description       what the phase covers
 * @param estimatedDuration duration after complexity adjustment (e.g. "4 days"); nullable
 * @param dependencies      IDs of phases that must finish first, in declaration order
 * @param deliverables      expected deliverable names
 */
public record Phase(
    String id,
    String name,
    String description,
    String estimatedDuration,
    List<String> dependencies,
    List<String> deliverables
) implements Serializable {

    public Phase {
        dependencies = dependencies == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependencies));
        deliverables = deliverables == null ? List.of() : List.copyOf(deliverables);
    }

    public Phase withDependencies(List<String> newDependencies) {
        return new Phase(id, name, description, estimatedDuration, newDependencies, deliverables);
    }
}
