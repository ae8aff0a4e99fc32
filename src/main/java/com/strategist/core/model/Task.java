package com.strategist.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A fine-grained unit of work within a phase.
 * <p>
 * Tasks are immutable: adding a dependency produces a new record via
 * {@link #withDependency(String)} or {@link #withDependencies(List)}.
 *
 * @param id                 unique identifier (e.g. "backend_data_model")
 * @param name               short display name
 * @param description        what the task should accomplish
 * @param phaseId            owning phase
 * @param dependencies       IDs of tasks that must complete first, in declaration order
 * @param estimatedEffort    effort estimate (e.g. "4 hours", "1.5 days"); nullable
 * @param complexityScore    complexity 1-10; nullable
 * @param profileHint        suggested resource profile; nullable
 * @param outputArtifacts    artifacts the task produces
 * @param validationCriteria success criteria
 * @param humanCheckpoint    true if a person must review the result
 */
public record Task(
    String id,
    String name,
    String description,
    String phaseId,
    List<String> dependencies,
    String estimatedEffort,
    Integer complexityScore,
    String profileHint,
    List<String> outputArtifacts,
    List<String> validationCriteria,
    boolean humanCheckpoint
) implements Serializable {

    public Task {
        if (complexityScore != null && (complexityScore < 1 || complexityScore > 10)) {
            throw new IllegalArgumentException(
                    "Task " + id + " has complexity " + complexityScore + " outside 1-10");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependencies));
        outputArtifacts = outputArtifacts == null ? List.of() : List.copyOf(outputArtifacts);
        validationCriteria = validationCriteria == null ? List.of() : List.copyOf(validationCriteria);
    }

    public Task withDependencies(List<String> newDependencies) {
        return new Task(id, name, description, phaseId, newDependencies, estimatedEffort,
                complexityScore, profileHint, outputArtifacts, validationCriteria, humanCheckpoint);
    }

    /** Returns this task unchanged if it already depends on {@code dependencyId}. */
    public Task withDependency(String dependencyId) {
        if (dependencies.contains(dependencyId)) {
            return this;
        }
        var updated = new ArrayList<>(dependencies);
        updated.add(dependencyId);
        return withDependencies(updated);
    }

    @JsonIgnore
    public boolean isVerification() {
        return VerificationPairing.isVerificationId(id);
    }
}
