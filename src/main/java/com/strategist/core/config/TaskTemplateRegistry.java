package com.strategist.core.config;

import com.strategist.core.model.Complexity;
import com.strategist.core.model.PhaseType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable task-template registry keyed by phase type.
 */
public final class TaskTemplateRegistry {

    /**
     * One task as declared in a template. The task ID is the phase ID followed by
     * {@code idSuffix}; {@code internalDependencies} are suffixes of other entries
     * in the same template.
     */
    public record TaskEntry(
        String idSuffix,
        String name,
        String description,
        String estimatedEffort,
        Integer complexityScore,
        String profileHint,
        List<String> internalDependencies,
        List<String> outputArtifacts,
        List<String> validationCriteria,
        boolean humanCheckpoint
    ) {
        public TaskEntry {
            internalDependencies = internalDependencies == null ? List.of() : List.copyOf(internalDependencies);
            outputArtifacts = outputArtifacts == null ? List.of() : List.copyOf(outputArtifacts);
            validationCriteria = validationCriteria == null ? List.of() : List.copyOf(validationCriteria);
        }

        /** Copy with a different suffix, name, complexity and dependency list. */
        public TaskEntry derive(String newSuffix, String newName, Integer newComplexity, List<String> newDependencies) {
            return new TaskEntry(newSuffix, newName, description, estimatedEffort, newComplexity, profileHint,
                    newDependencies, outputArtifacts, validationCriteria, humanCheckpoint);
        }
    }

    private final Map<PhaseType, List<TaskEntry>> templates;
    private final Map<String, Double> taskMultipliers;
    private final PhaseType defaultPhaseType;

    /**
     * @param defaultPhaseType type used for phases whose name matches no type; nullable
     * @throws ConfigurationException if a template declares an internal dependency on
     *                                a suffix it does not contain
     */
    public TaskTemplateRegistry(Map<PhaseType, List<TaskEntry>> templates,
                                Map<String, Double> taskMultipliers,
                                PhaseType defaultPhaseType) {
        var copy = new EnumMap<PhaseType, List<TaskEntry>>(PhaseType.class);
        if (templates != null) {
            templates.forEach((type, entries) -> {
                validateInternalDependencies(type, entries);
                copy.put(type, List.copyOf(entries));
            });
        }
        this.templates = Collections.unmodifiableMap(copy);
        this.taskMultipliers = taskMultipliers == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(taskMultipliers));
        this.defaultPhaseType = defaultPhaseType;
    }

    public List<TaskEntry> tasksFor(PhaseType type) {
        return templates.getOrDefault(type, List.of());
    }

    public Optional<PhaseType> defaultPhaseType() {
        return Optional.ofNullable(defaultPhaseType);
    }

    /** Task count multiplier for a complexity level; 1.0 when unknown or not configured. */
    public double taskMultiplierFor(Optional<Complexity> complexity) {
        return complexity.map(c -> taskMultipliers.getOrDefault(c.key(), 1.0)).orElse(1.0);
    }

    public Map<PhaseType, List<TaskEntry>> templates() {
        return templates;
    }

    private static void validateInternalDependencies(PhaseType type, List<TaskEntry> entries) {
        var suffixes = new HashSet<String>();
        entries.forEach(e -> suffixes.add(e.idSuffix()));
        var unknown = new ArrayList<String>();
        for (TaskEntry entry : entries) {
            for (String dep : entry.internalDependencies()) {
                if (!suffixes.contains(dep)) {
                    unknown.add(entry.idSuffix() + " -> " + dep);
                }
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException(
                    "Task template '" + type.key() + "' has undeclared internal dependencies: " + unknown);
        }
    }
}
