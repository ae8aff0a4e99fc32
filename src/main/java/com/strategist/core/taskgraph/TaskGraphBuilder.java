package com.strategist.core.taskgraph;

import com.strategist.core.config.TaskTemplateRegistry;
import com.strategist.core.config.TaskTemplateRegistry.TaskEntry;
import com.strategist.core.decompose.PhaseDecomposer;
import com.strategist.core.graph.DependencyGraph;
import com.strategist.core.graph.PlanValidationException;
import com.strategist.core.model.AnalysisResult;
import com.strategist.core.model.DecompositionResult;
import com.strategist.core.model.Phase;
import com.strategist.core.model.PhaseType;
import com.strategist.core.model.Task;
import com.strategist.core.model.TaskGraphResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Expands every phase of a decomposition into tasks from the template for its
 * phase type, links tasks across phase boundaries, and analyses the resulting
 * graph for its critical path, bottlenecks and parallel groups.
 */
@Service
public class TaskGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphBuilder.class);

    static final String ENHANCED_SUFFIX = "_enhanced";
    static final String ENHANCED_NAME = " (Enhanced)";
    private static final int DEFAULT_COMPLEXITY = 3;

    private final TaskTemplateRegistry registry;
    private final PhaseTypeResolver resolver;

    public TaskGraphBuilder(TaskTemplateRegistry registry, PhaseTypeResolver resolver) {
        this.registry = registry;
        this.resolver = resolver;
    }

    /**
     * @throws PlanValidationException if either input is missing, a phase has no
     *                                 resolvable type, the phase graph has duplicate ids,
     *                                 unknown dependencies or a cycle, or the linked graph is invalid
     */
    public TaskGraphResult build(DecompositionResult decomposition, AnalysisResult analysis) {
        if (decomposition == null) {
            throw new PlanValidationException("Task graph generation requires a phase decomposition");
        }
        if (analysis == null) {
            throw new PlanValidationException("Task graph generation requires an analysis result");
        }
        if (decomposition.phases().isEmpty()) {
            return TaskGraphResult.empty();
        }
        PhaseDecomposer.validate(decomposition.phases());
        double multiplier = registry.taskMultiplierFor(analysis.complexityLevel());

        var tasksByPhase = new LinkedHashMap<String, List<Task>>();
        for (Phase phase : decomposition.phases()) {
            PhaseType type = phaseTypeOf(phase);
            List<TaskEntry> entries = adjustForComplexity(registry.tasksFor(type), multiplier);
            if (entries.isEmpty()) {
                log.warn("No task template entries for phase {} (type {})", phase.id(), type.key());
            }
            var phaseTasks = new ArrayList<Task>();
            for (TaskEntry entry : entries) {
                List<String> dependencies = entry.internalDependencies().stream()
                        .map(suffix -> phase.id() + suffix)
                        .toList();
                phaseTasks.add(new Task(phase.id() + entry.idSuffix(), entry.name(), entry.description(),
                        phase.id(), dependencies, entry.estimatedEffort(), entry.complexityScore(),
                        entry.profileHint(), entry.outputArtifacts(), entry.validationCriteria(),
                        entry.humanCheckpoint()));
            }
            log.debug("Phase {} ({}) expanded into {} tasks", phase.id(), type.key(), phaseTasks.size());
            tasksByPhase.put(phase.id(), phaseTasks);
        }

        List<Task> linked = linkAcrossPhases(decomposition.phases(), tasksByPhase);
        TaskGraphResult result = fromTasks(linked);
        log.info("Generated {} tasks (critical path length {}, {} bottlenecks, {} parallel groups)",
                result.taskCount(), result.criticalPath().size(), result.bottlenecks().size(),
                result.parallelTasks().size());
        return result;
    }

    /**
     * Validates a task list and computes its dependency matrix, critical path,
     * bottlenecks and parallel groups.
     */
    public TaskGraphResult fromTasks(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return TaskGraphResult.empty();
        }
        DependencyGraph graph = validate(tasks);
        var matrix = new LinkedHashMap<String, List<String>>();
        for (Task task : tasks) {
            matrix.put(task.id(), task.dependencies());
        }
        Map<String, Integer> depths = graph.depths();
        List<String> criticalPath = criticalPath(graph, depths);
        return new TaskGraphResult(tasks, tasks.size(), matrix, criticalPath,
                bottlenecks(tasks, graph, criticalPath), parallelGroups(graph, depths));
    }

    /** Builds and validates the dependency graph of a task list. */
    public static DependencyGraph validate(List<Task> tasks) {
        DependencyGraph.requireUniqueIds("task", tasks.stream().map(Task::id).toList());
        var dependencies = new LinkedHashMap<String, List<String>>();
        for (Task task : tasks) {
            dependencies.put(task.id(), task.dependencies());
        }
        return DependencyGraph.validated("task", dependencies);
    }

    private PhaseType phaseTypeOf(Phase phase) {
        return resolver.resolve(phase.name()).orElseGet(() -> {
            PhaseType fallback = registry.defaultPhaseType().orElseThrow(() -> new PlanValidationException(
                    "Phase '" + phase.name() + "' matches no task template type and no default is configured",
                    List.of(phase.id())));
            log.warn("Phase '{}' matches no task template type, using default {}", phase.name(), fallback.key());
            return fallback;
        });
    }

    /**
     * Shrinks or grows a template's entries to {@code max(1, floor(n * multiplier))}.
     * Shrinking keeps the leading entries and drops internal dependencies on removed
     * ones; growing appends harder "enhanced" copies of the leading entries.
     */
    static List<TaskEntry> adjustForComplexity(List<TaskEntry> entries, double multiplier) {
        if (entries.isEmpty() || multiplier == 1.0) {
            return entries;
        }
        int target = Math.max(1, (int) (entries.size() * multiplier));
        if (target < entries.size()) {
            List<TaskEntry> kept = entries.subList(0, target);
            Set<String> keptSuffixes = new HashSet<>();
            kept.forEach(e -> keptSuffixes.add(e.idSuffix()));
            return kept.stream()
                    .map(e -> e.derive(e.idSuffix(), e.name(), e.complexityScore(),
                            e.internalDependencies().stream().filter(keptSuffixes::contains).toList()))
                    .toList();
        }
        if (target > entries.size() && multiplier > 1.0) {
            var grown = new ArrayList<>(entries);
            int extra = Math.min(target - entries.size(), entries.size());
            for (int i = 0; i < extra; i++) {
                TaskEntry base = entries.get(i);
                int complexity = base.complexityScore() == null ? DEFAULT_COMPLEXITY : base.complexityScore();
                grown.add(base.derive(base.idSuffix() + ENHANCED_SUFFIX, base.name() + ENHANCED_NAME,
                        Math.min(10, complexity + 1), base.internalDependencies()));
            }
            return grown;
        }
        return entries;
    }

    /**
     * For every phase edge P to Q, each task of Q gains a dependency on the
     * terminal tasks of P: those no other task of P depends on.
     */
    static List<Task> linkAcrossPhases(List<Phase> phases, Map<String, List<Task>> tasksByPhase) {
        var terminals = new HashMap<String, List<String>>();
        tasksByPhase.forEach((phaseId, tasks) -> terminals.put(phaseId, terminalTasks(tasks)));

        var linked = new ArrayList<Task>();
        for (Phase phase : phases) {
            for (Task task : tasksByPhase.getOrDefault(phase.id(), List.of())) {
                var dependencies = new ArrayList<>(task.dependencies());
                for (String phaseDependency : phase.dependencies()) {
                    dependencies.addAll(terminals.getOrDefault(phaseDependency, List.of()));
                }
                linked.add(task.withDependencies(dependencies));
            }
        }
        return linked;
    }

    private static List<String> terminalTasks(List<Task> phaseTasks) {
        Set<String> dependedOn = new HashSet<>();
        phaseTasks.forEach(t -> dependedOn.addAll(t.dependencies()));
        return phaseTasks.stream()
                .map(Task::id)
                .filter(id -> !dependedOn.contains(id))
                .toList();
    }

    /**
     * Traces back from the first deepest task, at each step following the
     * deepest dependency (first in declaration order on ties).
     */
    static List<String> criticalPath(DependencyGraph graph, Map<String, Integer> depths) {
        String current = null;
        int maxDepth = -1;
        for (var entry : depths.entrySet()) {
            if (entry.getValue() > maxDepth) {
                maxDepth = entry.getValue();
                current = entry.getKey();
            }
        }
        var path = new ArrayList<String>();
        while (current != null) {
            path.add(0, current);
            String next = null;
            int nextDepth = -1;
            for (String dep : graph.dependenciesOf(current)) {
                int depth = depths.getOrDefault(dep, 0);
                if (depth > nextDepth) {
                    nextDepth = depth;
                    next = dep;
                }
            }
            current = next;
        }
        return path;
    }

    /**
     * Scores fan-in (2 for three or more dependents, 1 for two), critical path
     * membership (2) and complexity of 4 or more (1). Three or more is a bottleneck.
     */
    static List<String> bottlenecks(List<Task> tasks, DependencyGraph graph, List<String> criticalPath) {
        Set<String> onCriticalPath = new HashSet<>(criticalPath);
        var result = new ArrayList<String>();
        for (Task task : tasks) {
            int score = 0;
            int dependents = graph.dependentsOf(task.id()).size();
            if (dependents >= 3) {
                score += 2;
            } else if (dependents >= 2) {
                score += 1;
            }
            if (onCriticalPath.contains(task.id())) {
                score += 2;
            }
            if (task.complexityScore() != null && task.complexityScore() >= 4) {
                score += 1;
            }
            if (score >= 3) {
                result.add(task.id());
            }
        }
        return result;
    }

    /**
     * Tasks at the same depth with no dependency on another task at that depth,
     * shallowest level first. Levels with fewer than two such tasks are skipped.
     */
    static List<List<String>> parallelGroups(DependencyGraph graph, Map<String, Integer> depths) {
        var byDepth = new TreeMap<Integer, List<String>>();
        depths.forEach((id, depth) -> byDepth.computeIfAbsent(depth, d -> new ArrayList<>()).add(id));
        var groups = new ArrayList<List<String>>();
        for (var level : byDepth.entrySet()) {
            int depth = level.getKey();
            List<String> candidates = level.getValue().stream()
                    .filter(id -> graph.dependenciesOf(id).stream()
                            .noneMatch(dep -> depths.getOrDefault(dep, -1) == depth))
                    .toList();
            if (candidates.size() > 1) {
                groups.add(candidates);
            }
        }
        return groups;
    }
}
