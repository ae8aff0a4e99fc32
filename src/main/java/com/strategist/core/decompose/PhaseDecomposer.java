package com.strategist.core.decompose;

import com.strategist.core.config.PhaseTemplateRegistry;
import com.strategist.core.graph.DependencyGraph;
import com.strategist.core.graph.PlanValidationException;
import com.strategist.core.model.AnalysisResult;
import com.strategist.core.model.DecompositionResult;
import com.strategist.core.model.Phase;
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

/**
 * Expands an analysis into a phase DAG from the template matching its domain.
 * <p>
 * Each template phase's duration is scaled by the complexity multiplier. The
 * result carries the duration-weighted critical path, the total duration along
 * it, and groups of phases that share a dependency set and could run in parallel.
 */
@Service
public class PhaseDecomposer {

    private static final Logger log = LoggerFactory.getLogger(PhaseDecomposer.class);

    private final PhaseTemplateRegistry registry;

    public PhaseDecomposer(PhaseTemplateRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws PlanValidationException if the analysis is missing or the selected
     *                                 template's phases do not form a valid DAG
     */
    public DecompositionResult decompose(AnalysisResult analysis) {
        if (analysis == null) {
            throw new PlanValidationException("Phase decomposition requires an analysis result");
        }
        String templateName = registry.templateNameFor(analysis.domain());
        if (PhaseTemplateRegistry.DEFAULT_TEMPLATE.equals(templateName)) {
            log.warn("No phase template mapped for domain '{}', using '{}'",
                    analysis.domain(), PhaseTemplateRegistry.DEFAULT_TEMPLATE);
        }
        double multiplier = registry.multiplierFor(analysis.complexityLevel());

        var phases = new ArrayList<Phase>();
        for (var entry : registry.template(templateName).phases()) {
            String base = entry.estimatedDuration() == null ? "1 day" : entry.estimatedDuration();
            phases.add(new Phase(entry.id(), entry.name(), entry.description(),
                    DurationParser.scale(base, multiplier), entry.dependencies(), entry.artifacts()));
        }
        log.debug("Template {} with complexity multiplier {}", templateName, multiplier);

        DecompositionResult result = fromPhases(templateName, phases, registry.priorityPhasesFor(analysis.domain()));
        log.info("Decomposed into {} phases using template {} (critical path {}, {})",
                result.phases().size(), templateName, result.criticalPath(), result.totalEstimatedDuration());
        return result;
    }

    /**
     * Validates a phase list and computes its critical path, total duration and
     * parallel opportunities. Priority phases not present in the list are dropped.
     */
    public DecompositionResult fromPhases(String templateName, List<Phase> phases, List<String> priorityPhases) {
        if (phases.isEmpty()) {
            return DecompositionResult.empty(templateName);
        }
        DependencyGraph graph = validate(phases);

        Map<String, Integer> days = new HashMap<>();
        for (Phase phase : phases) {
            days.put(phase.id(), DurationParser.toDays(phase.estimatedDuration()));
        }
        List<String> criticalPath = criticalPath(graph, days);
        int totalDays = criticalPath.stream().mapToInt(days::get).sum();

        List<String> priorities = priorityPhases == null ? List.of()
                : priorityPhases.stream().filter(graph.ids()::contains).toList();

        return new DecompositionResult(templateName, phases, DurationParser.format(totalDays),
                criticalPath, parallelOpportunities(phases), priorities);
    }

    /**
     * Checks phase ids are unique, every dependency names a listed phase, and the
     * phase graph is acyclic.
     *
     * @throws PlanValidationException if any check fails
     */
    public static DependencyGraph validate(List<Phase> phases) {
        DependencyGraph.requireUniqueIds("phase", phases.stream().map(Phase::id).toList());
        var dependencies = new LinkedHashMap<String, List<String>>();
        for (Phase phase : phases) {
            dependencies.put(phase.id(), phase.dependencies());
        }
        return DependencyGraph.validated("phase", dependencies);
    }

    /**
     * Longest duration-weighted path, walking forward from each root through its
     * dependents. The first root in declaration order wins ties.
     */
    static List<String> criticalPath(DependencyGraph graph, Map<String, Integer> days) {
        Map<String, PathResult> memo = new HashMap<>();
        PathResult best = null;
        for (String root : graph.roots()) {
            PathResult candidate = longestFrom(root, graph, days, memo);
            if (best == null || candidate.days() > best.days()) {
                best = candidate;
            }
        }
        return best == null ? List.of() : best.path();
    }

    private static PathResult longestFrom(String id, DependencyGraph graph, Map<String, Integer> days,
                                          Map<String, PathResult> memo) {
        PathResult known = memo.get(id);
        if (known != null) {
            return known;
        }
        int own = days.getOrDefault(id, 1);
        PathResult best = new PathResult(List.of(id), own);
        for (String dependent : graph.dependentsOf(id)) {
            PathResult tail = longestFrom(dependent, graph, days, memo);
            if (own + tail.days() > best.days()) {
                var path = new ArrayList<String>(tail.path().size() + 1);
                path.add(id);
                path.addAll(tail.path());
                best = new PathResult(List.copyOf(path), own + tail.days());
            }
        }
        memo.put(id, best);
        return best;
    }

    /**
     * Groups phases by identical dependency set; a group qualifies when at least
     * two of its members do not depend on another member.
     */
    static List<List<String>> parallelOpportunities(List<Phase> phases) {
        if (phases.size() < 2) {
            return List.of();
        }
        var byDependencySet = new LinkedHashMap<List<String>, List<Phase>>();
        for (Phase phase : phases) {
            List<String> key = phase.dependencies().stream().sorted().toList();
            byDependencySet.computeIfAbsent(key, k -> new ArrayList<>()).add(phase);
        }
        var groups = new ArrayList<List<String>>();
        for (List<Phase> members : byDependencySet.values()) {
            if (members.size() < 2) {
                continue;
            }
            Set<String> memberIds = new HashSet<>();
            members.forEach(p -> memberIds.add(p.id()));
            List<String> independent = members.stream()
                    .filter(p -> p.dependencies().stream().noneMatch(d -> !d.equals(p.id()) && memberIds.contains(d)))
                    .map(Phase::id)
                    .toList();
            if (independent.size() > 1) {
                groups.add(independent);
            }
        }
        return groups;
    }

    private record PathResult(List<String> path, int days) {}
}
