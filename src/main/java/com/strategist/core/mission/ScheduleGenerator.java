package com.strategist.core.mission;

import com.strategist.core.config.PlannerProperties;
import com.strategist.core.graph.CyclicDependencyException;
import com.strategist.core.graph.DependencyGraph;
import com.strategist.core.model.ResourceAssignment;
import com.strategist.core.model.Task;
import com.strategist.core.model.VerificationPairing;
import com.strategist.core.taskgraph.TaskGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes parallel execution groups and a total execution order for a task graph.
 * <p>
 * Groups are formed per dependency depth from tasks with no dependency at the same
 * depth, split into chunks of at most the target group size (hardest tasks first)
 * once a level has more candidates than that. The execution order is built one
 * readiness frontier at a time, verification tasks ahead of the rest.
 */
@Service
public class ScheduleGenerator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleGenerator.class);

    private static final int DEFAULT_COMPLEXITY = 3;

    /**
     * @param parallelGroups group ID ({@code level_<depth>_group_<i>}) to task IDs
     * @param executionOrder every task ID, dependencies first
     * @param assignments    the input assignments labelled with their group
     */
    public record Schedule(
        Map<String, List<String>> parallelGroups,
        List<String> executionOrder,
        List<ResourceAssignment> assignments
    ) {}

    private final int targetGroupSize;

    public ScheduleGenerator(PlannerProperties properties) {
        if (properties.getTargetGroupSize() < 1) {
            throw new IllegalArgumentException("Target group size must be positive, got "
                    + properties.getTargetGroupSize());
        }
        this.targetGroupSize = properties.getTargetGroupSize();
    }

    public Schedule generate(List<Task> tasks, List<ResourceAssignment> assignments) {
        DependencyGraph graph = TaskGraphBuilder.validate(tasks);
        Map<String, List<String>> groups = parallelGroups(tasks, graph);
        List<String> order = executionOrder(tasks);

        var groupOf = new HashMap<String, String>();
        groups.forEach((groupId, members) -> members.forEach(id -> groupOf.put(id, groupId)));
        List<ResourceAssignment> labelled = assignments.stream()
                .map(a -> a.withParallelGroup(groupOf.get(a.taskId())))
                .toList();

        log.info("Scheduled {} tasks in {} parallel groups", order.size(), groups.size());
        return new Schedule(groups, order, labelled);
    }

    Map<String, List<String>> parallelGroups(List<Task> tasks, DependencyGraph graph) {
        Map<String, Integer> depths = graph.depths();
        var complexity = new HashMap<String, Integer>();
        tasks.forEach(t -> complexity.put(t.id(),
                t.complexityScore() == null ? DEFAULT_COMPLEXITY : t.complexityScore()));

        var byDepth = new TreeMap<Integer, List<String>>();
        depths.forEach((id, depth) -> byDepth.computeIfAbsent(depth, d -> new ArrayList<>()).add(id));

        var groups = new LinkedHashMap<String, List<String>>();
        for (var level : byDepth.entrySet()) {
            int depth = level.getKey();
            if (level.getValue().size() <= 1) {
                continue;
            }
            List<String> candidates = level.getValue().stream()
                    .filter(id -> graph.dependenciesOf(id).stream()
                            .noneMatch(dep -> depths.getOrDefault(dep, -1) == depth))
                    .toList();
            if (candidates.size() <= 1) {
                continue;
            }
            List<List<String>> chunks = balance(candidates, complexity);
            for (int i = 0; i < chunks.size(); i++) {
                groups.put("level_" + depth + "_group_" + i, chunks.get(i));
            }
        }
        return groups;
    }

    private List<List<String>> balance(List<String> candidates, Map<String, Integer> complexity) {
        if (candidates.size() <= targetGroupSize) {
            return List.of(candidates);
        }
        List<String> sorted = candidates.stream()
                .sorted(Comparator.comparing((String id) -> complexity.get(id)).reversed())
                .toList();
        var chunks = new ArrayList<List<String>>();
        for (int i = 0; i < sorted.size(); i += targetGroupSize) {
            chunks.add(sorted.subList(i, Math.min(sorted.size(), i + targetGroupSize)));
        }
        return chunks;
    }

    /**
     * Repeatedly places every task whose dependencies are already placed:
     * verification tasks first, each set in lexicographic order.
     *
     * @throws CyclicDependencyException if tasks remain but none is ready
     */
    static List<String> executionOrder(List<Task> tasks) {
        var remaining = new ArrayList<>(tasks);
        Set<String> placed = new HashSet<>();
        var order = new ArrayList<String>(tasks.size());
        while (!remaining.isEmpty()) {
            List<Task> ready = remaining.stream()
                    .filter(t -> placed.containsAll(t.dependencies()))
                    .toList();
            if (ready.isEmpty()) {
                throw new CyclicDependencyException("task", remaining.stream().map(Task::id).toList());
            }
            List<String> frontier = new ArrayList<>();
            ready.stream().map(Task::id).filter(VerificationPairing::isVerificationId).sorted().forEach(frontier::add);
            ready.stream().map(Task::id).filter(id -> !VerificationPairing.isVerificationId(id)).sorted()
                    .forEach(frontier::add);
            order.addAll(frontier);
            placed.addAll(frontier);
            remaining.removeAll(ready);
        }
        return order;
    }
}
