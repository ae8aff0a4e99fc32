package com.strategist.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of a dependency graph keyed by node ID, shared by the phase
 * and task stages. Node order is the declaration order of the input map and
 * every traversal follows it, so results are deterministic.
 */
public final class DependencyGraph {

    private final String kind;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;

    private DependencyGraph(String kind, Map<String, List<String>> dependencies) {
        this.kind = kind;
        this.dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
        var reverse = new LinkedHashMap<String, List<String>>();
        for (String id : dependencies.keySet()) {
            reverse.put(id, new ArrayList<>());
        }
        for (var entry : dependencies.entrySet()) {
            for (String dep : entry.getValue()) {
                reverse.computeIfAbsent(dep, k -> new ArrayList<>()).add(entry.getKey());
            }
        }
        this.dependents = Collections.unmodifiableMap(reverse);
    }

    /**
     * Builds a graph and rejects it if it references unknown nodes or contains a cycle.
     *
     * @param kind         "phase" or "task", used in error messages
     * @param dependencies node ID to the IDs it depends on, in declaration order
     * @throws PlanValidationException   if a dependency references a node not in the graph
     * @throws CyclicDependencyException if the graph is not acyclic
     */
    public static DependencyGraph validated(String kind, Map<String, List<String>> dependencies) {
        var graph = new DependencyGraph(kind, dependencies);
        graph.checkReferences();
        graph.checkAcyclic();
        return graph;
    }

    /**
     * Rejects a node list containing the same ID twice.
     *
     * @throws PlanValidationException naming every repeated ID
     */
    public static void requireUniqueIds(String kind, List<String> ids) {
        var seen = new HashSet<String>();
        var repeated = new ArrayList<String>();
        for (String id : ids) {
            if (!seen.add(id) && !repeated.contains(id)) {
                repeated.add(id);
            }
        }
        if (!repeated.isEmpty()) {
            throw new PlanValidationException("Duplicate " + kind + " ids: " + repeated, repeated);
        }
    }

    public Set<String> ids() {
        return dependencies.keySet();
    }

    public List<String> dependenciesOf(String id) {
        return dependencies.getOrDefault(id, List.of());
    }

    /** Nodes that depend directly on {@code id}, in declaration order. */
    public List<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, List.of());
    }

    public List<String> roots() {
        return dependencies.entrySet().stream()
                .filter(e -> e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Depth of every node, in declaration order: the length in edges of the
     * longest path from any root.
     * Memoised; a node revisited on the current path counts as depth 0, which
     * only matters for graphs that bypassed {@link #validated}.
     */
    public Map<String, Integer> depths() {
        var memo = new HashMap<String, Integer>();
        var depths = new LinkedHashMap<String, Integer>();
        for (String id : dependencies.keySet()) {
            depths.put(id, depthOf(id, memo, new HashSet<>()));
        }
        return depths;
    }

    private int depthOf(String id, Map<String, Integer> depths, Set<String> onPath) {
        Integer known = depths.get(id);
        if (known != null) {
            return known;
        }
        if (!onPath.add(id)) {
            return 0;
        }
        int depth = 0;
        for (String dep : dependenciesOf(id)) {
            depth = Math.max(depth, depthOf(dep, depths, onPath) + 1);
        }
        onPath.remove(id);
        depths.put(id, depth);
        return depth;
    }

    private void checkReferences() {
        var unknown = new ArrayList<String>();
        for (var entry : dependencies.entrySet()) {
            for (String dep : entry.getValue()) {
                if (!dependencies.containsKey(dep)) {
                    unknown.add(entry.getKey() + " -> " + dep);
                }
            }
        }
        if (!unknown.isEmpty()) {
            throw new PlanValidationException(
                    "Invalid " + kind + " dependency references: " + unknown, unknown);
        }
    }

    private void checkAcyclic() {
        var indegree = new HashMap<String, Integer>();
        for (var entry : dependencies.entrySet()) {
            indegree.put(entry.getKey(), entry.getValue().size());
        }
        var queue = new ArrayDeque<String>();
        for (String id : dependencies.keySet()) {
            if (indegree.get(id) == 0) {
                queue.add(id);
            }
        }
        var ordered = new HashSet<String>();
        while (!queue.isEmpty()) {
            String id = queue.removeFirst();
            ordered.add(id);
            for (String next : dependentsOf(id)) {
                int remaining = indegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    queue.addLast(next);
                }
            }
        }
        if (ordered.size() < dependencies.size()) {
            List<String> stuck = dependencies.keySet().stream()
                    .filter(id -> !ordered.contains(id))
                    .toList();
            throw new CyclicDependencyException(kind, stuck);
        }
    }
}
