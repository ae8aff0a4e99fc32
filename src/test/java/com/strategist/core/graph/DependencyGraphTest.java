package com.strategist.core.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static Map<String, List<String>> graph(Object... idsAndDeps) {
        var map = new LinkedHashMap<String, List<String>>();
        for (int i = 0; i < idsAndDeps.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> deps = (List<String>) idsAndDeps[i + 1];
            map.put((String) idsAndDeps[i], deps);
        }
        return map;
    }

    @Test
    @DisplayName("unknown dependency references are rejected with the offending edge")
    void unknownReference() {
        var e = assertThrows(PlanValidationException.class, () ->
                DependencyGraph.validated("phase", graph("a", List.of(), "b", List.of("missing"))));
        assertEquals(List.of("b -> missing"), e.getOffendingIds());
        assertFalse(e instanceof CyclicDependencyException);
    }

    @Test
    @DisplayName("cycles are rejected naming the nodes that could not be ordered")
    void cycle() {
        var e = assertThrows(CyclicDependencyException.class, () ->
                DependencyGraph.validated("task", graph(
                        "root", List.of(),
                        "a", List.of("root", "b"),
                        "b", List.of("a"))));
        assertEquals(List.of("a", "b"), e.getOffendingIds());
        assertTrue(e.getMessage().contains("tasks"));
    }

    @Test
    @DisplayName("a self dependency is a cycle")
    void selfLoop() {
        assertThrows(CyclicDependencyException.class, () ->
                DependencyGraph.validated("task", graph("a", List.of("a"))));
    }

    @Test
    @DisplayName("duplicate ids are reported once each")
    void duplicateIds() {
        var e = assertThrows(PlanValidationException.class, () ->
                DependencyGraph.requireUniqueIds("task", List.of("a", "b", "a", "a", "c", "b")));
        assertEquals(List.of("a", "b"), e.getOffendingIds());
        assertDoesNotThrow(() -> DependencyGraph.requireUniqueIds("task", List.of("a", "b")));
    }

    @Test
    @DisplayName("depths are the longest path from a root, in declaration order")
    void depths() {
        var g = DependencyGraph.validated("task", graph(
                "d", List.of("b", "c"),
                "a", List.of(),
                "b", List.of("a"),
                "c", List.of("a", "b")));

        assertEquals(List.of("d", "a", "b", "c"), List.copyOf(g.depths().keySet()));
        assertEquals(Map.of("a", 0, "b", 1, "c", 2, "d", 3), g.depths());
    }

    @Test
    @DisplayName("roots and dependents follow declaration order")
    void rootsAndDependents() {
        var g = DependencyGraph.validated("phase", graph(
                "design", List.of(),
                "backend", List.of("design"),
                "frontend", List.of("design"),
                "ops", List.of()));

        assertEquals(List.of("design", "ops"), g.roots());
        assertEquals(List.of("backend", "frontend"), g.dependentsOf("design"));
        assertEquals(List.of(), g.dependentsOf("ops"));
        assertEquals(List.of("design"), g.dependenciesOf("frontend"));
    }
}
