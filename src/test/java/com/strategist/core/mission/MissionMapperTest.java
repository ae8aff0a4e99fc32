package com.strategist.core.mission;

import com.strategist.core.PlannerFixtures;
import com.strategist.core.config.ResourceProfileRegistry;
import com.strategist.core.graph.PlanValidationException;
import com.strategist.core.model.AnalysisResult;
import com.strategist.core.model.MissionMapResult;
import com.strategist.core.model.ResourceAssignment;
import com.strategist.core.model.Task;
import com.strategist.core.model.TaskGraphResult;
import com.strategist.core.model.VerificationPairing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MissionMapperTest {

    private ResourceProfileRegistry profiles;
    private MissionMapper mapper;
    private AnalysisResult analysis;
    private TaskGraphResult taskGraph;

    @BeforeEach
    void setUp() {
        profiles = PlannerFixtures.resourceProfiles();
        mapper = PlannerFixtures.missionMapper(profiles);
        analysis = AnalysisResult.of("web", "medium");
        taskGraph = PlannerFixtures.taskGraphBuilder()
                .build(PlannerFixtures.phaseDecomposer().decompose(analysis), analysis);
    }

    @Test
    @DisplayName("every implementation task is paired and preceded by its verification task")
    void pairsEveryImplementation() {
        MissionMapResult map = mapper.map(taskGraph, analysis);

        Set<String> ids = map.tasks().stream().map(Task::id).collect(Collectors.toSet());
        List<String> order = map.executionOrder();
        for (Task task : map.tasks()) {
            if (VerificationPairing.isImplementation(task)) {
                String verification = VerificationPairing.verificationIdFor(task.id());
                assertTrue(ids.contains(verification), task.id());
                assertTrue(task.dependencies().contains(verification), task.id());
                assertTrue(order.indexOf(verification) < order.indexOf(task.id()), task.id());
            }
        }
        assertEquals(1.0, map.verificationCompliance());
    }

    @Test
    @DisplayName("execution order respects every dependency")
    void topologicalOrder() {
        MissionMapResult map = mapper.map(taskGraph, analysis);

        assertEquals(map.tasks().size(), map.executionOrder().size());
        assertEquals(map.tasks().size(), new HashSet<>(map.executionOrder()).size());
        for (Task task : map.tasks()) {
            for (String dependency : task.dependencies()) {
                assertTrue(map.executionOrder().indexOf(dependency) < map.executionOrder().indexOf(task.id()),
                        dependency + " before " + task.id());
            }
        }
    }

    @Test
    @DisplayName("one assignment per task, each to a declared profile")
    void assignments() {
        MissionMapResult map = mapper.map(taskGraph, analysis);

        assertEquals(map.tasks().stream().map(Task::id).toList(),
                map.resourceAssignments().stream().map(ResourceAssignment::taskId).toList());
        for (ResourceAssignment assignment : map.resourceAssignments()) {
            assertTrue(profiles.find(assignment.profile()).isPresent(), assignment.profile());
        }
        assertEquals("architect", map.resourceAssignments().get(0).profile());
    }

    @Test
    @DisplayName("tasks belong to at most one group and carry its label")
    void groups() {
        MissionMapResult map = mapper.map(taskGraph, analysis);

        var seen = new HashSet<String>();
        for (Map.Entry<String, List<String>> group : map.parallelGroups().entrySet()) {
            assertTrue(group.getKey().matches("level_\\d+_group_\\d+"), group.getKey());
            for (String id : group.getValue()) {
                assertTrue(seen.add(id), id + " in two groups");
            }
        }
        for (ResourceAssignment assignment : map.resourceAssignments()) {
            assertEquals(seen.contains(assignment.taskId()), assignment.parallelGroup() != null);
        }
    }

    @Test
    @DisplayName("utilization stays within 0-100 and conflicts name declared profiles")
    void utilization() {
        MissionMapResult map = mapper.map(taskGraph, analysis);

        assertFalse(map.resourceUtilization().isEmpty());
        map.resourceUtilization().values().forEach(u -> {
            assertTrue(u.utilizationPercent() >= 0 && u.utilizationPercent() <= 100);
            assertTrue(u.taskCount() > 0);
        });
        map.conflicts().forEach(c -> assertTrue(c.assignedTasks() > c.maxCapacity()));
        assertNotEquals("0 days", map.totalEffortEstimate());
    }

    @Test
    @DisplayName("mapping is deterministic")
    void deterministic() {
        assertEquals(mapper.map(taskGraph, analysis), mapper.map(taskGraph, analysis));
    }

    @Test
    @DisplayName("empty task graph gives an empty mission map")
    void emptyGraph() {
        assertEquals(MissionMapResult.empty(), mapper.map(TaskGraphResult.empty(), analysis));
    }

    @Test
    @DisplayName("missing inputs are rejected")
    void missingInputs() {
        assertThrows(PlanValidationException.class, () -> mapper.map(null, analysis));
        assertThrows(PlanValidationException.class, () -> mapper.map(taskGraph, null));
    }
}
