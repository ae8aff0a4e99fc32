package com.strategist.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strategist.core.PlannerFixtures;
import com.strategist.core.config.ConfigurationException;
import com.strategist.core.graph.PlanValidationException;
import com.strategist.core.metrics.PlannerMetrics;
import com.strategist.core.model.AnalysisResult;
import com.strategist.core.model.DecompositionResult;
import com.strategist.core.model.Phase;
import com.strategist.core.model.StrategyPlan;
import com.strategist.core.model.WorkflowStage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StrategyEngineTest {

    private SimpleMeterRegistry registry;
    private StrategyEngine engine;
    private final AnalysisResult analysis = AnalysisResult.of("web", "medium");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engine = PlannerFixtures.engine(new PlannerMetrics(registry), null, null);
    }

    private long stageRuns(String stage) {
        var timer = registry.find("strategist.stage.duration").tag("stage", stage).timer();
        return timer == null ? 0 : timer.count();
    }

    private double plans(String status) {
        var counter = registry.find("strategist.plans.total").tag("status", status).counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("full plan")
    class FullPlan {

        @Test
        @DisplayName("runs every stage and reports completion")
        void complete() {
            StrategyPlan plan = engine.plan(analysis);

            assertTrue(plan.complete());
            assertNull(plan.nextStage());
            assertEquals("web_app", plan.decomposition().templateName());
            assertEquals(plan.taskGraph().taskCount(), plan.taskGraph().tasks().size());
            assertTrue(plan.missionMap().tasks().size() > plan.taskGraph().taskCount());
            assertEquals(1.0, plan.missionMap().verificationCompliance());
        }

        @Test
        @DisplayName("identical input gives identical JSON")
        void deterministic() throws Exception {
            ObjectMapper mapper = new ObjectMapper();
            String first = mapper.writeValueAsString(engine.plan(analysis));
            String second = mapper.writeValueAsString(PlannerFixtures.engine().plan(analysis));

            assertEquals(first, second);
            assertFalse(first.contains("PLAN-"));
        }

        @Test
        @DisplayName("times each stage exactly once")
        void stagesRunOnce() {
            engine.plan(analysis);

            assertEquals(1, stageRuns("decomposition"));
            assertEquals(1, stageRuns("task_graph"));
            assertEquals(1, stageRuns("mission_map"));
        }

        @Test
        @DisplayName("records the number of injected verification tasks")
        void injectedVerificationTasks() {
            StrategyPlan plan = engine.plan(analysis);

            var injected = registry.find("strategist.verification.injected").summary();
            assertEquals(1, injected.count());
            assertEquals(plan.missionMap().tasks().size() - plan.taskGraph().taskCount(), injected.totalAmount());
        }

        @Test
        @DisplayName("records stage timers, plan status and task counts")
        void metrics() {
            engine.plan(analysis);

            assertEquals(1.0, plans("completed"));
            for (String stage : List.of("decomposition", "task_graph", "mission_map")) {
                assertNotNull(registry.find("strategist.stage.duration").tag("stage", stage).timer(), stage);
            }
            assertEquals(1, registry.find("strategist.taskgraph.tasks").summary().count());
            assertNotNull(registry.find("strategist.conflicts.total").counter());
        }

        @Test
        @DisplayName("MDC is cleared once the run ends")
        void mdcCleared() {
            engine.plan(analysis);

            assertNull(MDC.get("planId"));
            assertNull(MDC.get("stage"));
        }
    }

    @Nested
    @DisplayName("staged runs")
    class StagedRuns {

        @Test
        @DisplayName("stops after the target stage and names the next one")
        void stopsAtTarget() {
            StrategyPlan plan = engine.execute(PlanningRequest.of(analysis).upTo(WorkflowStage.DECOMPOSITION));

            assertEquals(WorkflowStage.DECOMPOSITION, plan.stage());
            assertEquals(WorkflowStage.TASK_GRAPH, plan.nextStage());
            assertNotNull(plan.decomposition());
            assertNull(plan.taskGraph());
            assertNull(plan.missionMap());
            assertEquals(1.0, plans("partial"));
        }

        @Test
        @DisplayName("analysis target runs nothing")
        void analysisOnly() {
            StrategyPlan plan = engine.execute(PlanningRequest.of(analysis).upTo(WorkflowStage.ANALYSIS));

            assertEquals(WorkflowStage.ANALYSIS, plan.stage());
            assertEquals(WorkflowStage.DECOMPOSITION, plan.nextStage());
            assertNull(plan.decomposition());
        }

        @Test
        @DisplayName("continuation reuses earlier results and matches a full run")
        void continuation() {
            StrategyPlan partial = engine.execute(PlanningRequest.of(analysis).upTo(WorkflowStage.TASK_GRAPH));

            StrategyPlan resumed = engine.execute(new PlanningRequest(analysis, partial.decomposition(),
                    partial.taskGraph(), null));

            assertTrue(resumed.complete());
            assertSame(partial.taskGraph(), resumed.taskGraph());
            assertEquals(1, stageRuns("decomposition"));
            assertEquals(1, stageRuns("task_graph"));
            assertEquals(1, stageRuns("mission_map"));
            assertEquals(engine.plan(analysis).missionMap(), resumed.missionMap());
        }

        @Test
        @DisplayName("a supplied task graph makes decomposition unnecessary")
        void suppliedTaskGraph() {
            var taskGraph = engine.buildTaskGraph(engine.decompose(analysis), analysis);

            StrategyPlan plan = engine.execute(new PlanningRequest(analysis, null, taskGraph, WorkflowStage.COMPLETE));

            assertTrue(plan.complete());
            assertNull(plan.decomposition());
        }

        @Test
        @DisplayName("a supplied decomposition with an unknown phase dependency fails the plan")
        void suppliedDecompositionValidated() {
            var decomposition = new DecompositionResult("custom",
                    List.of(new Phase("design", "Design", "", "1 week", List.of("ghost"), List.of())),
                    "1 week", List.of(), List.of(), List.of());

            assertThrows(PlanValidationException.class, () ->
                    engine.execute(new PlanningRequest(analysis, decomposition, null, WorkflowStage.COMPLETE)));
            assertEquals(1.0, plans("failed"));
        }

        @Test
        @DisplayName("individual stage calls require their inputs")
        void individualStages() {
            assertThrows(PlanValidationException.class, () -> engine.decompose(null));
            assertThrows(PlanValidationException.class, () -> engine.buildTaskGraph(null, analysis));
            assertThrows(PlanValidationException.class, () -> engine.createMissionMap(null, analysis));
            assertThrows(PlanValidationException.class, () -> engine.execute(null));
            assertThrows(PlanValidationException.class, () -> engine.plan(null));
        }

        @Test
        @DisplayName("createMissionMap matches the mission map of a full plan")
        void createMissionMap() {
            var taskGraph = engine.buildTaskGraph(engine.decompose(analysis), analysis);

            assertEquals(engine.plan(analysis).missionMap(), engine.createMissionMap(taskGraph, analysis));
        }
    }

    @Nested
    @DisplayName("analysis collaborators")
    class Collaborators {

        @Test
        @DisplayName("refiner revises the analysis before any stage and sees the plan id in MDC")
        void refiner() {
            var planIdSeen = new AtomicReference<String>();
            var refined = PlannerFixtures.engine(new PlannerMetrics(registry), a -> {
                planIdSeen.set(MDC.get("planId"));
                return a.withDomain("api");
            }, null);

            StrategyPlan plan = refined.plan(analysis);

            assertEquals("api", plan.analysis().domain());
            assertEquals("api_service", plan.decomposition().templateName());
            assertTrue(planIdSeen.get().matches("PLAN-\\d{4}-\\d{4}"));
        }

        @Test
        @DisplayName("refiner returning nothing fails the plan")
        void refinerReturnsNull() {
            var broken = PlannerFixtures.engine(new PlannerMetrics(registry), a -> null, null);

            assertThrows(PlanValidationException.class, () -> broken.plan(analysis));
            assertEquals(0, stageRuns("decomposition"));
            assertEquals(1.0, plans("failed"));
            assertNull(MDC.get("planId"));
        }

        @Test
        @DisplayName("description is classified by the registered analyzer")
        void planFromDescription() {
            var withAnalyzer = PlannerFixtures.engine(new PlannerMetrics(registry), null,
                    description -> AnalysisResult.of("data", "low"));

            StrategyPlan plan = withAnalyzer.planFromDescription("Nightly ETL into the warehouse");

            assertEquals("data_pipeline", plan.decomposition().templateName());
            assertTrue(plan.complete());
        }

        @Test
        @DisplayName("description without an analyzer is a configuration error")
        void noAnalyzer() {
            assertThrows(ConfigurationException.class, () -> engine.planFromDescription("A todo app"));
        }
    }

    @Test
    @DisplayName("plan ids are unique and formatted")
    void planIds() {
        String first = engine.generatePlanId();
        String second = engine.generatePlanId();

        assertNotEquals(first, second);
        assertTrue(first.matches("PLAN-\\d{4}-\\d{4}"));
    }
}
