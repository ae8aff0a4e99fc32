package com.strategist.core.engine;

import com.strategist.core.analysis.AnalysisRefiner;
import com.strategist.core.analysis.ProjectAnalyzer;
import com.strategist.core.config.ConfigurationException;
import com.strategist.core.decompose.PhaseDecomposer;
import com.strategist.core.graph.PlanValidationException;
import com.strategist.core.logging.MdcContext;
import com.strategist.core.metrics.PlannerMetrics;
import com.strategist.core.mission.MissionMapper;
import com.strategist.core.model.AnalysisResult;
import com.strategist.core.model.DecompositionResult;
import com.strategist.core.model.MissionMapResult;
import com.strategist.core.model.StrategyPlan;
import com.strategist.core.model.TaskGraphResult;
import com.strategist.core.model.WorkflowStage;
import com.strategist.core.taskgraph.TaskGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Call boundary of the planner. Runs the decomposition, task graph and mission
 * map stages, individually or as a staged run that reuses results a caller
 * already holds.
 * <p>
 * Each run gets a plan ID ({@code PLAN-YYYY-NNNN}) used only for log correlation; it never appears in the results, which depend on their inputs alone.
 */
@Service
public class StrategyEngine {

    private static final Logger log = LoggerFactory.getLogger(StrategyEngine.class);
    private static final AtomicInteger PLAN_COUNTER = new AtomicInteger(0);

    private final PhaseDecomposer phaseDecomposer;
    private final TaskGraphBuilder taskGraphBuilder;
    private final MissionMapper missionMapper;
    private final PlannerMetrics metrics;
    private final ObjectProvider<AnalysisRefiner> refiner;
    private final ObjectProvider<ProjectAnalyzer> analyzer;

    public StrategyEngine(PhaseDecomposer phaseDecomposer, TaskGraphBuilder taskGraphBuilder,
                          MissionMapper missionMapper, PlannerMetrics metrics,
                          ObjectProvider<AnalysisRefiner> refiner, ObjectProvider<ProjectAnalyzer> analyzer) {
        this.phaseDecomposer = phaseDecomposer;
        this.taskGraphBuilder = taskGraphBuilder;
        this.missionMapper = missionMapper;
        this.metrics = metrics;
        this.refiner = refiner;
        this.analyzer = analyzer;
    }

    public DecompositionResult decompose(AnalysisResult analysis) {
        requireAnalysis(analysis);
        String planId = generatePlanId();
        return tracked(planId, () -> runStage(planId, WorkflowStage.DECOMPOSITION,
                () -> phaseDecomposer.decompose(analysis)));
    }

    public TaskGraphResult buildTaskGraph(DecompositionResult decomposition, AnalysisResult analysis) {
        requireAnalysis(analysis);
        if (decomposition == null) {
            throw new PlanValidationException("Task graph generation requires a phase decomposition");
        }
        String planId = generatePlanId();
        return tracked(planId, () -> runStage(planId, WorkflowStage.TASK_GRAPH,
                () -> taskGraphBuilder.build(decomposition, analysis)));
    }

    public MissionMapResult createMissionMap(TaskGraphResult taskGraph, AnalysisResult analysis) {
        requireAnalysis(analysis);
        if (taskGraph == null) {
            throw new PlanValidationException("Mission map creation requires a task graph");
        }
        String planId = generatePlanId();
        return tracked(planId, () -> runStage(planId, WorkflowStage.MISSION_MAP,
                () -> missionMapper.map(taskGraph, analysis)));
    }

    /** Runs every stage for an analysis. */
    public StrategyPlan plan(AnalysisResult analysis) {
        return execute(PlanningRequest.of(analysis));
    }

    /**
     * Classifies a project description with the registered {@link ProjectAnalyzer}
     * and plans it end to end.
     *
     * @throws ConfigurationException if no analyzer is registered
     */
    public StrategyPlan planFromDescription(String projectDescription) {
        ProjectAnalyzer projectAnalyzer = analyzer.getIfAvailable();
        if (projectAnalyzer == null) {
            throw new ConfigurationException("No ProjectAnalyzer registered; supply an analysis result instead");
        }
        return plan(projectAnalyzer.analyze(projectDescription));
    }

    /**
     * Staged run: results supplied in the request are reused and only the missing
     * stages up to the target are computed. A supplied task graph makes the
     * decomposition unnecessary.
     *
     * @throws PlanValidationException if the request carries no analysis, or any stage rejects its input
     */
    public StrategyPlan execute(PlanningRequest request) {
        if (request == null) {
            throw new PlanValidationException("Planning request is required");
        }
        requireAnalysis(request.analysis());
        String planId = generatePlanId();
        WorkflowStage target = request.effectiveTarget();

        return tracked(planId, () -> {
            AnalysisResult analysis = refine(request.analysis());
            DecompositionResult decomposition = request.decomposition();
            TaskGraphResult taskGraph = request.taskGraph();
            MissionMapResult missionMap = null;

            if (reaches(target, WorkflowStage.DECOMPOSITION) && decomposition == null && taskGraph == null) {
                decomposition = runStage(planId, WorkflowStage.DECOMPOSITION, () -> phaseDecomposer.decompose(analysis));
            }
            if (reaches(target, WorkflowStage.TASK_GRAPH) && taskGraph == null) {
                DecompositionResult source = decomposition;
                taskGraph = runStage(planId, WorkflowStage.TASK_GRAPH, () -> taskGraphBuilder.build(source, analysis));
                metrics.recordTaskCount(taskGraph.taskCount());
            }
            if (reaches(target, WorkflowStage.MISSION_MAP)) {
                TaskGraphResult source = taskGraph;
                missionMap = runStage(planId, WorkflowStage.MISSION_MAP, () -> missionMapper.map(source, analysis));
                metrics.recordInjectedVerificationTasks(Math.max(0, missionMap.tasks().size() - source.taskCount()));
                metrics.recordConflicts(missionMap.conflicts().size());
            }

            WorkflowStage reached = missionMap != null ? WorkflowStage.COMPLETE
                    : taskGraph != null ? WorkflowStage.TASK_GRAPH
                    : decomposition != null ? WorkflowStage.DECOMPOSITION
                    : WorkflowStage.ANALYSIS;
            return new StrategyPlan(reached, analysis, decomposition, taskGraph, missionMap,
                    reached == WorkflowStage.COMPLETE ? null : reached.next());
        });
    }

    /**
     * Generates a plan ID in the format PLAN-YYYY-NNNN.
     */
    public String generatePlanId() {
        int count = PLAN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("PLAN-%d-%04d", year, count);
    }

    private <T> T tracked(String planId, Supplier<T> run) {
        MdcContext.setPlan(planId);
        try {
            T result = run.get();
            String status = result instanceof StrategyPlan plan && !plan.complete() ? "partial" : "completed";
            metrics.recordPlanResult(status);
            log.info("Plan {} {}", planId, status);
            return result;
        } catch (RuntimeException e) {
            log.error("Plan {} failed: {}", planId, e.getMessage());
            metrics.recordPlanResult("failed");
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private <T> T runStage(String planId, WorkflowStage stage, Supplier<T> body) {
        MdcContext.setStage(planId, stage);
        long start = System.currentTimeMillis();
        try {
            T result = body.get();
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordStageDuration(stage, elapsed);
            log.info("Stage {} completed in {}ms", stage, elapsed);
            return result;
        } finally {
            MdcContext.clearStage();
        }
    }

    private AnalysisResult refine(AnalysisResult analysis) {
        AnalysisRefiner analysisRefiner = refiner.getIfAvailable();
        if (analysisRefiner == null) {
            return analysis;
        }
        AnalysisResult refined = analysisRefiner.refine(analysis);
        if (refined == null) {
            throw new PlanValidationException("Analysis refiner returned no analysis");
        }
        log.info("Analysis refined: domain {} -> {}, complexity {} -> {}",
                analysis.domain(), refined.domain(), analysis.complexity(), refined.complexity());
        return refined;
    }

    private static boolean reaches(WorkflowStage target, WorkflowStage stage) {
        return !stage.isAfter(target);
    }

    private static void requireAnalysis(AnalysisResult analysis) {
        if (analysis == null) {
            throw new PlanValidationException("An analysis result is required");
        }
    }
}
