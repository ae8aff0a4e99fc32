package com.strategist.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strategist.core.config.ConfigurationException;
import com.strategist.core.engine.PlanningRequest;
import com.strategist.core.engine.StrategyEngine;
import com.strategist.core.graph.PlanValidationException;
import com.strategist.core.model.AnalysisResult;
import com.strategist.core.model.DecompositionResult;
import com.strategist.core.model.MissionMapResult;
import com.strategist.core.model.Phase;
import com.strategist.core.model.ResourceAssignment;
import com.strategist.core.model.StrategyPlan;
import com.strategist.core.model.TaskGraphResult;
import com.strategist.core.model.WorkflowStage;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * CLI command: strategist plan --domain web --complexity high
 * <p>
 * Runs the planning pipeline for an analysis given on the command line and
 * prints the phases, task graph and mission map, or the plan as JSON.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Plan a project from its analysis")
@Component
public class PlanCommand implements Runnable {

    @Option(names = {"--domain", "-d"}, description = "Project domain, e.g. web, api, data, mobile")
    private String domain;

    @Option(names = {"--complexity", "-c"}, description = "Complexity: low, medium, high, very_high")
    private String complexity;

    @Option(names = {"--tech", "-t"}, split = ",", description = "Technology stack entries")
    private List<String> technologyStack = new ArrayList<>();

    @Option(names = {"--keyword", "-k"}, split = ",", description = "Keywords from the project description")
    private List<String> keywords = new ArrayList<>();

    @Option(names = {"--stage", "-s"}, defaultValue = "COMPLETE",
            description = "Last stage to run: DECOMPOSITION, TASK_GRAPH, MISSION_MAP, COMPLETE")
    private String stage;

    @Option(names = "--json", description = "Print the plan as JSON")
    private boolean json;

    private final StrategyEngine strategyEngine;
    private final ObjectMapper objectMapper;

    public PlanCommand(StrategyEngine strategyEngine, ObjectMapper objectMapper) {
        this.strategyEngine = strategyEngine;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        WorkflowStage target;
        try {
            target = WorkflowStage.fromLabel(stage);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid stage: " + stage
                    + ". Valid stages: DECOMPOSITION, TASK_GRAPH, MISSION_MAP, COMPLETE");
            return;
        }

        var analysis = new AnalysisResult(domain, complexity, keywords, technologyStack, List.of(), List.of());
        StrategyPlan plan;
        try {
            plan = strategyEngine.execute(PlanningRequest.of(analysis).upTo(target));
        } catch (PlanValidationException | ConfigurationException e) {
            ConsoleOutput.error("Planning failed: " + e.getMessage());
            return;
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(plan));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not render plan as JSON: " + e.getOriginalMessage());
            }
            return;
        }

        ConsoleOutput.printBanner();
        ConsoleOutput.info(String.format("Domain: %s | Complexity: %s",
                orDash(plan.analysis().domain()), orDash(plan.analysis().complexity())));
        if (plan.decomposition() != null) {
            printDecomposition(plan.decomposition());
        }
        if (plan.taskGraph() != null) {
            printTaskGraph(plan.taskGraph());
        }
        if (plan.missionMap() != null) {
            printMissionMap(plan.missionMap());
        }

        System.out.println();
        if (plan.complete()) {
            ConsoleOutput.success("Plan complete.");
        } else {
            ConsoleOutput.info("Stopped after " + plan.stage() + ". Next stage: " + plan.nextStage());
        }
    }

    private static void printDecomposition(DecompositionResult d) {
        ConsoleOutput.heading("PHASES (template " + d.templateName() + ", " + d.totalEstimatedDuration() + ")");
        for (Phase p : d.phases()) {
            System.out.printf("  %-16s %-36s %-12s %s%n", p.id(), p.name(), orDash(p.estimatedDuration()),
                    p.dependencies().isEmpty() ? "" : "after " + String.join(", ", p.dependencies()));
        }
        ConsoleOutput.path("Critical path", d.criticalPath());
        for (List<String> group : d.parallelOpportunities()) {
            System.out.println("  Parallel: " + String.join(", ", group));
        }
        if (!d.priorityPhases().isEmpty()) {
            System.out.println("  Priority: " + String.join(", ", d.priorityPhases()));
        }
    }

    private static void printTaskGraph(TaskGraphResult g) {
        ConsoleOutput.heading("TASK GRAPH (" + g.taskCount() + " tasks)");
        ConsoleOutput.path("Critical path", g.criticalPath());
        System.out.println("  Bottlenecks: " + (g.bottlenecks().isEmpty() ? "(none)" : String.join(", ", g.bottlenecks())));
        System.out.println("  Parallel groups: " + g.parallelTasks().size());
    }

    private static void printMissionMap(MissionMapResult m) {
        ConsoleOutput.heading("MISSION MAP (" + m.tasks().size() + " tasks, " + m.totalEffortEstimate() + ")");
        var byTask = new HashMap<String, ResourceAssignment>();
        m.resourceAssignments().forEach(a -> byTask.put(a.taskId(), a));
        int step = 1;
        for (String taskId : m.executionOrder()) {
            ResourceAssignment a = byTask.get(taskId);
            System.out.printf("  %3d. %-40s %-22s p%-2d %s%n", step++, taskId, a.profile(), a.priority(),
                    a.parallelGroup() == null ? "" : a.parallelGroup());
        }

        ConsoleOutput.heading("UTILIZATION");
        m.resourceUtilization().values().forEach(ConsoleOutput::utilization);
        System.out.println("  Verification compliance: " + ConsoleOutput.percent(m.verificationCompliance()));
        for (var conflict : m.conflicts()) {
            ConsoleOutput.conflict(conflict);
        }
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
