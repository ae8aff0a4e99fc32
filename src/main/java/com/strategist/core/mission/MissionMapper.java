package com.strategist.core.mission;

import com.strategist.core.graph.PlanValidationException;
import com.strategist.core.model.AnalysisResult;
import com.strategist.core.model.MissionMapResult;
import com.strategist.core.model.ResourceAssignment;
import com.strategist.core.model.Task;
import com.strategist.core.model.TaskGraphResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns a task graph into a mission map: verification pairing, resource
 * assignment, scheduling, then utilization analysis.
 */
@Service
public class MissionMapper {

    private static final Logger log = LoggerFactory.getLogger(MissionMapper.class);

    private final VerificationInjector verificationInjector;
    private final ResourceAssigner resourceAssigner;
    private final ScheduleGenerator scheduleGenerator;
    private final UtilizationAnalyzer utilizationAnalyzer;

    public MissionMapper(VerificationInjector verificationInjector, ResourceAssigner resourceAssigner,
                         ScheduleGenerator scheduleGenerator, UtilizationAnalyzer utilizationAnalyzer) {
        this.verificationInjector = verificationInjector;
        this.resourceAssigner = resourceAssigner;
        this.scheduleGenerator = scheduleGenerator;
        this.utilizationAnalyzer = utilizationAnalyzer;
    }

    /**
     * @throws PlanValidationException if either input is missing or the task graph is invalid
     */
    public MissionMapResult map(TaskGraphResult taskGraph, AnalysisResult analysis) {
        if (taskGraph == null) {
            throw new PlanValidationException("Mission map creation requires a task graph");
        }
        if (analysis == null) {
            throw new PlanValidationException("Mission map creation requires an analysis result");
        }
        if (taskGraph.tasks().isEmpty()) {
            return MissionMapResult.empty();
        }

        List<Task> tasks = verificationInjector.inject(taskGraph.tasks());
        List<ResourceAssignment> assignments = resourceAssigner.assign(tasks);
        ScheduleGenerator.Schedule schedule = scheduleGenerator.generate(tasks, assignments);
        UtilizationAnalyzer.Report report = utilizationAnalyzer.analyze(tasks, schedule.assignments());

        log.info("Mission map: {} tasks, {} groups, total effort {}, compliance {}",
                tasks.size(), schedule.parallelGroups().size(), report.totalEffortEstimate(),
                report.verificationCompliance());
        return new MissionMapResult(tasks, schedule.assignments(), schedule.executionOrder(),
                schedule.parallelGroups(), report.totalEffortEstimate(), report.utilization(),
                report.conflicts(), report.verificationCompliance());
    }
}
