package com.strategist.core.metrics;

import com.strategist.core.model.WorkflowStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for planning runs.
 */
@Service
public class PlannerMetrics {

    private final MeterRegistry registry;

    public PlannerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(WorkflowStage stage, long ms) {
        Timer.builder("strategist.stage.duration")
                .tag("stage", stage.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param status "completed", "partial" or "failed"
     */
    public void recordPlanResult(String status) {
        Counter.builder("strategist.plans.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordInjectedVerificationTasks(int count) {
        DistributionSummary.builder("strategist.verification.injected")
                .description("Verification tasks synthesized per mission map")
                .register(registry)
                .record(count);
    }

    public void recordConflicts(int count) {
        Counter.builder("strategist.conflicts.total")
                .description("Over-capacity parallel groups detected")
                .register(registry)
                .increment(count);
    }

    public void recordTaskCount(int count) {
        DistributionSummary.builder("strategist.taskgraph.tasks")
                .description("Tasks per generated task graph")
                .register(registry)
                .record(count);
    }
}
