package com.strategist.core.mission;

import com.strategist.core.model.Task;
import com.strategist.core.model.VerificationPairing;
import com.strategist.core.taskgraph.TaskGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pairs every implementation task with a verification task that must run first.
 * <p>
 * Missing verification tasks are synthesized and placed immediately before their
 * implementation task; each implementation task then depends on its pair. Running
 * the injector on its own output changes nothing.
 */
@Service
public class VerificationInjector {

    private static final Logger log = LoggerFactory.getLogger(VerificationInjector.class);

    static final String FAIL_FIRST_CRITERION = "Tests must fail before implementation exists";

    /**
     * @return the tasks with verification pairs in place
     * @throws com.strategist.core.graph.PlanValidationException if pairing creates a cycle,
     *         e.g. a template verification task that depends on its own implementation
     */
    public List<Task> inject(List<Task> tasks) {
        Set<String> ids = new HashSet<>();
        tasks.forEach(t -> ids.add(t.id()));

        var paired = new ArrayList<Task>(tasks.size() * 2);
        int synthesized = 0;
        for (Task task : tasks) {
            if (VerificationPairing.isImplementation(task)) {
                String verificationId = VerificationPairing.verificationIdFor(task.id());
                if (ids.add(verificationId)) {
                    paired.add(verificationTaskFor(task, verificationId));
                    synthesized++;
                    log.debug("Synthesized {} for {}", verificationId, task.id());
                }
            }
            paired.add(task);
        }

        var rewired = new ArrayList<Task>(paired.size());
        for (Task task : paired) {
            if (VerificationPairing.isImplementation(task)) {
                String verificationId = VerificationPairing.verificationIdFor(task.id());
                rewired.add(ids.contains(verificationId) ? task.withDependency(verificationId) : task);
            } else {
                rewired.add(task);
            }
        }

        TaskGraphBuilder.validate(rewired);
        if (synthesized > 0) {
            log.info("Injected {} verification tasks ({} tasks total)", synthesized, rewired.size());
        }
        return rewired;
    }

    static Task verificationTaskFor(Task implementation, String verificationId) {
        int complexity = implementation.complexityScore() == null ? 3 : implementation.complexityScore();
        return new Task(
                verificationId,
                "Write Unit Tests for " + implementation.name(),
                "Create unit tests for " + implementation.name() + ". The tests must fail before the "
                        + "implementation exists and define the expected behavior and interface.",
                implementation.phaseId(),
                List.of(),
                EffortEstimates.verificationEffort(implementation.estimatedEffort()),
                Math.max(1, complexity - 1),
                implementation.profileHint(),
                List.of("test_" + implementation.id() + ".java", "test_cases_" + implementation.id() + ".json"),
                List.of(FAIL_FIRST_CRITERION,
                        "Tests cover all expected functionality",
                        "Tests follow naming conventions",
                        "Tests include edge cases"),
                false);
    }
}
