package com.strategist.core.mission;

import com.strategist.core.config.ConfigurationException;
import com.strategist.core.config.ResourceProfileRegistry;
import com.strategist.core.config.ScoringWeights;
import com.strategist.core.model.ResourceAssignment;
import com.strategist.core.model.ResourceProfile;
import com.strategist.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceAssignerTest {

    private static final ResourceProfile GENERALIST = new ResourceProfile("generalist", List.of(), 1, 10, 3, false);
    private static final ResourceProfile TESTER = new ResourceProfile("tester", List.of("test"), 1, 5, 3, true);

    private static ResourceAssigner assigner(ScoringWeights weights, ResourceProfile... profiles) {
        return new ResourceAssigner(new ResourceProfileRegistry(List.of(profiles)), weights);
    }

    private static Task task(String id, String name, Integer complexity, String hint, String... deps) {
        return new Task(id, name, "", "auth", List.of(deps), "1 day", complexity, hint,
                List.of(), List.of(), false);
    }

    @Nested
    @DisplayName("assign")
    class Assign {

        @Test
        @DisplayName("verification work goes to the tester and its implementation follows")
        void pairingContinuity() {
            List<ResourceAssignment> result = assigner(ScoringWeights.defaults(), GENERALIST, TESTER).assign(List.of(
                    task("test_login", "Login Tests", 2, null),
                    task("impl_login", "Login Flow", 4, null, "test_login")));

            assertEquals("tester", result.get(0).profile());
            assertEquals("tester", result.get(1).profile());
            assertNull(result.get(0).parallelGroup());
        }

        @Test
        @DisplayName("profile hint naming a declared profile wins outright")
        void honorsHint() {
            List<ResourceAssignment> result = assigner(ScoringWeights.defaults(), GENERALIST, TESTER).assign(List.of(
                    task("test_login", "Login Tests", 2, "generalist")));

            assertEquals("generalist", result.get(0).profile());
        }

        @Test
        @DisplayName("hints are ignored when disabled")
        void ignoresHint() {
            List<ResourceAssignment> result = assigner(ScoringWeights.defaults().withHonorProfileHints(false),
                    GENERALIST, TESTER).assign(List.of(task("test_login", "Login Tests", 2, "generalist")));

            assertEquals("tester", result.get(0).profile());
        }

        @Test
        @DisplayName("unknown hint falls back to scoring")
        void unknownHint() {
            List<ResourceAssignment> result = assigner(ScoringWeights.defaults(), GENERALIST, TESTER).assign(List.of(
                    task("impl_payroll", "Payroll", 8, "accountant")));

            assertEquals("generalist", result.get(0).profile());
        }

        @Test
        @DisplayName("ties go to the profile declared first")
        void tieBreak() {
            var twin = new ResourceProfile("twin", List.of(), 1, 10, 3, false);
            List<ResourceAssignment> result = assigner(ScoringWeights.defaults(), GENERALIST, twin).assign(List.of(
                    task("impl_a", "A", 3, null)));

            assertEquals("generalist", result.get(0).profile());
        }

        @Test
        @DisplayName("full profiles lose to profiles with free slots")
        void spreadsLoad() {
            var solo = new ResourceProfile("solo", List.of("auth"), 1, 10, 1, false);
            var backup = new ResourceProfile("backup", List.of(), 1, 10, 1, false);
            List<ResourceAssignment> result = assigner(ScoringWeights.defaults(), solo, backup).assign(List.of(
                    task("deploy_a", "Deploy A", 3, null),
                    task("deploy_b", "Deploy B", 3, null)));

            assertEquals("solo", result.get(0).profile());
            assertEquals("backup", result.get(1).profile());
        }

        @Test
        @DisplayName("effort defaults to one day")
        void defaultEffort() {
            var noEffort = new Task("impl_a", "A", "", "p", List.of(), null, 3, null, List.of(), List.of(), false);
            List<ResourceAssignment> result = assigner(ScoringWeights.defaults(), GENERALIST).assign(List.of(noEffort));

            assertEquals(ResourceAssigner.DEFAULT_EFFORT, result.get(0).estimatedEffort());
        }

        @Test
        @DisplayName("no profiles is a configuration error")
        void noProfiles() {
            var assigner = assigner(ScoringWeights.defaults());
            var tasks = List.of(task("impl_a", "A", 3, null));
            assertThrows(ConfigurationException.class, () -> assigner.assign(tasks));
        }
    }

    @Nested
    @DisplayName("score")
    class Score {

        private final ResourceAssigner assigner = assigner(ScoringWeights.defaults(), GENERALIST, TESTER);

        @Test
        @DisplayName("specialization, fit, expertise and free capacity add up")
        void verificationTask() {
            Task verification = task("test_login", "Login Tests", 2, null);

            assertEquals(33, assigner.score(verification, TESTER, List.of(), List.of()));
            assertEquals(14, assigner.score(verification, GENERALIST, List.of(), List.of()));
        }

        @Test
        @DisplayName("holding the counterpart earns the continuity bonus")
        void continuity() {
            Task implementation = task("impl_login", "Login Flow", 4, null);

            assertEquals(27, assigner.score(implementation, TESTER, List.of("test_login"), List.of("test_login")));
        }

        @Test
        @DisplayName("complexity outside the range is scored as over or under qualified")
        void outsideRange() {
            var senior = new ResourceProfile("senior", List.of(), 5, 10, 1, false);

            assertEquals(4 + 2, assigner.score(task("impl_a", "A", 2, null), senior, List.of(), List.of()));
            assertEquals(-5 - 10, assigner.score(task("impl_a", "A", 7, null), TESTER,
                    List.of("x", "y", "z"), List.of()));
        }

        @Test
        @DisplayName("phase id counts as task text")
        void phaseIdMatches() {
            var auth = new ResourceProfile("auth", List.of("AUTH"), 1, 10, 1, false);

            assertEquals(10 + 8 + 2, assigner.score(task("impl_a", "A", 3, null), auth, List.of(), List.of()));
        }
    }

    @Nested
    @DisplayName("priorityOf")
    class Priority {

        @Test
        @DisplayName("clamped at ten")
        void clamped() {
            var task = new Task("test_a", "A", "", "p", List.of(), "1 day", 4, null, List.of(), List.of(), true);
            assertEquals(10, ResourceAssigner.priorityOf(task));
        }

        @Test
        @DisplayName("base priority for simple dependent work")
        void base() {
            assertEquals(5, ResourceAssigner.priorityOf(task("impl_a", "A", 2, null, "x")));
            assertEquals(5, ResourceAssigner.priorityOf(task("impl_a", "A", null, null, "x")));
        }

        @Test
        @DisplayName("complexity and root position raise priority")
        void raised() {
            assertEquals(6, ResourceAssigner.priorityOf(task("impl_a", "A", 3, null, "x")));
            assertEquals(8, ResourceAssigner.priorityOf(task("impl_a", "A", 9, null)));
        }
    }
}
