package com.strategist.core.mission;

import com.strategist.core.config.ResourceProfileRegistry;
import com.strategist.core.model.EfficiencyRating;
import com.strategist.core.model.ResourceAssignment;
import com.strategist.core.model.ResourceConflict;
import com.strategist.core.model.ResourceProfile;
import com.strategist.core.model.ResourceUtilization;
import com.strategist.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UtilizationAnalyzerTest {

    private final UtilizationAnalyzer analyzer = new UtilizationAnalyzer(new ResourceProfileRegistry(List.of(
            new ResourceProfile("dev", List.of(), 1, 10, 2, false),
            new ResourceProfile("qa", List.of("test"), 1, 10, 4, true))));

    private static Task task(String id) {
        return new Task(id, id, "", "p", List.of(), "1 day", 3, null, List.of(), List.of(), false);
    }

    private static ResourceAssignment assignment(String taskId, String profile, String effort, String group) {
        return new ResourceAssignment(taskId, profile, effort, 5, group);
    }

    @Test
    @DisplayName("workload score weights effort by average priority")
    void workloadScore() {
        var assignments = List.of(
                new ResourceAssignment("impl_a", "dev", "3 days", 8, null),
                new ResourceAssignment("impl_b", "dev", "2 days", 6, null),
                new ResourceAssignment("impl_c", "qa", "1 day", 7, null));

        UtilizationAnalyzer.Report report = analyzer.analyze(
                List.of(task("impl_a"), task("impl_b"), task("impl_c")), assignments);

        ResourceUtilization dev = report.utilization().get("dev");
        assertEquals(5.0, dev.totalEffortDays());
        assertEquals(7.0, dev.averagePriority());
        assertEquals(3.5, dev.workloadScore(), 1e-9);
        ResourceUtilization qa = report.utilization().get("qa");
        assertEquals(7.0, qa.averagePriority());
        assertEquals(0.7, qa.workloadScore(), 1e-9);
    }

    @Nested
    @DisplayName("conflicts")
    class Conflicts {

        @Test
        @DisplayName("three tasks in one group against a capacity of two")
        void overallocated() {
            var tasks = List.of(task("impl_a"), task("impl_b"), task("impl_c"));
            var assignments = List.of(
                    assignment("impl_a", "dev", "1 day", "g"),
                    assignment("impl_b", "dev", "1 day", "g"),
                    assignment("impl_c", "dev", "1 day", "g"));

            UtilizationAnalyzer.Report report = analyzer.analyze(tasks, assignments);

            assertEquals(List.of(ResourceConflict.overallocation("g", "dev", 3, 2)), report.conflicts());
            ResourceUtilization dev = report.utilization().get("dev");
            assertEquals(3, dev.peakConcurrentLoad());
            assertEquals(100.0, dev.utilizationPercent());
            assertEquals(EfficiencyRating.OVER_UTILIZED, dev.efficiency());
        }

        @Test
        @DisplayName("load exactly at capacity is not a conflict")
        void atCapacity() {
            var assignments = List.of(
                    assignment("impl_a", "dev", "1 day", "g"),
                    assignment("impl_b", "dev", "1 day", "g"));

            assertTrue(analyzer.detectConflicts(assignments).isEmpty());
        }

        @Test
        @DisplayName("ungrouped assignments never conflict")
        void ungrouped() {
            var assignments = List.of(
                    assignment("a", "dev", "1 day", null),
                    assignment("b", "dev", "1 day", null),
                    assignment("c", "dev", "1 day", null));

            assertTrue(analyzer.detectConflicts(assignments).isEmpty());
        }

        @Test
        @DisplayName("undeclared profiles get the default capacity of three")
        void undeclaredProfile() {
            var assignments = List.of(
                    assignment("a", "ghost", "1 day", "g"),
                    assignment("b", "ghost", "1 day", "g"),
                    assignment("c", "ghost", "1 day", "g"),
                    assignment("d", "ghost", "1 day", "g"));

            assertEquals(List.of(ResourceConflict.overallocation("g", "ghost", 4, 3)),
                    analyzer.detectConflicts(assignments));
        }
    }

    @Nested
    @DisplayName("utilization")
    class Utilization {

        @Test
        @DisplayName("profile without grouped tasks has a peak load of one")
        void peakOfOne() {
            UtilizationAnalyzer.Report report = analyzer.analyze(List.of(task("impl_a")),
                    List.of(assignment("impl_a", "dev", "4 hours", null)));

            ResourceUtilization dev = report.utilization().get("dev");
            assertEquals(1, dev.peakConcurrentLoad());
            assertEquals(50.0, dev.utilizationPercent());
            assertEquals(EfficiencyRating.UNDER_UTILIZED, dev.efficiency());
            assertEquals(0.5, dev.totalEffortDays());
        }

        @Test
        @DisplayName("profiles with no tasks are omitted")
        void omitsIdleProfiles() {
            UtilizationAnalyzer.Report report = analyzer.analyze(List.of(task("impl_a")),
                    List.of(assignment("impl_a", "dev", "1 day", null)));

            assertEquals(List.of("dev"), List.copyOf(report.utilization().keySet()));
        }

        @Test
        @DisplayName("per-profile compliance and total effort")
        void complianceAndEffort() {
            var tasks = List.of(task("test_a"), task("impl_a"), task("impl_b"));
            UtilizationAnalyzer.Report report = analyzer.analyze(tasks, List.of(
                    assignment("test_a", "qa", "4 hours", null),
                    assignment("impl_a", "dev", "1 day", null),
                    assignment("impl_b", "dev", "1 day", null)));

            assertEquals(1.0, report.utilization().get("qa").verificationCompliance());
            assertEquals(0.0, report.utilization().get("dev").verificationCompliance());
            assertEquals(0.5, report.verificationCompliance());
            assertEquals("2.5 days", report.totalEffortEstimate());
        }
    }

    @Nested
    @DisplayName("compliance")
    class Compliance {

        @Test
        @DisplayName("no tasks at all is neutral")
        void neutral() {
            assertEquals(0.5, UtilizationAnalyzer.compliance(List.of()));
        }

        @Test
        @DisplayName("verification without implementation is compliant")
        void verificationOnly() {
            assertEquals(1.0, UtilizationAnalyzer.compliance(List.of(task("test_a"))));
        }

        @Test
        @DisplayName("ratio is capped at one")
        void capped() {
            assertEquals(1.0, UtilizationAnalyzer.compliance(
                    List.of(task("test_a"), task("test_b"), task("test_c"), task("impl_a"))));
        }

        @Test
        @DisplayName("exempt tasks do not count as implementation")
        void exemptIgnored() {
            var deploy = new Task("release", "Deploy Release", "", "p", List.of(), "1 day", 3, null,
                    List.of(), List.of(), false);
            assertEquals(0.5, UtilizationAnalyzer.compliance(List.of(deploy)));
        }
    }
}
