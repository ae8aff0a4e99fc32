package com.strategist.core.mission;

import com.strategist.core.config.ResourceProfileRegistry;
import com.strategist.core.model.EfficiencyRating;
import com.strategist.core.model.ResourceAssignment;
import com.strategist.core.model.ResourceConflict;
import com.strategist.core.model.ResourceProfile;
import com.strategist.core.model.ResourceUtilization;
import com.strategist.core.model.Task;
import com.strategist.core.model.VerificationPairing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates per-profile load from grouped assignments and flags parallel groups
 * in which a profile holds more tasks than it can run at once.
 */
@Service
public class UtilizationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(UtilizationAnalyzer.class);

    private static final int DEFAULT_CAPACITY = 3;

    /**
     * @param utilization            per-profile utilization, profiles with no tasks omitted
     * @param conflicts              over-capacity groups
     * @param verificationCompliance overall verification to implementation ratio
     * @param totalEffortEstimate    summed effort of all assignments
     */
    public record Report(
        Map<String, ResourceUtilization> utilization,
        List<ResourceConflict> conflicts,
        double verificationCompliance,
        String totalEffortEstimate
    ) {}

    private final ResourceProfileRegistry profiles;

    public UtilizationAnalyzer(ResourceProfileRegistry profiles) {
        this.profiles = profiles;
    }

    /**
     * @param tasks       tasks after verification pairing
     * @param assignments assignments already labelled with their parallel group
     */
    public Report analyze(List<Task> tasks, List<ResourceAssignment> assignments) {
        var taskById = new HashMap<String, Task>();
        tasks.forEach(t -> taskById.put(t.id(), t));

        var byProfile = new LinkedHashMap<String, List<ResourceAssignment>>();
        profiles.profiles().forEach(p -> byProfile.put(p.name(), new ArrayList<>()));
        for (ResourceAssignment assignment : assignments) {
            byProfile.computeIfAbsent(assignment.profile(), k -> new ArrayList<>()).add(assignment);
        }

        var utilization = new LinkedHashMap<String, ResourceUtilization>();
        byProfile.forEach((profile, assigned) -> {
            if (!assigned.isEmpty()) {
                utilization.put(profile, utilizationOf(profile, assigned, taskById));
            }
        });

        List<ResourceConflict> conflicts = detectConflicts(assignments);
        double compliance = compliance(tasks);
        double totalDays = assignments.stream().mapToDouble(a -> EffortEstimates.toDays(a.estimatedEffort())).sum();
        if (!conflicts.isEmpty()) {
            log.warn("Detected {} resource conflicts", conflicts.size());
        }
        return new Report(utilization, conflicts, compliance, EffortEstimates.formatTotal(totalDays));
    }

    private ResourceUtilization utilizationOf(String profile, List<ResourceAssignment> assigned,
                                              Map<String, Task> taskById) {
        int capacity = capacityOf(profile);
        double effortDays = assigned.stream().mapToDouble(a -> EffortEstimates.toDays(a.estimatedEffort())).sum();

        var perGroup = new HashMap<String, Integer>();
        for (ResourceAssignment a : assigned) {
            if (a.parallelGroup() != null) {
                perGroup.merge(a.parallelGroup(), 1, Integer::sum);
            }
        }
        int peak = perGroup.values().stream().mapToInt(Integer::intValue).max().orElse(1);
        double percent = Math.min(100.0, peak * 100.0 / capacity);

        double averagePriority = assigned.stream().mapToInt(ResourceAssignment::priority).average().orElse(0);

        List<Task> profileTasks = assigned.stream()
                .map(a -> taskById.get(a.taskId()))
                .filter(Objects::nonNull)
                .toList();
        return new ResourceUtilization(profile, assigned.size(), effortDays, peak, capacity, percent,
                EfficiencyRating.of(percent), compliance(profileTasks),
                averagePriority, effortDays * averagePriority / 10);
    }

    List<ResourceConflict> detectConflicts(List<ResourceAssignment> assignments) {
        var loads = new LinkedHashMap<String, Map<String, Integer>>();
        for (ResourceAssignment a : assignments) {
            if (a.parallelGroup() != null) {
                loads.computeIfAbsent(a.parallelGroup(), g -> new LinkedHashMap<>())
                        .merge(a.profile(), 1, Integer::sum);
            }
        }
        var conflicts = new ArrayList<ResourceConflict>();
        loads.forEach((group, byProfile) -> byProfile.forEach((profile, load) -> {
            int capacity = capacityOf(profile);
            if (load > capacity) {
                conflicts.add(ResourceConflict.overallocation(group, profile, load, capacity));
            }
        }));
        return conflicts;
    }

    /**
     * Verification tasks over implementation tasks, capped at 1. With no
     * implementation tasks: 1.0 if any verification task exists, otherwise 0.5.
     */
    static double compliance(Collection<Task> tasks) {
        long verification = tasks.stream().filter(Task::isVerification).count();
        long implementation = tasks.stream().filter(VerificationPairing::isImplementation).count();
        if (implementation == 0) {
            return verification > 0 ? 1.0 : 0.5;
        }
        return Math.min(1.0, (double) verification / implementation);
    }

    private int capacityOf(String profile) {
        return profiles.find(profile).map(ResourceProfile::maxConcurrentTasks).orElse(DEFAULT_CAPACITY);
    }
}
