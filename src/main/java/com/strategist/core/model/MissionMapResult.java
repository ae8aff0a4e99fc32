package com.strategist.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executable mission plan derived from a task graph.
 *
 * @param tasks                  tasks after verification pairing, in declaration order
 * @param resourceAssignments    one assignment per task, same order as {@code tasks}
 * @param executionOrder         topological order, verification tasks first within each frontier
 * @param parallelGroups         group ID to task IDs
 * @param totalEffortEstimate    summed effort (e.g. "2.4 weeks")
 * @param resourceUtilization    per-profile utilization, in profile declaration order
 * @param conflicts              over-capacity groups
 * @param verificationCompliance overall verification to implementation ratio
 */
public record MissionMapResult(
    List<Task> tasks,
    List<ResourceAssignment> resourceAssignments,
    List<String> executionOrder,
    Map<String, List<String>> parallelGroups,
    String totalEffortEstimate,
    Map<String, ResourceUtilization> resourceUtilization,
    List<ResourceConflict> conflicts,
    double verificationCompliance
) implements Serializable {

    public MissionMapResult {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        resourceAssignments = resourceAssignments == null ? List.of() : List.copyOf(resourceAssignments);
        executionOrder = executionOrder == null ? List.of() : List.copyOf(executionOrder);
        parallelGroups = parallelGroups == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parallelGroups));
        resourceUtilization = resourceUtilization == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(resourceUtilization));
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static MissionMapResult empty() {
        return new MissionMapResult(List.of(), List.of(), List.of(), Map.of(), "0 days", Map.of(), List.of(), 0.5);
    }
}
