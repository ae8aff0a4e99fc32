package com.strategist.core.model;

import java.io.Serializable;

/**
 * A parallel group in which one profile is assigned more tasks than it can run at once.
 */
public record ResourceConflict(
    String type,
    String parallelGroup,
    String profile,
    int assignedTasks,
    int maxCapacity,
    String description
) implements Serializable {

    public static final String OVERALLOCATION = "overallocation";

    public static ResourceConflict overallocation(String group, String profile, int assigned, int capacity) {
        return new ResourceConflict(OVERALLOCATION, group, profile, assigned, capacity,
                "Profile " + profile + " assigned " + assigned + " tasks in parallel group " + group
                        + ", exceeding capacity of " + capacity);
    }
}
