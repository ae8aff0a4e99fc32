package com.strategist.core.model;

import java.io.Serializable;

/**
 * Assignment of one task to a resource profile.
 *
 * @param taskId          the assigned task
 * @param profile         resource profile name
 * @param estimatedEffort effort estimate carried from the task ("1 day" when unknown)
 * @param priority        1-10, higher runs earlier
 * @param parallelGroup   schedule group the task belongs to; nullable
 */
public record ResourceAssignment(
    String taskId,
    String profile,
    String estimatedEffort,
    int priority,
    String parallelGroup
) implements Serializable {

    public ResourceAssignment {
        if (priority < 1 || priority > 10) {
            throw new IllegalArgumentException("Priority " + priority + " for task " + taskId + " outside 1-10");
        }
    }

    public ResourceAssignment withParallelGroup(String group) {
        return new ResourceAssignment(taskId, profile, estimatedEffort, priority, group);
    }
}
