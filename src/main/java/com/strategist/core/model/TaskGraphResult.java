package com.strategist.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of task graph generation.
 *
 * @param tasks            all tasks, phase by phase in template order
 * @param taskCount        always {@code tasks.size()}
 * @param dependencyMatrix task ID to the IDs it depends on, in task order
 * @param criticalPath     task IDs along the deepest dependency chain
 * @param bottlenecks      task IDs flagged as likely constraints
 * @param parallelTasks    groups of tasks at the same depth with no mutual dependency
 */
public record TaskGraphResult(
    List<Task> tasks,
    int taskCount,
    Map<String, List<String>> dependencyMatrix,
    List<String> criticalPath,
    List<String> bottlenecks,
    List<List<String>> parallelTasks
) implements Serializable {

    public TaskGraphResult {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        if (taskCount != tasks.size()) {
            throw new IllegalArgumentException("taskCount " + taskCount + " does not match " + tasks.size() + " tasks");
        }
        dependencyMatrix = dependencyMatrix == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dependencyMatrix));
        criticalPath = criticalPath == null ? List.of() : List.copyOf(criticalPath);
        bottlenecks = bottlenecks == null ? List.of() : List.copyOf(bottlenecks);
        parallelTasks = parallelTasks == null ? List.of() : parallelTasks.stream().map(List::copyOf).toList();
    }

    public static TaskGraphResult empty() {
        return new TaskGraphResult(List.of(), 0, Map.of(), List.of(), List.of(), List.of());
    }
}
