package com.strategist.core.model;

import java.io.Serializable;
import java.util.Locale;

/**
 * Aggregated load for one resource profile across a mission map.
 *
 * @param profile                resource profile name
 * @param taskCount              tasks assigned to the profile
 * @param totalEffortDays        summed effort in working days
 * @param peakConcurrentLoad     most tasks of this profile inside a single parallel group
 * @param capacity               declared max concurrent tasks
 * @param utilizationPercent     peak load against capacity, 0-100
 * @param efficiency             label derived from {@code utilizationPercent}
 * @param verificationCompliance verification to implementation ratio, 0.0-1.0
 * @param averagePriority        mean assignment priority, 1-10
 * @param workloadScore          {@code totalEffortDays} weighted by {@code averagePriority / 10}
 */
public record ResourceUtilization(
    String profile,
    int taskCount,
    double totalEffortDays,
    int peakConcurrentLoad,
    int capacity,
    double utilizationPercent,
    EfficiencyRating efficiency,
    double verificationCompliance,
    double averagePriority,
    double workloadScore
) implements Serializable {

    /** One-line rendering, e.g. "66.7% utilization (4 tasks, 2.5 days, good, verification: 100%)". */
    public String summary() {
        return String.format(Locale.ROOT, "%.1f%% utilization (%d tasks, %.1f days, %s, verification: %.0f%%)",
                utilizationPercent, taskCount, totalEffortDays, efficiency.label(), verificationCompliance * 100);
    }
}
