package com.strategist.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A named category of simulated worker that tasks can be assigned to.
 *
 * @param name                  profile name (e.g. "backend_developer")
 * @param specializations       tags matched against task text
 * @param complexityLow         lowest task complexity the profile handles well
 * @param complexityHigh        highest task complexity the profile handles well
 * @param maxConcurrentTasks    concurrency capacity
 * @param verificationExpertise true if the profile specialises in writing tests first
 */
public record ResourceProfile(
    String name,
    List<String> specializations,
    int complexityLow,
    int complexityHigh,
    int maxConcurrentTasks,
    boolean verificationExpertise
) implements Serializable {

    public ResourceProfile {
        specializations = specializations == null ? List.of() : List.copyOf(specializations);
    }

    public boolean accepts(int complexity) {
        return complexity >= complexityLow && complexity <= complexityHigh;
    }
}
