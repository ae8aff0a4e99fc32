package com.strategist.core.mission;

import com.strategist.core.config.ConfigurationException;
import com.strategist.core.config.ResourceProfileRegistry;
import com.strategist.core.config.ScoringWeights;
import com.strategist.core.model.ResourceAssignment;
import com.strategist.core.model.ResourceProfile;
import com.strategist.core.model.Task;
import com.strategist.core.model.VerificationPairing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns each task, in declaration order, to the best-scoring resource profile.
 * <p>
 * The score rewards specialization matches, a fitting complexity range,
 * verification expertise on verification tasks, spare capacity, and a profile
 * that already holds the task's verification or implementation counterpart.
 * Ties go to the profile declared first.
 */
@Service
public class ResourceAssigner {

    private static final Logger log = LoggerFactory.getLogger(ResourceAssigner.class);

    private static final int DEFAULT_COMPLEXITY = 3;
    static final String DEFAULT_EFFORT = "1 day";

    private final ResourceProfileRegistry profiles;
    private final ScoringWeights weights;

    public ResourceAssigner(ResourceProfileRegistry profiles, ScoringWeights weights) {
        this.profiles = profiles;
        this.weights = weights;
    }

    /**
     * @return one assignment per task in task order, without parallel groups
     * @throws ConfigurationException if no resource profiles are configured
     */
    public List<ResourceAssignment> assign(List<Task> tasks) {
        if (profiles.isEmpty()) {
            throw new ConfigurationException("No resource profiles configured");
        }
        Map<String, List<String>> implementationsByVerification = new LinkedHashMap<>();
        for (Task task : tasks) {
            if (VerificationPairing.isImplementation(task)) {
                implementationsByVerification
                        .computeIfAbsent(VerificationPairing.verificationIdFor(task.id()), k -> new ArrayList<>())
                        .add(task.id());
            }
        }

        Map<String, List<String>> workload = new LinkedHashMap<>();
        profiles.profiles().forEach(p -> workload.put(p.name(), new ArrayList<>()));

        var assignments = new ArrayList<ResourceAssignment>(tasks.size());
        for (Task task : tasks) {
            List<String> counterparts = task.isVerification()
                    ? implementationsByVerification.getOrDefault(task.id(), List.of())
                    : List.of(VerificationPairing.verificationIdFor(task.id()));
            String profile = hintedProfile(task).orElseGet(() -> bestProfile(task, counterparts, workload));
            workload.get(profile).add(task.id());
            assignments.add(new ResourceAssignment(task.id(), profile,
                    task.estimatedEffort() == null ? DEFAULT_EFFORT : task.estimatedEffort(),
                    priorityOf(task), null));
        }
        log.info("Assigned {} tasks across {} profiles", assignments.size(),
                workload.values().stream().filter(l -> !l.isEmpty()).count());
        return assignments;
    }

    private Optional<String> hintedProfile(Task task) {
        if (!weights.honorProfileHints()) {
            return Optional.empty();
        }
        Optional<String> hinted = profiles.findByHint(task.profileHint()).map(ResourceProfile::name);
        hinted.ifPresent(p -> log.debug("{} -> {} (profile hint)", task.id(), p));
        return hinted;
    }

    private String bestProfile(Task task, List<String> counterparts, Map<String, List<String>> workload) {
        String best = null;
        int bestScore = Integer.MIN_VALUE;
        for (ResourceProfile profile : profiles.profiles()) {
            int score = score(task, profile, workload.get(profile.name()), counterparts);
            if (score > bestScore) {
                bestScore = score;
                best = profile.name();
            }
        }
        log.debug("{} -> {} (score {})", task.id(), best, bestScore);
        return best;
    }

    int score(Task task, ResourceProfile profile, List<String> assignedToProfile, List<String> counterparts) {
        int score = 0;
        String text = (nullToEmpty(task.name()) + " " + nullToEmpty(task.description()) + " "
                + nullToEmpty(task.phaseId())).toLowerCase(Locale.ROOT);
        if (profile.specializations().stream().anyMatch(s -> text.contains(s.toLowerCase(Locale.ROOT)))) {
            score += weights.specializationMatch();
        }

        int complexity = task.complexityScore() == null ? DEFAULT_COMPLEXITY : task.complexityScore();
        if (profile.accepts(complexity)) {
            score += weights.complexityFit();
        } else if (complexity < profile.complexityLow()) {
            score += weights.overqualified();
        } else {
            score += weights.underqualified();
        }

        if (task.isVerification() && profile.verificationExpertise()) {
            score += weights.verificationExpertise();
        }

        int current = assignedToProfile.size();
        if (current < profile.maxConcurrentTasks()) {
            score += (profile.maxConcurrentTasks() - current) * weights.workloadPerFreeSlot();
        } else {
            score += weights.overCapacity();
        }

        if (counterparts.stream().anyMatch(assignedToProfile::contains)) {
            score += weights.pairingContinuity();
        }
        return score;
    }

    /**
     * Base 5; +2 for verification tasks; +2 for complexity 4 and up or +1 for 3;
     * +1 for a human checkpoint; +1 for a task with no dependencies. Clamped to 1-10.
     */
    static int priorityOf(Task task) {
        int priority = 5;
        if (task.isVerification()) {
            priority += 2;
        }
        Integer complexity = task.complexityScore();
        if (complexity != null) {
            if (complexity >= 4) {
                priority += 2;
            } else if (complexity >= 3) {
                priority += 1;
            }
        }
        if (task.humanCheckpoint()) {
            priority += 1;
        }
        if (task.dependencies().isEmpty()) {
            priority += 1;
        }
        return Math.min(10, Math.max(1, priority));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
