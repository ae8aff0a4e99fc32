package com.strategist.core.config;

/**
 * Weights used when scoring a (task, resource profile) pair.
 *
 * @param specializationMatch   a profile specialization appears in the task text
 * @param complexityFit         task complexity inside the profile's range
 * @param overqualified         task complexity below the range
 * @param underqualified        task complexity above the range (usually negative)
 * @param verificationExpertise verification task on a profile with verification expertise
 * @param workloadPerFreeSlot   multiplied by the profile's remaining capacity
 * @param overCapacity          applied once the profile is at or over capacity (usually negative)
 * @param pairingContinuity     the profile already holds the task's verification/implementation counterpart
 * @param honorProfileHints     take a task's profile hint outright when it names a declared profile
 */
public record ScoringWeights(
    int specializationMatch,
    int complexityFit,
    int overqualified,
    int underqualified,
    int verificationExpertise,
    int workloadPerFreeSlot,
    int overCapacity,
    int pairingContinuity,
    boolean honorProfileHints
) {

    public static ScoringWeights defaults() {
        return new ScoringWeights(10, 8, 4, -5, 9, 2, -10, 15, true);
    }

    public ScoringWeights withHonorProfileHints(boolean honor) {
        return new ScoringWeights(specializationMatch, complexityFit, overqualified, underqualified,
                verificationExpertise, workloadPerFreeSlot, overCapacity, pairingContinuity, honor);
    }
}
