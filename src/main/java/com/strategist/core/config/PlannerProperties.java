package com.strategist.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "strategist")
public class PlannerProperties {

    private Templates templates = new Templates();
    private Scoring scoring = new Scoring();
    private Schedule schedule = new Schedule();

    public String getPhaseTemplatesLocation() { return templates.phase; }
    public String getTaskTemplatesLocation() { return templates.task; }
    public String getResourceProfilesLocation() { return templates.profiles; }
    public int getTargetGroupSize() { return schedule.targetGroupSize; }

    public ScoringWeights toScoringWeights() {
        return new ScoringWeights(
                scoring.specializationMatch, scoring.complexityFit, scoring.overqualified,
                scoring.underqualified, scoring.verificationExpertise, scoring.workloadPerFreeSlot,
                scoring.overCapacity, scoring.pairingContinuity, scoring.honorProfileHints);
    }

    public Templates getTemplates() { return templates; }
    public void setTemplates(Templates templates) { this.templates = templates; }
    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }
    public Schedule getSchedule() { return schedule; }
    public void setSchedule(Schedule schedule) { this.schedule = schedule; }

    public static class Templates {
        private String phase = "classpath:templates/phase-templates.json";
        private String task = "classpath:templates/task-templates.json";
        private String profiles = "classpath:templates/resource-profiles.json";

        public String getPhase() { return phase; }
        public void setPhase(String phase) { this.phase = phase; }
        public String getTask() { return task; }
        public void setTask(String task) { this.task = task; }
        public String getProfiles() { return profiles; }
        public void setProfiles(String profiles) { this.profiles = profiles; }
    }

    public static class Scoring {
        private int specializationMatch = 10;
        private int complexityFit = 8;
        private int overqualified = 4;
        private int underqualified = -5;
        private int verificationExpertise = 9;
        private int workloadPerFreeSlot = 2;
        private int overCapacity = -10;
        private int pairingContinuity = 15;
        private boolean honorProfileHints = true;

        public int getSpecializationMatch() { return specializationMatch; }
        public void setSpecializationMatch(int specializationMatch) { this.specializationMatch = specializationMatch; }
        public int getComplexityFit() { return complexityFit; }
        public void setComplexityFit(int complexityFit) { this.complexityFit = complexityFit; }
        public int getOverqualified() { return overqualified; }
        public void setOverqualified(int overqualified) { this.overqualified = overqualified; }
        public int getUnderqualified() { return underqualified; }
        public void setUnderqualified(int underqualified) { this.underqualified = underqualified; }
        public int getVerificationExpertise() { return verificationExpertise; }
        public void setVerificationExpertise(int verificationExpertise) { this.verificationExpertise = verificationExpertise; }
        public int getWorkloadPerFreeSlot() { return workloadPerFreeSlot; }
        public void setWorkloadPerFreeSlot(int workloadPerFreeSlot) { this.workloadPerFreeSlot = workloadPerFreeSlot; }
        public int getOverCapacity() { return overCapacity; }
        public void setOverCapacity(int overCapacity) { this.overCapacity = overCapacity; }
        public int getPairingContinuity() { return pairingContinuity; }
        public void setPairingContinuity(int pairingContinuity) { this.pairingContinuity = pairingContinuity; }
        public boolean isHonorProfileHints() { return honorProfileHints; }
        public void setHonorProfileHints(boolean honorProfileHints) { this.honorProfileHints = honorProfileHints; }
    }

    public static class Schedule {
        private int targetGroupSize = 3;

        public int getTargetGroupSize() { return targetGroupSize; }
        public void setTargetGroupSize(int targetGroupSize) { this.targetGroupSize = targetGroupSize; }
    }
}
