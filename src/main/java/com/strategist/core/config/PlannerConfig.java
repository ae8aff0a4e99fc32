package com.strategist.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the template and profile registries once at startup. Planning stages
 * receive them through constructor injection and never touch the filesystem.
 */
@Configuration
public class PlannerConfig {

    @Bean
    public PhaseTemplateRegistry phaseTemplateRegistry(TemplateLoader loader, PlannerProperties properties) {
        return loader.loadPhaseTemplates(properties.getPhaseTemplatesLocation());
    }

    @Bean
    public TaskTemplateRegistry taskTemplateRegistry(TemplateLoader loader, PlannerProperties properties) {
        return loader.loadTaskTemplates(properties.getTaskTemplatesLocation());
    }

    @Bean
    public ResourceProfileRegistry resourceProfileRegistry(TemplateLoader loader, PlannerProperties properties) {
        return loader.loadResourceProfiles(properties.getResourceProfilesLocation());
    }

    @Bean
    public ScoringWeights scoringWeights(PlannerProperties properties) {
        return properties.toScoringWeights();
    }
}
