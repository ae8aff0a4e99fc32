package com.strategist.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strategist.core.model.Complexity;
import com.strategist.core.model.PhaseType;
import com.strategist.core.model.ResourceProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the phase-template, task-template and resource-profile JSON files and
 * turns them into immutable registries. Any missing file or malformed content
 * raises {@link ConfigurationException}.
 */
@Component
public class TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public TemplateLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    public PhaseTemplateRegistry loadPhaseTemplates(String location) {
        PhaseTemplatesFile file = read(location, PhaseTemplatesFile.class);
        var templates = new LinkedHashMap<String, PhaseTemplateRegistry.PhaseTemplate>();
        if (file.templates() != null) {
            file.templates().forEach((name, t) -> {
                var entries = new ArrayList<PhaseTemplateRegistry.PhaseEntry>();
                for (PhaseFileEntry p : nullSafe(t.phases())) {
                    if (p.id() == null || p.name() == null) {
                        throw new ConfigurationException("Phase template '" + name + "' has a phase without id or name");
                    }
                    entries.add(new PhaseTemplateRegistry.PhaseEntry(p.id(), p.name(), p.description(),
                            p.estimatedDuration(), p.dependencies(), p.artifacts()));
                }
                templates.put(name, new PhaseTemplateRegistry.PhaseTemplate(name, t.description(), entries));
            });
        }
        var registry = new PhaseTemplateRegistry(file.domainMapping(), templates,
                byComplexityKey(location, file.complexityAdjustments()), file.domainPriorities());
        log.info("Loaded {} phase templates from {}", templates.size(), location);
        return registry;
    }

    public TaskTemplateRegistry loadTaskTemplates(String location) {
        TaskTemplatesFile file = read(location, TaskTemplatesFile.class);
        var templates = new LinkedHashMap<PhaseType, List<TaskTemplateRegistry.TaskEntry>>();
        if (file.taskTemplates() != null) {
            file.taskTemplates().forEach((key, t) -> {
                PhaseType type = phaseType(location, key);
                var entries = new ArrayList<TaskTemplateRegistry.TaskEntry>();
                for (TaskFileEntry e : nullSafe(t.tasks())) {
                    if (e.idSuffix() == null || e.name() == null) {
                        throw new ConfigurationException("Task template '" + key + "' has a task without id_suffix or name");
                    }
                    if (e.complexityScore() != null && (e.complexityScore() < 1 || e.complexityScore() > 10)) {
                        throw new ConfigurationException("Task template '" + key + "' entry " + e.idSuffix()
                                + " has complexity " + e.complexityScore() + " outside 1-10");
                    }
                    entries.add(new TaskTemplateRegistry.TaskEntry(e.idSuffix(), e.name(), e.description(),
                            e.estimatedEffort(), e.complexityScore(), e.agentProfile(), e.internalDependencies(),
                            e.artifactsOutput(), e.validationCriteria(), e.humanCheckpoint()));
                }
                templates.put(type, entries);
            });
        }
        var multipliers = new LinkedHashMap<String, Double>();
        if (file.complexityAdjustments() != null) {
            file.complexityAdjustments().forEach((label, adjustment) ->
                    multipliers.put(complexityKey(location, label),
                            adjustment.taskMultiplier() == null ? 1.0 : adjustment.taskMultiplier()));
        }
        PhaseType defaultType = file.defaultPhaseType() == null ? null : phaseType(location, file.defaultPhaseType());
        var registry = new TaskTemplateRegistry(templates, multipliers, defaultType);
        log.info("Loaded task templates for {} phase types from {}", templates.size(), location);
        return registry;
    }

    public ResourceProfileRegistry loadResourceProfiles(String location) {
        ResourceProfilesFile file = read(location, ResourceProfilesFile.class);
        var profiles = new ArrayList<ResourceProfile>();
        if (file.profiles() != null) {
            file.profiles().forEach((name, p) -> {
                List<Integer> range = p.complexityRange() == null ? List.of(1, 10) : p.complexityRange();
                if (range.size() != 2) {
                    throw new ConfigurationException("Profile " + name + " complexity_range must have two bounds");
                }
                profiles.add(new ResourceProfile(name, p.specializations(), range.get(0), range.get(1),
                        p.maxConcurrentTasks() == null ? 3 : p.maxConcurrentTasks(), p.verificationExpertise()));
            });
        }
        var registry = new ResourceProfileRegistry(profiles);
        log.info("Loaded {} resource profiles from {}", registry.size(), location);
        return registry;
    }

    private <T> T read(String location, Class<T> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            T value = objectMapper.readValue(in, type);
            if (value == null) {
                throw new ConfigurationException("Configuration file is empty: " + location);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed JSON in " + location + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + location, e);
        }
    }

    private static Map<String, Double> byComplexityKey(String location, Map<String, Double> adjustments) {
        var result = new LinkedHashMap<String, Double>();
        if (adjustments != null) {
            adjustments.forEach((label, multiplier) -> result.put(complexityKey(location, label), multiplier));
        }
        return result;
    }

    private static String complexityKey(String location, String label) {
        return Complexity.fromLabel(label)
                .map(Complexity::key)
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown complexity level '" + label + "' in " + location));
    }

    private static PhaseType phaseType(String location, String key) {
        return PhaseType.fromKey(key)
                .orElseThrow(() -> new ConfigurationException("Unknown phase type '" + key + "' in " + location));
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    // File shapes

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PhaseTemplatesFile(
        @JsonProperty("domain_mapping") Map<String, String> domainMapping,
        @JsonProperty("templates") Map<String, PhaseFileTemplate> templates,
        @JsonProperty("complexity_adjustments") Map<String, Double> complexityAdjustments,
        @JsonProperty("domain_priorities") Map<String, List<String>> domainPriorities
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PhaseFileTemplate(
        @JsonProperty("description") String description,
        @JsonProperty("phases") List<PhaseFileEntry> phases
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PhaseFileEntry(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("estimated_duration") String estimatedDuration,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("artifacts") List<String> artifacts
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskTemplatesFile(
        @JsonProperty("task_templates") Map<String, TaskFileTemplate> taskTemplates,
        @JsonProperty("complexity_adjustments") Map<String, TaskAdjustment> complexityAdjustments,
        @JsonProperty("default_phase_type") String defaultPhaseType
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskFileTemplate(
        @JsonProperty("description") String description,
        @JsonProperty("tasks") List<TaskFileEntry> tasks
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskFileEntry(
        @JsonProperty("id_suffix") String idSuffix,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("estimated_effort") String estimatedEffort,
        @JsonProperty("complexity_score") Integer complexityScore,
        @JsonProperty("agent_profile") String agentProfile,
        @JsonProperty("internal_dependencies") List<String> internalDependencies,
        @JsonProperty("artifacts_output") List<String> artifactsOutput,
        @JsonProperty("validation_criteria") List<String> validationCriteria,
        @JsonProperty("human_checkpoint") boolean humanCheckpoint
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskAdjustment(
        @JsonProperty("task_multiplier") Double taskMultiplier
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResourceProfilesFile(
        @JsonProperty("profiles") Map<String, ProfileFileEntry> profiles
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProfileFileEntry(
        @JsonProperty("specializations") List<String> specializations,
        @JsonProperty("complexity_range") List<Integer> complexityRange,
        @JsonProperty("max_concurrent_tasks") Integer maxConcurrentTasks,
        @JsonProperty("verification_expertise") boolean verificationExpertise
    ) {}
}
