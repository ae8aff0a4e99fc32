package com.strategist.core.config;

import com.strategist.core.model.Complexity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable phase-template registry: domain to template name, template name to
 * phase entries, complexity multipliers and per-domain priority phases.
 */
public final class PhaseTemplateRegistry {

    public static final String DEFAULT_TEMPLATE = "default";

    /**
     * One phase as declared in a template, before complexity adjustment.
     */
    public record PhaseEntry(
        String id,
        String name,
        String description,
        String estimatedDuration,
        List<String> dependencies,
        List<String> artifacts
    ) {
        public PhaseEntry {
            dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
            artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        }
    }

    public record PhaseTemplate(String name, String description, List<PhaseEntry> phases) {
        public PhaseTemplate {
            phases = phases == null ? List.of() : List.copyOf(phases);
        }
    }

    private final Map<String, String> domainMapping;
    private final Map<String, PhaseTemplate> templates;
    private final Map<String, Double> complexityAdjustments;
    private final Map<String, List<String>> domainPriorities;

    public PhaseTemplateRegistry(Map<String, String> domainMapping,
                                 Map<String, PhaseTemplate> templates,
                                 Map<String, Double> complexityAdjustments,
                                 Map<String, List<String>> domainPriorities) {
        if (templates == null || !templates.containsKey(DEFAULT_TEMPLATE)) {
            throw new ConfigurationException("Phase template registry has no '" + DEFAULT_TEMPLATE + "' template");
        }
        this.domainMapping = lowercaseKeys(domainMapping);
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        this.complexityAdjustments = lowercaseKeys(complexityAdjustments);
        this.domainPriorities = lowercaseKeys(domainPriorities);
    }

    /**
     * Resolves the template name for a domain. Unknown or blank domains, and
     * domains mapped to a template that does not exist, fall back to {@code default}.
     */
    public String templateNameFor(String domain) {
        if (domain == null || domain.isBlank()) {
            return DEFAULT_TEMPLATE;
        }
        String mapped = domainMapping.get(domain.trim().toLowerCase(Locale.ROOT));
        return mapped != null && templates.containsKey(mapped) ? mapped : DEFAULT_TEMPLATE;
    }

    public PhaseTemplate template(String name) {
        return templates.getOrDefault(name, templates.get(DEFAULT_TEMPLATE));
    }

    /** Duration multiplier for a complexity level; 1.0 when the level is unknown or not configured. */
    public double multiplierFor(Optional<Complexity> complexity) {
        return complexity.map(c -> complexityAdjustments.getOrDefault(c.key(), 1.0)).orElse(1.0);
    }

    public List<String> priorityPhasesFor(String domain) {
        if (domain == null) {
            return List.of();
        }
        return domainPriorities.getOrDefault(domain.trim().toLowerCase(Locale.ROOT), List.of());
    }

    public Map<String, String> domainMapping() {
        return domainMapping;
    }

    public Map<String, PhaseTemplate> templates() {
        return templates;
    }

    private static <V> Map<String, V> lowercaseKeys(Map<String, V> source) {
        var result = new LinkedHashMap<String, V>();
        if (source != null) {
            source.forEach((k, v) -> result.put(k.toLowerCase(Locale.ROOT), v));
        }
        return Collections.unmodifiableMap(result);
    }
}
