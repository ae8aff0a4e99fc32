package com.strategist.core.config;

import com.strategist.core.model.ResourceProfile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resource profiles in declaration order. The order is significant: it breaks
 * scoring ties during assignment.
 */
public final class ResourceProfileRegistry {

    private final Map<String, ResourceProfile> profiles;

    public ResourceProfileRegistry(List<ResourceProfile> profiles) {
        var byName = new LinkedHashMap<String, ResourceProfile>();
        for (ResourceProfile profile : profiles) {
            if (profile.complexityLow() > profile.complexityHigh()) {
                throw new ConfigurationException("Profile " + profile.name() + " has inverted complexity range ["
                        + profile.complexityLow() + ", " + profile.complexityHigh() + "]");
            }
            if (profile.maxConcurrentTasks() < 1) {
                throw new ConfigurationException("Profile " + profile.name()
                        + " must allow at least one concurrent task, got " + profile.maxConcurrentTasks());
            }
            if (byName.put(profile.name(), profile) != null) {
                throw new ConfigurationException("Duplicate resource profile " + profile.name());
            }
        }
        this.profiles = Collections.unmodifiableMap(byName);
    }

    public List<ResourceProfile> profiles() {
        return List.copyOf(profiles.values());
    }

    public Optional<ResourceProfile> find(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    /**
     * Looks up a profile by a free-form hint: lowercase, spaces and hyphens as underscores.
     */
    public Optional<ResourceProfile> findByHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        return find(hint.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_'));
    }

    public boolean isEmpty() {
        return profiles.isEmpty();
    }

    public int size() {
        return profiles.size();
    }
}
