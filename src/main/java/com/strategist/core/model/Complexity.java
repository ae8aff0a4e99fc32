package com.strategist.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Project complexity levels. Each level has a canonical configuration key and
 * accepts the Spanish labels emitted by the upstream classifier.
 */
public enum Complexity {
    LOW("low", "baja"),
    MEDIUM("medium", "media"),
    HIGH("high", "alta"),
    VERY_HIGH("very_high", "muy_alta");

    private final String key;
    private final String alias;

    Complexity(String key, String alias) {
        this.key = key;
        this.alias = alias;
    }

    /** Key used by the template registries' complexity adjustment tables. */
    public String key() {
        return key;
    }

    /**
     * Parses a complexity label case-insensitively. Spaces and hyphens are
     * treated as underscores, so "Very High" and "muy-alta" both resolve.
     *
     * @return the level, or empty for a blank or unknown label
     */
    public static Optional<Complexity> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (Complexity level : values()) {
            if (level.key.equals(normalized) || level.alias.equals(normalized)
                    || level.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
