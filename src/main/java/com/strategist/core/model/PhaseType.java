package com.strategist.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Normalized phase categories that task templates are keyed by.
 */
public enum PhaseType {
    DESIGN,
    BACKEND,
    FRONTEND,
    INTEGRATION,
    TESTING,
    DEPLOYMENT;

    /** Template registry key, e.g. "backend". */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PhaseType> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (PhaseType type : values()) {
            if (type.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
