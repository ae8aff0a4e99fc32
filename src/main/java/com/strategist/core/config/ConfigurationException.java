package com.strategist.core.config;

/**
 * Thrown when a template or resource-profile registry is missing or malformed.
 * Always fatal: the planner cannot run without valid configuration.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
