package com.strategist.core.graph;

import java.util.List;

/**
 * Thrown when planning input is rejected before any computation: unknown
 * dependency references, duplicate identifiers, or a missing upstream result.
 */
public class PlanValidationException extends RuntimeException {

    private final List<String> offendingIds;

    public PlanValidationException(String message) {
        this(message, List.of());
    }

    public PlanValidationException(String message, List<String> offendingIds) {
        super(message);
        this.offendingIds = List.copyOf(offendingIds);
    }

    public List<String> getOffendingIds() {
        return offendingIds;
    }
}
