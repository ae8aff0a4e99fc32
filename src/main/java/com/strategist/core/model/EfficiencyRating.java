package com.strategist.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Efficiency label for a resource profile's utilization percentage.
 */
public enum EfficiencyRating {
    UNDER_UTILIZED("under-utilized"),
    OPTIMAL("optimal"),
    GOOD("good"),
    OVER_UTILIZED("over-utilized");

    private final String label;

    EfficiencyRating(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Below 60 is under-utilized, above 90 over-utilized, 70-85 optimal, anything else good. */
    public static EfficiencyRating of(double utilizationPercent) {
        if (utilizationPercent < 60) return UNDER_UTILIZED;
        if (utilizationPercent > 90) return OVER_UTILIZED;
        if (utilizationPercent >= 70 && utilizationPercent <= 85) return OPTIMAL;
        return GOOD;
    }
}
