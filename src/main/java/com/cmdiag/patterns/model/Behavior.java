package com.cmdiag.patterns.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trend shape of a numeric series.
 */
public enum Behavior {

    INCREASE("increase"),
    DECREASE("decrease"),
    STABLE("stable"),

    /**
     * Dispersion dominates the trend (coefficient of variation above the limit).
     */
    OSCILLATING("oscillating");

    private final String label;

    Behavior(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Behavior fromLabel(String label) {
        for (Behavior behavior : values()) {
            if (behavior.label.equalsIgnoreCase(label) || behavior.name().equalsIgnoreCase(label)) {
                return behavior;
            }
        }
        throw new IllegalArgumentException("Unknown behavior: " + label);
    }
}
