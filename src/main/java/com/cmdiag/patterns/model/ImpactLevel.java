package com.cmdiag.patterns.model;

/**
 * Qualitative severity derived from pattern type, confidence and occurrence count.
 */
public enum ImpactLevel {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String displayName;

    ImpactLevel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
