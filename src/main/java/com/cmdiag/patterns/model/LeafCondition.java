package com.cmdiag.patterns.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Compares the window mean of {@code metric} against {@code value}.
 * Any null field makes the leaf malformed; malformed leaves evaluate false.
 */
public record LeafCondition(String metric, ConditionOperator operator, Double value) implements PatternCondition {

    @JsonIgnore
    public boolean isWellFormed() {
        return metric != null && operator != null && value != null;
    }
}
