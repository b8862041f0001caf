package com.cmdiag.patterns.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structural description of a pattern: metric behaviors, boolean conditions,
 * window size (in samples) and optional recurrence shape.
 */
@Value
@Builder
@Jacksonized
public class PatternSignature {

    @Singular
    List<MetricPattern> metrics;

    @Singular
    List<PatternCondition> conditions;

    Integer timeWindow;

    PatternFrequency frequency;

    public int getEffectiveTimeWindow(int defaultWindow) {
        return timeWindow != null && timeWindow > 0 ? timeWindow : defaultWindow;
    }
}
