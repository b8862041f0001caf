package com.cmdiag.patterns.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Expected behavior of one metric inside a signature.
 */
@Value
@Builder
@Jacksonized
public class MetricPattern {

    String metric;
    Behavior behavior;

    /**
     * Optional: the window maximum must reach this value.
     */
    Double threshold;

    /**
     * Optional: expected mean change per sample. Only adds a bonus to the score.
     */
    Double rate;
}
