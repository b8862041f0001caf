package com.cmdiag.patterns.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Expected recurrence shape of the samples inside a window.
 */
@Value
@Builder
@Jacksonized
public class PatternFrequency {

    FrequencyType type;

    /** Minutes */
    Double interval;

    /** Allowed deviation in minutes; defaults to a fraction of the interval */
    Double variance;
}
