package com.cmdiag.patterns.model;

public enum FrequencyType {
    /** Mean inter-sample gap close to the interval */
    RECURRING,
    /** Every gap close to a multiple of the interval */
    PERIODIC,
    /** Gaps vary widely relative to their mean */
    SPORADIC
}
