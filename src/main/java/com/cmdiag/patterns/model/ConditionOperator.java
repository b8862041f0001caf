package com.cmdiag.patterns.model;

/**
 * Comparison applied to a metric's window mean.
 */
public enum ConditionOperator {
    GT,
    LT,
    GTE,
    LTE,
    /** Equal within the configured absolute tolerance */
    EQ,
    /** Differs by at least the configured absolute tolerance */
    NE
}
