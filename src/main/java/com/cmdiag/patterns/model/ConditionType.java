package com.cmdiag.patterns.model;

/**
 * Boolean combinator of a composite condition.
 */
public enum ConditionType {
    AND,
    OR,

    /**
     * True iff none of the children holds (negated OR, not single-child negation).
     */
    NOT
}
