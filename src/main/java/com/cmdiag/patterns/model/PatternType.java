package com.cmdiag.patterns.model;

/**
 * Category of a detected pattern.
 */
public enum PatternType {
    PERFORMANCE,
    ERROR,
    USAGE,
    SECURITY,
    WORKFLOW
}
