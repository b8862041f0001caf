package com.cmdiag.patterns.registry;

import com.cmdiag.patterns.model.PatternType;

import java.util.Map;

/**
 * Snapshot of registry and catalog sizes.
 */
public record PatternStatistics(
        int registeredPatterns,
        Map<PatternType, Long> patternsByType,
        int templateCount,
        long catalogVersion
) {
}
