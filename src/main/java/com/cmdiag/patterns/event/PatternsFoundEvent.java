package com.cmdiag.patterns.event;

import com.cmdiag.patterns.metrics.TimeRange;

/**
 * Published after every scan, including scans with too few samples.
 */
public record PatternsFoundEvent(int count, TimeRange timeRange) {
}
