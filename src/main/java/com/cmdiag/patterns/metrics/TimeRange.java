package com.cmdiag.patterns.metrics;

import java.time.LocalDateTime;

/**
 * Analysis window bound, inclusive on both ends.
 */
public record TimeRange(LocalDateTime start, LocalDateTime end) {

    public boolean contains(LocalDateTime timestamp) {
        if (timestamp == null) {
            return false;
        }
        return !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }

    public static TimeRange lastMinutes(LocalDateTime end, int minutes) {
        return new TimeRange(end.minusMinutes(minutes), end);
    }
}
