package com.cmdiag.patterns.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * One concrete window, cluster member or sub-sequence where a signature matched.
 */
@Value
@Builder
@Jacksonized
public class PatternOccurrence {

    LocalDateTime timestamp;
    String systemId;

    /**
     * Match score in [0, 1].
     */
    double matchScore;

    OccurrenceContext context;

    public static class PatternOccurrenceBuilder {
        public PatternOccurrenceBuilder matchScore(double matchScore) {
            this.matchScore = Scores.clamp(matchScore);
            return this;
        }
    }
}
