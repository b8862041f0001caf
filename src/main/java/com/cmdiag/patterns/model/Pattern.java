package com.cmdiag.patterns.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Output unit of a detection run. Immutable; merging produces a new instance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Pattern {

    String id;
    String name;
    String description;
    PatternType type;
    PatternSignature signature;

    @Singular
    List<PatternOccurrence> occurrences;

    /**
     * Confidence in [0, 1].
     */
    double confidence;

    ImpactLevel impact;

    @JsonIgnore
    public int getOccurrenceCount() {
        return occurrences.size();
    }

    /**
     * Copy of this pattern with {@code other}'s occurrences appended and the
     * higher of the two confidences.
     */
    public Pattern mergeWith(Pattern other) {
        return toBuilder()
                .occurrences(other.getOccurrences())
                .confidence(Math.max(confidence, other.getConfidence()))
                .build();
    }

    /**
     * Get confidence as percentage string.
     */
    @JsonIgnore
    public String getConfidencePercent() {
        return String.format("%.0f%%", confidence * 100);
    }

    public static class PatternBuilder {
        public PatternBuilder confidence(double confidence) {
            this.confidence = Scores.clamp(confidence);
            return this;
        }
    }
}
