package com.cmdiag.patterns.sequence;

/**
 * A sub-sequence that repeats later in the series.
 */
public record SequenceMatch(int start, int length, double similarity) {

    public int end() {
        return start + length;
    }
}
