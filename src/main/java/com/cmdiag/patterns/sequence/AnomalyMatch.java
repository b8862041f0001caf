package com.cmdiag.patterns.sequence;

/**
 * A span whose statistics drift away from the baseline.
 */
public record AnomalyMatch(int start, int length, double score) {

    public int end() {
        return start + length;
    }
}
