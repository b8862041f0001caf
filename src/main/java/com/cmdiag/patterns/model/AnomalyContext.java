package com.cmdiag.patterns.model;

public record AnomalyContext(int startIndex, int length, double anomalyScore) implements OccurrenceContext {
}
