package com.cmdiag.patterns.model;

public record SequenceContext(int startIndex, int sequenceLength) implements OccurrenceContext {
}
