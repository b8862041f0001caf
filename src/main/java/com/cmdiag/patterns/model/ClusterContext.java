package com.cmdiag.patterns.model;

public record ClusterContext(String clusterId, ClusterMethod method) implements OccurrenceContext {
}
