package com.cmdiag.patterns.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Diagnostic detail attached to an occurrence, one variant per producer.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "source")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TemplateMatchContext.class, name = "template"),
        @JsonSubTypes.Type(value = ClusterContext.class, name = "cluster"),
        @JsonSubTypes.Type(value = SequenceContext.class, name = "sequence"),
        @JsonSubTypes.Type(value = AnomalyContext.class, name = "anomaly")
})
public interface OccurrenceContext {
}
