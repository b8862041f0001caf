package com.cmdiag.patterns.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Node of a boolean condition tree: either a metric comparison leaf or an
 * AND/OR/NOT composite over child nodes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LeafCondition.class, name = "leaf"),
        @JsonSubTypes.Type(value = CompositeCondition.class, name = "composite")
})
public interface PatternCondition {

    static LeafCondition leaf(String metric, ConditionOperator operator, double value) {
        return new LeafCondition(metric, operator, value);
    }

    static CompositeCondition and(PatternCondition... children) {
        return new CompositeCondition(ConditionType.AND, List.of(children));
    }

    static CompositeCondition or(PatternCondition... children) {
        return new CompositeCondition(ConditionType.OR, List.of(children));
    }

    static CompositeCondition not(PatternCondition... children) {
        return new CompositeCondition(ConditionType.NOT, List.of(children));
    }
}
