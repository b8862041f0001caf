package com.cmdiag.patterns.model;

import java.util.List;

public record CompositeCondition(ConditionType type, List<PatternCondition> children) implements PatternCondition {

    public CompositeCondition {
        children = children != null ? List.copyOf(children) : List.of();
    }
}
