package com.cmdiag.patterns.model;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Behaviors computed per signature metric; {@code frequencyMatch} is null when the
 * signature declares no frequency.
 */
public record TemplateMatchContext(Map<String, Behavior> behaviors, Boolean frequencyMatch)
        implements OccurrenceContext {

    public TemplateMatchContext {
        behaviors = behaviors != null ? ImmutableMap.copyOf(behaviors) : ImmutableMap.of();
    }
}
