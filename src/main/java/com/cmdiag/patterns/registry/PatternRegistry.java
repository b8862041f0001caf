package com.cmdiag.patterns.registry;

import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.event.PatternRegisteredEvent;
import com.cmdiag.patterns.matching.TemplateCatalog;
import com.cmdiag.patterns.matching.TemplateMatcher;
import com.cmdiag.patterns.metrics.MetricSample;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternOccurrence;
import com.cmdiag.patterns.model.PatternTemplate;
import com.cmdiag.patterns.model.PatternType;
import com.google.common.collect.ImmutableMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Confirmed patterns, kept for the lifetime of the process.
 *
 * High-confidence registrations are promoted into the template catalog so
 * later scans look for them like any built-in signature.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PatternRegistry {

    private final PatternEngineProperties properties;
    private final TemplateCatalog catalog;
    private final TemplateMatcher templateMatcher;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    /**
     * Store the pattern by id, replacing an earlier one with the same id.
     * A pattern with confidence above the promotion threshold becomes a
     * template whose minimum confidence is a fraction of its own.
     */
    public void registerPattern(Pattern pattern) {
        checkNotNull(pattern, "pattern");
        checkNotNull(pattern.getId(), "pattern id");

        patterns.put(pattern.getId(), pattern);

        PatternEngineProperties.Registry config = properties.getRegistry();
        if (pattern.getConfidence() > config.getPromotionThreshold()) {
            catalog.add(PatternTemplate.builder()
                    .id(pattern.getId())
                    .name(pattern.getName())
                    .description(pattern.getDescription())
                    .type(pattern.getType())
                    .signature(pattern.getSignature())
                    .minConfidence(pattern.getConfidence() * config.getMinConfidenceFactor())
                    .build());
            log.info("Promoted pattern {} to template (catalog version {})", pattern.getId(), catalog.version());
        }

        eventPublisher.publishEvent(new PatternRegisteredEvent(pattern));
    }

    /**
     * Every window of the series where the pattern's signature holds,
     * evaluated at every start position. The catalog is not touched.
     */
    public List<PatternOccurrence> matchPattern(Pattern pattern, List<MetricSample> samples) {
        checkNotNull(pattern, "pattern");
        checkNotNull(samples, "samples");

        if (pattern.getSignature() == null) {
            return List.of();
        }
        return templateMatcher.findOccurrences(pattern.getSignature(), samples, 1);
    }

    public Optional<Pattern> getPattern(String id) {
        return Optional.ofNullable(patterns.get(id));
    }

    /**
     * Registered patterns ordered by id.
     */
    public List<Pattern> getAllPatterns() {
        List<Pattern> all = new ArrayList<>(patterns.values());
        all.sort(Comparator.comparing(Pattern::getId));
        return all;
    }

    public PatternStatistics getStatistics() {
        Map<PatternType, Long> byType = new EnumMap<>(PatternType.class);
        for (Pattern pattern : patterns.values()) {
            if (pattern.getType() != null) {
                byType.merge(pattern.getType(), 1L, Long::sum);
            }
        }

        return new PatternStatistics(
                patterns.size(),
                ImmutableMap.copyOf(byType),
                catalog.size(),
                catalog.version());
    }
}
