package com.cmdiag.patterns.service;

import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.discovery.ClusterDiscoverer;
import com.cmdiag.patterns.event.PatternsFoundEvent;
import com.cmdiag.patterns.matching.TemplateCatalog;
import com.cmdiag.patterns.matching.TemplateMatcher;
import com.cmdiag.patterns.metrics.MetricSample;
import com.cmdiag.patterns.metrics.TimeRange;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternTemplate;
import com.cmdiag.patterns.ranking.PatternDeduplicator;
import com.cmdiag.patterns.sequence.SequenceAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Full detection pipeline over one sample series.
 *
 * Flow:
 * 1. Snapshot the template catalog
 * 2. Keep samples inside the time range
 * 3. Match every template (each isolated from the others)
 * 4. Cluster discovery
 * 5. Sequence and anomaly analysis
 * 6. Deduplicate and rank
 * 7. Publish PatternsFoundEvent
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatternRecognizer {

    private final PatternEngineProperties properties;
    private final TemplateCatalog catalog;
    private final TemplateMatcher templateMatcher;
    private final ClusterDiscoverer clusterDiscoverer;
    private final SequenceAnalyzer sequenceAnalyzer;
    private final PatternDeduplicator deduplicator;
    private final ApplicationEventPublisher eventPublisher;

    public List<Pattern> findPatterns(List<MetricSample> samples, TimeRange timeRange) {
        checkNotNull(samples, "samples");
        checkNotNull(timeRange, "timeRange");

        List<PatternTemplate> templates = catalog.snapshot();

        List<MetricSample> inRange = samples.stream()
                .filter(s -> timeRange.contains(s.getTimestamp()))
                .collect(Collectors.toList());

        if (inRange.size() < properties.getDiscovery().getMinSamples()) {
            log.debug("Only {} samples in range, skipping scan", inRange.size());
            eventPublisher.publishEvent(new PatternsFoundEvent(0, timeRange));
            return List.of();
        }

        List<Pattern> found = new ArrayList<>();

        for (PatternTemplate template : templates) {
            try {
                Pattern match = templateMatcher.matchTemplate(template, inRange);
                if (match.getConfidence() >= template.getMinConfidence()) {
                    found.add(match);
                }
            } catch (RuntimeException e) {
                log.warn("Template {} failed: {}", template.getId(), e.getMessage());
            }
        }
        int templateMatches = found.size();

        found.addAll(clusterDiscoverer.discover(inRange));
        found.addAll(sequenceAnalyzer.analyze(inRange));

        List<Pattern> ranked = deduplicator.deduplicateAndRank(found);

        log.info("Scan over {} samples: {} template matches, {} patterns after dedup",
                inRange.size(), templateMatches, ranked.size());

        eventPublisher.publishEvent(new PatternsFoundEvent(ranked.size(), timeRange));
        return ranked;
    }

    /**
     * Match a single template without applying its minimum confidence.
     */
    public Pattern matchTemplate(PatternTemplate template, List<MetricSample> samples) {
        checkNotNull(template, "template");
        checkNotNull(samples, "samples");
        return templateMatcher.matchTemplate(template, samples);
    }
}
