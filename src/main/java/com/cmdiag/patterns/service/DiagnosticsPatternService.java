package com.cmdiag.patterns.service;

import com.cmdiag.patterns.metrics.MetricSample;
import com.cmdiag.patterns.metrics.MetricSampleBuffer;
import com.cmdiag.patterns.metrics.TimeRange;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternOccurrence;
import com.cmdiag.patterns.registry.PatternRegistry;
import com.cmdiag.patterns.registry.PatternStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Entry point for host code: buffers telemetry per system and runs
 * recognition against the buffered series.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiagnosticsPatternService {

    private final MetricSampleBuffer buffer;
    private final PatternRecognizer recognizer;
    private final PatternRegistry registry;

    public void ingestMetrics(Collection<MetricSample> samples) {
        buffer.ingest(samples);
    }

    public List<Pattern> findPatterns(String systemId, TimeRange timeRange) {
        List<MetricSample> samples = buffer.getSamples(systemId);
        log.debug("Finding patterns for {} over {} buffered samples", systemId, samples.size());
        return recognizer.findPatterns(samples, timeRange);
    }

    public List<PatternOccurrence> matchPattern(String systemId, Pattern pattern) {
        return registry.matchPattern(pattern, buffer.getSamples(systemId));
    }

    public void registerPattern(Pattern pattern) {
        registry.registerPattern(pattern);
    }

    public PatternStatistics getStatistics() {
        return registry.getStatistics();
    }

    public Set<String> getSystemIds() {
        return buffer.getSystemIds();
    }

    public int getSampleCount(String systemId) {
        return buffer.size(systemId);
    }
}
