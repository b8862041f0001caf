package com.cmdiag.patterns.metrics;

import com.cmdiag.patterns.config.PatternEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory per-system buffer of ingested samples.
 *
 * Each system keeps at most {@code pattern.buffer.max-samples-per-system} samples
 * (oldest dropped first) and samples older than the retention period are purged
 * on every ingest. Nothing here survives a restart.
 */
@Component
@Slf4j
public class MetricSampleBuffer {

    private final PatternEngineProperties properties;
    private final Clock clock;
    private final Map<String, List<MetricSample>> buffers = new ConcurrentHashMap<>();

    public MetricSampleBuffer(PatternEngineProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public void ingest(Collection<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return;
        }

        int maxSize = properties.getBuffer().getMaxSamplesPerSystem();
        for (MetricSample sample : samples) {
            if (sample == null || sample.getSystemId() == null) {
                log.debug("Skipping sample without system id");
                continue;
            }

            List<MetricSample> buffer = buffers.computeIfAbsent(sample.getSystemId(), k -> new ArrayList<>());
            synchronized (buffer) {
                buffer.add(sample);
                if (buffer.size() > maxSize) {
                    buffer.subList(0, buffer.size() - maxSize).clear();
                }
            }
        }

        cleanOldData();
    }

    /**
     * Drop samples older than the retention period.
     */
    public void cleanOldData() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(properties.getBuffer().getRetentionDays());

        buffers.forEach((systemId, buffer) -> {
            synchronized (buffer) {
                int before = buffer.size();
                buffer.removeIf(s -> s.getTimestamp() == null || !s.getTimestamp().isAfter(cutoff));
                if (buffer.size() < before) {
                    log.debug("Purged {} expired samples for system {}", before - buffer.size(), systemId);
                }
            }
        });
    }

    /**
     * Buffered samples for a system in timestamp order.
     */
    public List<MetricSample> getSamples(String systemId) {
        List<MetricSample> buffer = buffers.get(systemId);
        if (buffer == null) {
            return List.of();
        }

        List<MetricSample> copy;
        synchronized (buffer) {
            copy = new ArrayList<>(buffer);
        }
        copy.sort(Comparator.comparing(MetricSample::getTimestamp));
        return copy;
    }

    public Set<String> getSystemIds() {
        return new TreeSet<>(buffers.keySet());
    }

    public int size(String systemId) {
        List<MetricSample> buffer = buffers.get(systemId);
        if (buffer == null) {
            return 0;
        }
        synchronized (buffer) {
            return buffer.size();
        }
    }
}
