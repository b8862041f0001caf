package com.cmdiag.patterns.scheduler;

import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.metrics.TimeRange;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternIds;
import com.cmdiag.patterns.service.DiagnosticsPatternService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Background scan of every buffered system.
 *
 * Flow:
 * 1. Samples ingested (by DiagnosticsPatternService)
 * 2. Each system scanned over the lookback window (this scheduler)
 * 3. Optionally, high-confidence patterns registered
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "pattern.scan", name = "enabled", havingValue = "true")
public class PatternScanScheduler {

    private final DiagnosticsPatternService patternService;
    private final PatternEngineProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${pattern.scan.interval-ms:900000}")
    public void scanAllSystems() {
        try {
            PatternEngineProperties.Scan config = properties.getScan();
            TimeRange range = TimeRange.lastMinutes(LocalDateTime.now(clock), config.getLookbackMinutes());

            log.info("Running scheduled pattern scan...");
            int total = 0;

            for (String systemId : patternService.getSystemIds()) {
                try {
                    total += scanSystem(systemId, range);
                } catch (Exception e) {
                    log.warn("Pattern scan failed for system {}: {}", systemId, e.getMessage());
                }
            }

            log.info("Pattern scan complete: {} patterns", total);
        } catch (Exception e) {
            log.error("Error during pattern scan: {}", e.getMessage(), e);
        }
    }

    int scanSystem(String systemId, TimeRange range) {
        if (patternService.getSampleCount(systemId) < properties.getScan().getMinSamples()) {
            log.debug("System {}: not enough samples, skipping", systemId);
            return 0;
        }

        List<Pattern> patterns = patternService.findPatterns(systemId, range);

        if (properties.getScan().isAutoRegister()) {
            double threshold = properties.getRegistry().getPromotionThreshold();
            // keyed by name so a sliding window replaces earlier promotions
            patterns.stream()
                    .filter(p -> p.getConfidence() > threshold)
                    .map(p -> p.toBuilder().id(PatternIds.scoped(systemId, p.getName())).build())
                    .forEach(patternService::registerPattern);
        }

        log.debug("System {}: {} patterns", systemId, patterns.size());
        return patterns.size();
    }
}
