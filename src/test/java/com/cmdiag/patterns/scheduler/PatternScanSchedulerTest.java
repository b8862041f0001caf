package com.cmdiag.patterns.scheduler;

import com.cmdiag.patterns.BaseIntegrationTest;
import com.cmdiag.patterns.matching.TemplateCatalog;
import com.cmdiag.patterns.metrics.TimeRange;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternTemplate;
import com.cmdiag.patterns.registry.PatternRegistry;
import com.cmdiag.patterns.service.DiagnosticsPatternService;
import com.cmdiag.patterns.support.SampleFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("PatternScanScheduler Tests")
@TestPropertySource(properties = {
        "pattern.scan.enabled=true",
        "pattern.scan.auto-register=true",
        "pattern.scan.interval-ms=3600000"
})
class PatternScanSchedulerTest extends BaseIntegrationTest {

    @Autowired
    private PatternScanScheduler scheduler;

    @Autowired
    private DiagnosticsPatternService patternService;

    @Autowired
    private PatternRegistry registry;

    @Autowired
    private TemplateCatalog catalog;

    @Test
    @DisplayName("Scan registers high-confidence patterns of every buffered system")
    void scanAutoRegisters() {
        patternService.ingestMetrics(SampleFixtures.memoryLeak(200, "cm-scan-01"));

        scheduler.scanAllSystems();

        assertThat(registry.getAllPatterns())
                .extracting(Pattern::getName)
                .contains("Memory Leak Pattern");
        assertThat(registry.getAllPatterns())
                .allMatch(p -> p.getConfidence() > 0.8);
    }

    @Test
    @DisplayName("Rescanning a sliding window replaces earlier promotions")
    void slidingWindowKeepsIds() {
        String systemId = "cm-scan-02";
        patternService.ingestMetrics(SampleFixtures.memoryLeak(200, systemId));
        LocalDateTime end = SampleFixtures.START.plusDays(1);

        scheduler.scanSystem(systemId, new TimeRange(SampleFixtures.START, end));
        scheduler.scanSystem(systemId, new TimeRange(SampleFixtures.START.plusMinutes(10), end));

        String leakId = "auto-cm-scan-02-memory-leak-pattern";
        assertThat(registry.getAllPatterns())
                .filteredOn(p -> p.getId().startsWith("auto-" + systemId))
                .extracting(Pattern::getId)
                .containsOnlyOnce(leakId);
        assertThat(catalog.snapshot())
                .filteredOn(t -> t.getName().equals("Memory Leak Pattern"))
                .extracting(PatternTemplate::getId)
                .containsOnlyOnce(leakId);
    }

    @Test
    @DisplayName("Systems with too few samples are skipped")
    void sparseSystemSkipped() {
        patternService.ingestMetrics(SampleFixtures.series(5, (i, b) -> b.systemId("cm-sparse")));

        assertThatCode(() -> scheduler.scanAllSystems()).doesNotThrowAnyException();
        assertThat(scheduler.scanSystem("cm-sparse", null)).isZero();
    }
}
