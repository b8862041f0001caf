package com.cmdiag.patterns;

import com.cmdiag.patterns.event.PatternRegisteredEvent;
import com.cmdiag.patterns.event.PatternsFoundEvent;
import com.cmdiag.patterns.matching.TemplateCatalog;
import com.cmdiag.patterns.metrics.TimeRange;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternOccurrence;
import com.cmdiag.patterns.registry.PatternStatistics;
import com.cmdiag.patterns.scheduler.PatternScanScheduler;
import com.cmdiag.patterns.service.DiagnosticsPatternService;
import com.cmdiag.patterns.support.SampleFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Pattern Engine Integration Tests")
@RecordApplicationEvents
class PatternEngineIntegrationTest extends BaseIntegrationTest {

    private static final TimeRange FIXTURE_DAY =
            new TimeRange(SampleFixtures.START, SampleFixtures.START.plusDays(1));

    @Autowired
    private DiagnosticsPatternService patternService;

    @Autowired
    private TemplateCatalog catalog;

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ApplicationEvents events;

    @Test
    @DisplayName("Context starts with the built-in catalog and no background scan")
    void contextLoads() {
        assertThat(catalog.find(TemplateCatalog.MEMORY_LEAK)).isPresent();
        assertThat(context.getBeanProvider(PatternScanScheduler.class).getIfAvailable()).isNull();
    }

    @Test
    @DisplayName("Buffered memory leak is found and announced")
    void findsBufferedMemoryLeak() {
        patternService.ingestMetrics(SampleFixtures.memoryLeak(200, "cm-it-find"));

        List<Pattern> patterns = patternService.findPatterns("cm-it-find", FIXTURE_DAY);

        assertThat(patterns).extracting(Pattern::getName).contains("Memory Leak Pattern");
        assertThat(events.stream(PatternsFoundEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.count()).isEqualTo(patterns.size()));
    }

    @Test
    @DisplayName("Registered pattern is promoted, announced and can be matched")
    void registerAndMatch() {
        patternService.ingestMetrics(SampleFixtures.memoryLeak(200, "cm-it-register"));
        Pattern leak = patternService.findPatterns("cm-it-register", FIXTURE_DAY).stream()
                .filter(p -> "Memory Leak Pattern".equals(p.getName()))
                .findFirst()
                .orElseThrow();

        patternService.registerPattern(leak);

        PatternStatistics stats = patternService.getStatistics();
        assertThat(stats.registeredPatterns()).isGreaterThanOrEqualTo(1);
        assertThat(catalog.find(leak.getId())).isPresent();
        assertThat(events.stream(PatternRegisteredEvent.class)).hasSize(1);

        List<PatternOccurrence> occurrences = patternService.matchPattern("cm-it-register", leak);
        assertThat(occurrences).isNotEmpty();
    }
}
