package com.cmdiag.patterns.registry;

import com.cmdiag.patterns.analysis.BehaviorClassifier;
import com.cmdiag.patterns.analysis.ConditionEvaluator;
import com.cmdiag.patterns.analysis.FrequencyEvaluator;
import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.event.PatternRegisteredEvent;
import com.cmdiag.patterns.matching.TemplateCatalog;
import com.cmdiag.patterns.matching.TemplateMatcher;
import com.cmdiag.patterns.metrics.MetricNames;
import com.cmdiag.patterns.model.Behavior;
import com.cmdiag.patterns.model.ImpactLevel;
import com.cmdiag.patterns.model.MetricPattern;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternOccurrence;
import com.cmdiag.patterns.model.PatternSignature;
import com.cmdiag.patterns.model.PatternTemplate;
import com.cmdiag.patterns.model.PatternType;
import com.cmdiag.patterns.ranking.ImpactAssessor;
import com.cmdiag.patterns.support.SampleFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PatternRegistry Tests")
class PatternRegistryTest {

    private TemplateCatalog catalog;
    private PatternRegistry registry;
    private List<Object> events;

    @BeforeEach
    void setUp() {
        PatternEngineProperties properties = new PatternEngineProperties();
        catalog = new TemplateCatalog();
        catalog.init();
        TemplateMatcher matcher = new TemplateMatcher(properties,
                new BehaviorClassifier(properties),
                new ConditionEvaluator(properties),
                new FrequencyEvaluator(properties),
                new ImpactAssessor(properties));
        events = new ArrayList<>();
        registry = new PatternRegistry(properties, catalog, matcher, events::add);
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("High confidence pattern is promoted to a template")
        void promotesHighConfidence() {
            registry.registerPattern(pattern("learned-cpu", 0.85));

            PatternTemplate template = catalog.find("learned-cpu").orElseThrow();
            assertEquals(0.68, template.getMinConfidence(), 1e-9);
            assertEquals("Learned learned-cpu", template.getName());
            assertEquals(7, catalog.size());
        }

        @Test
        @DisplayName("Low confidence pattern is stored but not promoted")
        void keepsLowConfidence() {
            long version = catalog.version();

            registry.registerPattern(pattern("learned-cpu", 0.5));

            assertTrue(registry.getPattern("learned-cpu").isPresent());
            assertFalse(catalog.find("learned-cpu").isPresent());
            assertEquals(version, catalog.version());
        }

        @Test
        @DisplayName("Exactly the threshold is not promoted")
        void thresholdIsExclusive() {
            registry.registerPattern(pattern("edge", 0.8));
            assertFalse(catalog.find("edge").isPresent());
        }

        @Test
        @DisplayName("Re-registering replaces the pattern and its template")
        void reRegister() {
            registry.registerPattern(pattern("learned-cpu", 0.85));
            registry.registerPattern(pattern("learned-cpu", 0.95));

            assertEquals(0.95, registry.getPattern("learned-cpu").orElseThrow().getConfidence(), 1e-9);
            assertEquals(0.76, catalog.find("learned-cpu").orElseThrow().getMinConfidence(), 1e-9);
            assertEquals(7, catalog.size());
            assertEquals(1, registry.getAllPatterns().size());
        }

        @Test
        @DisplayName("Each registration publishes an event")
        void publishesEvent() {
            Pattern pattern = pattern("learned-cpu", 0.5);

            registry.registerPattern(pattern);

            assertEquals(1, events.size());
            assertSame(pattern, ((PatternRegisteredEvent) events.get(0)).pattern());
        }

        @Test
        @DisplayName("Null pattern is rejected")
        void rejectsNull() {
            assertThatThrownBy(() -> registry.registerPattern(null))
                    .isInstanceOf(NullPointerException.class);
            assertTrue(events.isEmpty());
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("Statistics count patterns per type and report the catalog")
        void statistics() {
            registry.registerPattern(pattern("a", 0.9));
            registry.registerPattern(pattern("b", 0.4));
            registry.registerPattern(pattern("c", 0.4).toBuilder().type(PatternType.SECURITY).build());

            PatternStatistics stats = registry.getStatistics();

            assertEquals(3, stats.registeredPatterns());
            assertEquals(2L, stats.patternsByType().get(PatternType.PERFORMANCE));
            assertEquals(1L, stats.patternsByType().get(PatternType.SECURITY));
            assertEquals(7, stats.templateCount());
            assertEquals(catalog.version(), stats.catalogVersion());
        }

        @Test
        @DisplayName("All patterns are listed by id")
        void allPatterns() {
            registry.registerPattern(pattern("b", 0.4));
            registry.registerPattern(pattern("a", 0.4));

            assertThat(registry.getAllPatterns()).extracting(Pattern::getId).containsExactly("a", "b");
            assertFalse(registry.getPattern("missing").isPresent());
        }

        @Test
        @DisplayName("Matching a pattern checks every start position without touching the catalog")
        void matchPattern() {
            long version = catalog.version();

            List<PatternOccurrence> occurrences = registry.matchPattern(pattern("steady", 0.9),
                    SampleFixtures.constant(20));

            // window 5 over 20 samples: starts 0..14
            assertEquals(15, occurrences.size());
            assertEquals(SampleFixtures.START, occurrences.get(0).getTimestamp());
            assertEquals(version, catalog.version());
        }
    }

    private static Pattern pattern(String id, double confidence) {
        return Pattern.builder()
                .id(id)
                .name("Learned " + id)
                .description("Registered by an operator")
                .type(PatternType.PERFORMANCE)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.CPU_USAGE)
                                .behavior(Behavior.STABLE)
                                .build())
                        .timeWindow(5)
                        .build())
                .confidence(confidence)
                .impact(ImpactLevel.MEDIUM)
                .build();
    }
}
