package com.cmdiag.patterns.model;

import com.cmdiag.patterns.metrics.MetricNames;
import com.cmdiag.patterns.support.SampleFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@DisplayName("Pattern JSON Tests")
class PatternSerializationTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Test
    @DisplayName("Pattern with every context variant survives a JSON round trip")
    void roundTrip() throws Exception {
        Pattern pattern = Pattern.builder()
                .id("pattern-memory-leak-20240304000000")
                .name("Memory Leak Pattern")
                .description("Gradual memory increase without corresponding decrease")
                .type(PatternType.PERFORMANCE)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.MEMORY_USAGE)
                                .behavior(Behavior.INCREASE)
                                .threshold(75.0)
                                .build())
                        .condition(PatternCondition.and(
                                PatternCondition.leaf(MetricNames.MEMORY_USAGE, ConditionOperator.GT, 50),
                                PatternCondition.not(PatternCondition.leaf("gc_frequency", ConditionOperator.LT, 10))))
                        .timeWindow(180)
                        .frequency(PatternFrequency.builder().type(FrequencyType.PERIODIC).interval(1440.0).build())
                        .build())
                .occurrence(occurrence(new TemplateMatchContext(Map.of(MetricNames.MEMORY_USAGE, Behavior.INCREASE), null)))
                .occurrence(occurrence(new ClusterContext("dbscan-0", ClusterMethod.DBSCAN)))
                .occurrence(occurrence(new SequenceContext(3, 20)))
                .occurrence(occurrence(new AnomalyContext(20, 39, 4.5)))
                .confidence(0.9)
                .impact(ImpactLevel.MEDIUM)
                .build();

        String json = mapper.writeValueAsString(pattern);

        assertEquals(pattern, mapper.readValue(json, Pattern.class));
    }

    @Test
    @DisplayName("Enums and context tags use readable names")
    void readableJson() throws Exception {
        Pattern pattern = Pattern.builder()
                .id("p")
                .name("P")
                .type(PatternType.ERROR)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder().metric(MetricNames.CPU_USAGE).behavior(Behavior.OSCILLATING).build())
                        .build())
                .occurrence(occurrence(new AnomalyContext(20, 20, 3.0)))
                .confidence(0.6)
                .impact(ImpactLevel.HIGH)
                .build();

        JsonNode json = mapper.valueToTree(pattern);

        assertEquals("oscillating", json.at("/signature/metrics/0/behavior").asText());
        assertEquals("anomaly", json.at("/occurrences/0/context/source").asText());
        assertEquals("2024-03-04T00:00:00", json.at("/occurrences/0/timestamp").asText());
        assertFalse(json.has("occurrenceCount"));
        assertFalse(json.has("confidencePercent"));
    }

    @Test
    @DisplayName("Confidence and match score are clamped to [0, 1]")
    void clamped() {
        assertEquals(1.0, Pattern.builder().confidence(1.4).build().getConfidence());
        assertEquals(0.0, Pattern.builder().confidence(Double.NaN).build().getConfidence());
        assertEquals(0.0, PatternOccurrence.builder().matchScore(-0.2).build().getMatchScore());
    }

    private static PatternOccurrence occurrence(OccurrenceContext context) {
        return PatternOccurrence.builder()
                .timestamp(SampleFixtures.START)
                .systemId(SampleFixtures.SYSTEM_ID)
                .matchScore(0.9)
                .context(context)
                .build();
    }
}
