package com.cmdiag.patterns.ranking;

import com.cmdiag.patterns.model.ImpactLevel;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternOccurrence;
import com.cmdiag.patterns.model.PatternType;
import com.cmdiag.patterns.support.SampleFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("PatternDeduplicator Tests")
class PatternDeduplicatorTest {

    private PatternDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        deduplicator = new PatternDeduplicator();
    }

    @Test
    @DisplayName("Same type, name and decile merge into one pattern")
    void mergesSameDecile() {
        Pattern first = pattern("a", PatternType.PERFORMANCE, "CPU Spike Pattern", 0.81, 2);
        Pattern second = pattern("b", PatternType.PERFORMANCE, "CPU Spike Pattern", 0.84, 3);

        List<Pattern> result = deduplicator.deduplicateAndRank(List.of(first, second));

        assertEquals(1, result.size());
        Pattern merged = result.get(0);
        assertEquals("a", merged.getId());
        assertEquals(0.84, merged.getConfidence(), 1e-9);
        assertEquals(5, merged.getOccurrenceCount());
    }

    @Test
    @DisplayName("Different deciles stay separate")
    void keepsDifferentDeciles() {
        Pattern first = pattern("a", PatternType.PERFORMANCE, "CPU Spike Pattern", 0.79, 1);
        Pattern second = pattern("b", PatternType.PERFORMANCE, "CPU Spike Pattern", 0.81, 1);

        assertEquals(2, deduplicator.deduplicateAndRank(List.of(first, second)).size());
    }

    @Test
    @DisplayName("Output is sorted by descending confidence, ties keep input order")
    void ranksByConfidence() {
        Pattern low = pattern("low", PatternType.USAGE, "Low", 0.3, 1);
        Pattern high = pattern("high", PatternType.ERROR, "High", 0.9, 1);
        Pattern tieA = pattern("tie-a", PatternType.SECURITY, "Tie A", 0.6, 1);
        Pattern tieB = pattern("tie-b", PatternType.WORKFLOW, "Tie B", 0.6, 1);

        List<Pattern> result = deduplicator.deduplicateAndRank(List.of(low, tieA, high, tieB));

        assertThat(result).extracting(Pattern::getId)
                .containsExactly("high", "tie-a", "tie-b", "low");
    }

    @Test
    @DisplayName("Input patterns are not modified")
    void inputUntouched() {
        Pattern first = pattern("a", PatternType.ERROR, "Same", 0.55, 1);
        Pattern second = pattern("b", PatternType.ERROR, "Same", 0.58, 1);

        deduplicator.deduplicateAndRank(List.of(first, second));

        assertEquals(1, first.getOccurrenceCount());
        assertEquals(0.55, first.getConfidence(), 1e-9);
    }

    private static Pattern pattern(String id, PatternType type, String name, double confidence, int occurrences) {
        Pattern.PatternBuilder builder = Pattern.builder()
                .id(id)
                .name(name)
                .type(type)
                .confidence(confidence)
                .impact(ImpactLevel.MEDIUM);
        for (int i = 0; i < occurrences; i++) {
            builder.occurrence(PatternOccurrence.builder()
                    .timestamp(SampleFixtures.START.plusMinutes(i))
                    .systemId(SampleFixtures.SYSTEM_ID)
                    .matchScore(0.5)
                    .build());
        }
        return builder.build();
    }
}
