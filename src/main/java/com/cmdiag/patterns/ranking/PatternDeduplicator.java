package com.cmdiag.patterns.ranking;

import com.cmdiag.patterns.model.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges equivalent patterns coming from the three detection paths and orders
 * the result by descending confidence.
 *
 * Patterns are equivalent when type, name and confidence decile agree. The first
 * one seen is kept; later ones contribute their occurrences and can only raise
 * its confidence.
 */
@Component
@Slf4j
public class PatternDeduplicator {

    public List<Pattern> deduplicateAndRank(List<Pattern> patterns) {
        Map<String, Pattern> unique = new LinkedHashMap<>();

        for (Pattern pattern : patterns) {
            String key = key(pattern);
            Pattern existing = unique.get(key);
            if (existing == null) {
                unique.put(key, pattern);
            } else {
                unique.put(key, existing.mergeWith(pattern));
                log.debug("Merged duplicate pattern {} into {}", pattern.getId(), existing.getId());
            }
        }

        List<Pattern> ranked = new ArrayList<>(unique.values());
        ranked.sort(Comparator.comparingDouble(Pattern::getConfidence).reversed());
        return ranked;
    }

    static String key(Pattern pattern) {
        return String.format("%s-%s-%d",
                pattern.getType(),
                pattern.getName(),
                (int) Math.floor(pattern.getConfidence() * 10));
    }
}
