package com.cmdiag.patterns.ranking;

import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.model.ImpactLevel;
import com.cmdiag.patterns.model.PatternType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps (type, confidence, occurrence count) to a qualitative severity.
 *
 * score = weight(type) * confidence * ln(occurrences + 1)
 */
@Component
@RequiredArgsConstructor
public class ImpactAssessor {

    private final PatternEngineProperties properties;

    public ImpactLevel assess(PatternType type, double confidence, int occurrences) {
        double score = score(type, confidence, occurrences);
        PatternEngineProperties.Impact config = properties.getImpact();

        if (score > config.getCriticalAbove()) return ImpactLevel.CRITICAL;
        if (score > config.getHighAbove()) return ImpactLevel.HIGH;
        if (score > config.getMediumAbove()) return ImpactLevel.MEDIUM;
        return ImpactLevel.LOW;
    }

    public double score(PatternType type, double confidence, int occurrences) {
        return baseWeight(type) * confidence * Math.log(occurrences + 1);
    }

    double baseWeight(PatternType type) {
        PatternEngineProperties.Impact config = properties.getImpact();
        if (type == null) {
            return config.getUsageWeight();
        }
        return switch (type) {
            case SECURITY -> config.getSecurityWeight();
            case ERROR -> config.getErrorWeight();
            case PERFORMANCE -> config.getPerformanceWeight();
            case USAGE -> config.getUsageWeight();
            case WORKFLOW -> config.getWorkflowWeight();
        };
    }
}
