package com.cmdiag.patterns.matching;

import com.cmdiag.patterns.analysis.BehaviorClassifier;
import com.cmdiag.patterns.analysis.ConditionEvaluator;
import com.cmdiag.patterns.analysis.FrequencyEvaluator;
import com.cmdiag.patterns.analysis.SeriesStats;
import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.metrics.MetricExtractor;
import com.cmdiag.patterns.metrics.MetricSample;
import com.cmdiag.patterns.model.Behavior;
import com.cmdiag.patterns.model.MetricPattern;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternCondition;
import com.cmdiag.patterns.model.PatternIds;
import com.cmdiag.patterns.model.PatternOccurrence;
import com.cmdiag.patterns.model.PatternSignature;
import com.cmdiag.patterns.model.PatternTemplate;
import com.cmdiag.patterns.model.Scores;
import com.cmdiag.patterns.model.TemplateMatchContext;
import com.cmdiag.patterns.ranking.ImpactAssessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores catalogued signatures against a sample series with a sliding window.
 *
 * Scoring per window:
 * - each metric behavior match: +0.5 (mismatch fails the window)
 * - declared threshold reached by the window max: +0.3 (miss fails the window)
 * - declared rate within tolerance of the mean first difference: +0.2 (bonus)
 * - each satisfied condition: +0.1 (failure fails the window)
 * - satisfied frequency: +0.2 (bonus)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TemplateMatcher {

    private final PatternEngineProperties properties;
    private final BehaviorClassifier behaviorClassifier;
    private final ConditionEvaluator conditionEvaluator;
    private final FrequencyEvaluator frequencyEvaluator;
    private final ImpactAssessor impactAssessor;

    /**
     * Match one template against the series with 25% window overlap.
     * The result may have zero occurrences (confidence 0); callers apply
     * {@link PatternTemplate#getMinConfidence()} themselves.
     */
    public Pattern matchTemplate(PatternTemplate template, List<MetricSample> samples) {
        int windowSize = windowSize(template.getSignature());
        int step = Math.max(1, windowSize / properties.getTemplate().getStepDivisor());

        List<PatternOccurrence> occurrences = findOccurrences(template.getSignature(), samples, step);

        double confidence = occurrences.stream()
                .mapToDouble(PatternOccurrence::getMatchScore)
                .average()
                .orElse(0);

        log.debug("Template {} matched {} windows (confidence: {})",
                template.getId(), occurrences.size(), String.format("%.2f", confidence));

        return Pattern.builder()
                .id(PatternIds.of("pattern-" + template.getId(), firstTimestamp(samples)))
                .name(template.getName())
                .description(template.getDescription())
                .type(template.getType())
                .signature(template.getSignature())
                .occurrences(occurrences)
                .confidence(confidence)
                .impact(impactAssessor.assess(template.getType(), Scores.clamp(confidence), occurrences.size()))
                .build();
    }

    /**
     * Slide a window over the series and collect every matching window.
     * Windows start at 0, step, 2*step, ... while start &lt; size - windowSize.
     */
    public List<PatternOccurrence> findOccurrences(PatternSignature signature, List<MetricSample> samples, int step) {
        List<PatternOccurrence> occurrences = new ArrayList<>();
        int windowSize = windowSize(signature);

        for (int i = 0; i < samples.size() - windowSize; i += step) {
            List<MetricSample> window = samples.subList(i, i + windowSize);
            SignatureMatch match = evaluateSignature(signature, window);

            if (match.matches()) {
                MetricSample first = window.get(0);
                occurrences.add(PatternOccurrence.builder()
                        .timestamp(first.getTimestamp())
                        .systemId(first.getSystemId())
                        .matchScore(match.score())
                        .context(match.context())
                        .build());
            }
        }

        return occurrences;
    }

    public SignatureMatch evaluateSignature(PatternSignature signature, List<MetricSample> window) {
        PatternEngineProperties.Template config = properties.getTemplate();
        double score = 0;
        boolean matches = true;
        Map<String, Behavior> behaviors = new LinkedHashMap<>();

        for (MetricPattern metricPattern : signature.getMetrics()) {
            if (metricPattern == null || metricPattern.getMetric() == null) {
                // unnamed metric can never be satisfied
                matches = false;
                continue;
            }
            double[] values = MetricExtractor.values(window, metricPattern.getMetric());
            Behavior behavior = behaviorClassifier.classify(values);

            if (metricPattern.getBehavior() == behavior) {
                score += config.getBehaviorWeight();
            } else {
                matches = false;
            }

            if (metricPattern.getThreshold() != null) {
                if (values.length > 0 && SeriesStats.max(values) >= metricPattern.getThreshold()) {
                    score += config.getThresholdWeight();
                } else {
                    matches = false;
                }
            }

            if (metricPattern.getRate() != null) {
                double rate = SeriesStats.meanDelta(values);
                if (Math.abs(rate - metricPattern.getRate()) < config.getRateTolerance()) {
                    score += config.getRateWeight();
                }
            }

            behaviors.put(metricPattern.getMetric(), behavior);
        }

        for (PatternCondition condition : signature.getConditions()) {
            if (conditionEvaluator.evaluate(condition, window)) {
                score += config.getConditionWeight();
            } else {
                matches = false;
            }
        }

        Boolean frequencyMatch = null;
        if (signature.getFrequency() != null && window.size() > 1) {
            frequencyMatch = frequencyEvaluator.evaluate(signature.getFrequency(), window);
            if (frequencyMatch) {
                score += config.getFrequencyWeight();
            }
        }

        return new SignatureMatch(matches, Scores.clamp(score), new TemplateMatchContext(behaviors, frequencyMatch));
    }

    private int windowSize(PatternSignature signature) {
        return signature.getEffectiveTimeWindow(properties.getTemplate().getDefaultTimeWindow());
    }

    static LocalDateTime firstTimestamp(List<MetricSample> samples) {
        return samples.isEmpty() ? null : samples.get(0).getTimestamp();
    }
}
