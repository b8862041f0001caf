package com.cmdiag.patterns.analysis;

import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.metrics.MetricSample;
import com.cmdiag.patterns.model.PatternFrequency;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Classifies inter-sample timing inside a window against a frequency definition.
 */
@Component
@RequiredArgsConstructor
public class FrequencyEvaluator {

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final PatternEngineProperties properties;

    public boolean evaluate(PatternFrequency frequency, List<MetricSample> window) {
        if (frequency == null || frequency.getType() == null || window == null || window.size() < 2) {
            return false;
        }

        double[] gaps = gapsInMinutes(window);
        double meanGap = SeriesStats.mean(gaps);
        PatternEngineProperties.Template config = properties.getTemplate();

        switch (frequency.getType()) {
            case RECURRING: {
                if (frequency.getInterval() == null) {
                    return false;
                }
                return Math.abs(meanGap - frequency.getInterval()) <= variance(frequency, config);
            }
            case PERIODIC: {
                if (frequency.getInterval() == null || frequency.getInterval() == 0) {
                    return false;
                }
                double interval = frequency.getInterval();
                double variance = variance(frequency, config);
                for (double gap : gaps) {
                    if (Math.abs(gap % interval) > variance) {
                        return false;
                    }
                }
                return true;
            }
            case SPORADIC:
                return SeriesStats.stdDev(gaps) > meanGap * config.getSporadicFactor();
            default:
                return false;
        }
    }

    private double variance(PatternFrequency frequency, PatternEngineProperties.Template config) {
        if (frequency.getVariance() != null) {
            return frequency.getVariance();
        }
        return frequency.getInterval() * config.getDefaultVarianceFraction();
    }

    static double[] gapsInMinutes(List<MetricSample> window) {
        double[] gaps = new double[window.size() - 1];
        for (int i = 1; i < window.size(); i++) {
            gaps[i - 1] = Duration.between(window.get(i - 1).getTimestamp(), window.get(i).getTimestamp())
                    .toMillis() / MILLIS_PER_MINUTE;
        }
        return gaps;
    }
}
