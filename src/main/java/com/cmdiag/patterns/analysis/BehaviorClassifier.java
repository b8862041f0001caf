package com.cmdiag.patterns.analysis;

import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.model.Behavior;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Classifies the trend of a numeric series.
 *
 * Dispersion wins over direction: a coefficient of variation above the limit
 * is OSCILLATING regardless of slope.
 */
@Component
@RequiredArgsConstructor
public class BehaviorClassifier {

    private final PatternEngineProperties properties;

    public Behavior classify(double[] values) {
        if (values == null || values.length < 2) {
            return Behavior.STABLE;
        }

        PatternEngineProperties.Behavior config = properties.getBehavior();

        double mean = SeriesStats.mean(values);
        double cv = SeriesStats.stdDev(values) / (mean != 0 ? mean : 1);
        if (cv > config.getOscillationCv()) {
            return Behavior.OSCILLATING;
        }

        double slope = SeriesStats.slope(values);
        if (slope > config.getSlopeThreshold()) {
            return Behavior.INCREASE;
        }
        if (slope < -config.getSlopeThreshold()) {
            return Behavior.DECREASE;
        }
        return Behavior.STABLE;
    }
}
