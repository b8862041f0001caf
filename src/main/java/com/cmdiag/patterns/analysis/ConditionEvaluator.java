package com.cmdiag.patterns.analysis;

import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.metrics.MetricExtractor;
import com.cmdiag.patterns.metrics.MetricSample;
import com.cmdiag.patterns.model.CompositeCondition;
import com.cmdiag.patterns.model.LeafCondition;
import com.cmdiag.patterns.model.PatternCondition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Recursive evaluation of condition trees over a window of samples.
 *
 * AND is vacuously true, OR vacuously false, NOT is true iff no child holds.
 * Leaves compare the window mean of their metric; malformed nodes fail closed.
 */
@Component
@RequiredArgsConstructor
public class ConditionEvaluator {

    private final PatternEngineProperties properties;

    public boolean evaluate(PatternCondition condition, List<MetricSample> window) {
        if (condition instanceof CompositeCondition) {
            return evaluateComposite((CompositeCondition) condition, window);
        }
        if (condition instanceof LeafCondition) {
            return evaluateLeaf((LeafCondition) condition, window);
        }
        return false;
    }

    private boolean evaluateComposite(CompositeCondition composite, List<MetricSample> window) {
        if (composite.type() == null) {
            return false;
        }

        List<PatternCondition> children = composite.children();
        return switch (composite.type()) {
            case AND -> children.stream().allMatch(c -> evaluate(c, window));
            case OR -> children.stream().anyMatch(c -> evaluate(c, window));
            case NOT -> children.stream().noneMatch(c -> evaluate(c, window));
        };
    }

    private boolean evaluateLeaf(LeafCondition leaf, List<MetricSample> window) {
        if (!leaf.isWellFormed() || window == null || window.isEmpty()) {
            return false;
        }

        double mean = SeriesStats.mean(MetricExtractor.values(window, leaf.metric()));
        double value = leaf.value();
        double tolerance = properties.getCondition().getEqualityTolerance();

        return switch (leaf.operator()) {
            case GT -> mean > value;
            case LT -> mean < value;
            case GTE -> mean >= value;
            case LTE -> mean <= value;
            case EQ -> Math.abs(mean - value) < tolerance;
            case NE -> Math.abs(mean - value) >= tolerance;
        };
    }
}
