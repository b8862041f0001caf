package com.cmdiag.patterns.discovery;

import com.cmdiag.patterns.metrics.MetricSample;
import org.apache.commons.math3.ml.clustering.Clusterable;

/**
 * Feature vector of one sample, remembering which sample it came from.
 * Identity-based equality keeps duplicate readings as separate cluster members.
 */
public class SampleFeatures implements Clusterable {

    private final int index;
    private final MetricSample sample;
    private final double[] point;

    public SampleFeatures(int index, MetricSample sample, double[] point) {
        this.index = index;
        this.sample = sample;
        this.point = point;
    }

    public int getIndex() {
        return index;
    }

    public MetricSample getSample() {
        return sample;
    }

    @Override
    public double[] getPoint() {
        return point;
    }
}
