package com.cmdiag.patterns.analysis;

import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;
import com.google.common.math.PairedStatsAccumulator;
import com.google.common.math.Stats;

/**
 * Descriptive statistics over primitive series.
 * Empty input yields 0 instead of an exception.
 */
public final class SeriesStats {

    private SeriesStats() {}

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        return Stats.meanOf(values);
    }

    /**
     * Population standard deviation.
     */
    public static double stdDev(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        return Stats.of(values).populationStandardDeviation();
    }

    public static double max(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        return Stats.of(values).max();
    }

    /**
     * Ordinary least squares slope of value against index.
     */
    public static double slope(double[] values) {
        if (values == null || values.length < 2) {
            return 0;
        }
        PairedStatsAccumulator accumulator = new PairedStatsAccumulator();
        for (int i = 0; i < values.length; i++) {
            accumulator.add(i, values[i]);
        }
        return accumulator.snapshot().leastSquaresFit().slope();
    }

    /**
     * Mean of consecutive differences.
     */
    public static double meanDelta(double[] values) {
        if (values == null || values.length < 2) {
            return 0;
        }
        double[] deltas = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            deltas[i - 1] = values[i] - values[i - 1];
        }
        return mean(deltas);
    }

    /**
     * Most frequent value; ties resolve to the smallest value.
     */
    public static int mode(int[] values) {
        Multiset<Integer> counts = TreeMultiset.create();
        for (int value : values) {
            counts.add(value);
        }

        int mode = 0;
        int best = 0;
        for (Multiset.Entry<Integer> entry : counts.entrySet()) {
            if (entry.getCount() > best) {
                best = entry.getCount();
                mode = entry.getElement();
            }
        }
        return mode;
    }

    public static double[] slice(double[] values, int from, int to) {
        double[] result = new double[to - from];
        System.arraycopy(values, from, result, 0, to - from);
        return result;
    }
}
