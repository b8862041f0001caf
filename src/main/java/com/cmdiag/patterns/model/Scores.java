package com.cmdiag.patterns.model;

public final class Scores {

    private Scores() {}

    /**
     * Clamp to [0, 1]; NaN maps to 0.
     */
    public static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0;
        }
        return Math.max(0, Math.min(1, score));
    }
}
