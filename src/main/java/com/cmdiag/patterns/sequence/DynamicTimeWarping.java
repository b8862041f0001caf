package com.cmdiag.patterns.sequence;

import java.util.Arrays;

/**
 * Dynamic time warping distance between two numeric sequences.
 */
public final class DynamicTimeWarping {

    private DynamicTimeWarping() {}

    /**
     * Standard O(n*m) cost matrix with cell cost |a - b| and insert/delete/match
     * moves. Returns the bottom-right cell; an empty input against a non-empty
     * one is infinitely far.
     */
    public static double distance(double[] a, double[] b) {
        int n = a.length;
        int m = b.length;
        double[][] matrix = new double[n + 1][m + 1];

        for (double[] row : matrix) {
            Arrays.fill(row, Double.POSITIVE_INFINITY);
        }
        matrix[0][0] = 0;

        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                double cost = Math.abs(a[i - 1] - b[j - 1]);
                matrix[i][j] = cost + Math.min(matrix[i - 1][j - 1],
                        Math.min(matrix[i - 1][j], matrix[i][j - 1]));
            }
        }

        return matrix[n][m];
    }
}
