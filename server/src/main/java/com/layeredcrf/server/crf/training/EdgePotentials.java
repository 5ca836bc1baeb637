package com.layeredcrf.server.crf.training;

/**
 * Building blocks for pairwise potential matrices.
 */
public final class EdgePotentials {

    private EdgePotentials() {
    }

    /**
     * Potts matrix: {@code val} on the diagonal, 1 elsewhere.
     */
    public static double[][] potts(int numStates, double val) {
        double[][] pot = new double[numStates][numStates];
        for (int i = 0; i < numStates; i++) {
            for (int j = 0; j < numStates; j++) {
                pot[i][j] = (i == j) ? val : 1.0;
            }
        }
        return pot;
    }

    /**
     * Diagonal value of a contrast-sensitive Potts matrix:
     * {@code 1 + (smoothness - 1) * exp(-beta * squaredDistance)}. Equal
     * features keep the full smoothness; growing distance decays it towards 1.
     */
    public static double contrastSmoothness(double smoothness, double beta, double squaredDistance) {
        return 1.0 + (smoothness - 1.0) * Math.exp(-beta * squaredDistance);
    }

    public static double squaredDistance(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Feature vectors differ in length: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    /**
     * Applies a weight in the log domain, i.e. raises every entry to
     * {@code weight}. Returns {@code pot} itself for weight 1.
     */
    public static double[][] pow(double[][] pot, double weight) {
        if (weight == 1.0) {
            return pot;
        }
        double[][] res = new double[pot.length][];
        for (int i = 0; i < pot.length; i++) {
            res[i] = new double[pot[i].length];
            for (int j = 0; j < pot[i].length; j++) {
                res[i][j] = Math.pow(pot[i][j], weight);
            }
        }
        return res;
    }
}
