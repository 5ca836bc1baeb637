package com.layeredcrf.server.crf.feature;

/**
 * Per-site feature vectors over a width x height grid.
 */
public interface FeatureMap {

    int getWidth();

    int getHeight();

    int getNumFeatures();

    /**
     * Copies the feature vector of site (x, y) into {@code dst}, which must hold
     * at least {@link #getNumFeatures()} values.
     */
    void get(int x, int y, double[] dst);

    default double[] get(int x, int y) {
        double[] v = new double[getNumFeatures()];
        get(x, y, v);
        return v;
    }

    default boolean hasSize(int width, int height) {
        return getWidth() == width && getHeight() == height;
    }
}
