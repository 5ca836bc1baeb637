package com.layeredcrf.server.crf.feature;

/**
 * Feature map holding one multi-channel sample per site, stored interleaved:
 * the features of a site are contiguous.
 */
public class MultiChannelFeatureMap implements FeatureMap {

    private final int width;
    private final int height;
    private final int numFeatures;
    private final double[] data;

    public MultiChannelFeatureMap(int width, int height, int numFeatures, double[] data) {
        if (width <= 0 || height <= 0 || numFeatures <= 0) {
            throw new IllegalArgumentException(
                    "Feature map dimensions must be positive: " + width + "x" + height + "x" + numFeatures);
        }
        if (data == null || data.length != width * height * numFeatures) {
            throw new IllegalArgumentException("Expected " + (width * height * numFeatures) + " values, got "
                    + (data == null ? "null" : data.length));
        }
        this.width = width;
        this.height = height;
        this.numFeatures = numFeatures;
        this.data = data;
    }

    /**
     * @param samples indexed [y][x][feature]
     */
    public static MultiChannelFeatureMap of(double[][][] samples) {
        if (samples == null || samples.length == 0 || samples[0].length == 0 || samples[0][0].length == 0) {
            throw new IllegalArgumentException("Feature samples must be a non-empty [y][x][feature] array");
        }
        int height = samples.length;
        int width = samples[0].length;
        int numFeatures = samples[0][0].length;
        double[] data = new double[width * height * numFeatures];
        for (int y = 0; y < height; y++) {
            if (samples[y].length != width) {
                throw new IllegalArgumentException("Row " + y + " has " + samples[y].length + " sites, expected " + width);
            }
            for (int x = 0; x < width; x++) {
                if (samples[y][x].length != numFeatures) {
                    throw new IllegalArgumentException("Site (" + x + ", " + y + ") has " + samples[y][x].length
                            + " features, expected " + numFeatures);
                }
                System.arraycopy(samples[y][x], 0, data, (y * width + x) * numFeatures, numFeatures);
            }
        }
        return new MultiChannelFeatureMap(width, height, numFeatures, data);
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getNumFeatures() {
        return numFeatures;
    }

    @Override
    public void get(int x, int y, double[] dst) {
        System.arraycopy(data, (y * width + x) * numFeatures, dst, 0, numFeatures);
    }
}
