package com.layeredcrf.server.crf.feature;

import java.util.ArrayList;
import java.util.List;

/**
 * Feature map given as one single-channel image per feature dimension.
 */
public class PlanarFeatureMap implements FeatureMap {

    private final List<double[][]> planes;
    private final int width;
    private final int height;

    /**
     * @param planes one [y][x] plane per feature, all of the same size
     */
    public PlanarFeatureMap(List<double[][]> planes) {
        if (planes == null || planes.isEmpty()) {
            throw new IllegalArgumentException("At least one feature plane is required");
        }
        double[][] first = planes.get(0);
        if (first.length == 0 || first[0].length == 0) {
            throw new IllegalArgumentException("Feature planes must not be empty");
        }
        this.height = first.length;
        this.width = first[0].length;
        for (int f = 0; f < planes.size(); f++) {
            double[][] plane = planes.get(f);
            if (plane.length != height) {
                throw new IllegalArgumentException("Plane " + f + " has height " + plane.length + ", expected " + height);
            }
            for (double[] row : plane) {
                if (row.length != width) {
                    throw new IllegalArgumentException("Plane " + f + " has a row of width " + row.length
                            + ", expected " + width);
                }
            }
        }
        this.planes = new ArrayList<>(planes);
    }

    /**
     * Builds planes from 8-bit style integer images, as delivered by image
     * decoders.
     */
    public static PlanarFeatureMap fromPixels(List<int[][]> pixelPlanes) {
        List<double[][]> planes = new ArrayList<>(pixelPlanes.size());
        for (int[][] pixels : pixelPlanes) {
            double[][] plane = new double[pixels.length][];
            for (int y = 0; y < pixels.length; y++) {
                plane[y] = new double[pixels[y].length];
                for (int x = 0; x < pixels[y].length; x++) {
                    plane[y][x] = pixels[y][x];
                }
            }
            planes.add(plane);
        }
        return new PlanarFeatureMap(planes);
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
        return planes.size();
    }

    @Override
    public void get(int x, int y, double[] dst) {
        for (int f = 0; f < planes.size(); f++) {
            dst[f] = planes.get(f)[y][x];
        }
    }
}
