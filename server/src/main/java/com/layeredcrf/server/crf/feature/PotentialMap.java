package com.layeredcrf.server.crf.feature;

/**
 * Node potentials for one layer: a vector of {@code numStates} non-negative
 * values per site.
 */
public class PotentialMap {

    private final int width;
    private final int height;
    private final int numStates;
    private final double[] data;

    public PotentialMap(int width, int height, int numStates, double[] data) {
        if (width <= 0 || height <= 0 || numStates <= 0) {
            throw new IllegalArgumentException(
                    "Potential map dimensions must be positive: " + width + "x" + height + "x" + numStates);
        }
        if (data == null || data.length != width * height * numStates) {
            throw new IllegalArgumentException("Expected " + (width * height * numStates) + " values, got "
                    + (data == null ? "null" : data.length));
        }
        for (double v : data) {
            if (!(v >= 0.0)) {
                throw new IllegalArgumentException("Potentials must be non-negative, got " + v);
            }
        }
        this.width = width;
        this.height = height;
        this.numStates = numStates;
        this.data = data;
    }

    /**
     * @param pots indexed [y][x][state]
     */
    public static PotentialMap of(double[][][] pots) {
        if (pots == null || pots.length == 0 || pots[0].length == 0 || pots[0][0].length == 0) {
            throw new IllegalArgumentException("Potentials must be a non-empty [y][x][state] array");
        }
        int height = pots.length;
        int width = pots[0].length;
        int numStates = pots[0][0].length;
        double[] data = new double[width * height * numStates];
        for (int y = 0; y < height; y++) {
            if (pots[y].length != width) {
                throw new IllegalArgumentException("Row " + y + " has " + pots[y].length + " sites, expected " + width);
            }
            for (int x = 0; x < width; x++) {
                if (pots[y][x].length != numStates) {
                    throw new IllegalArgumentException("Site (" + x + ", " + y + ") has " + pots[y][x].length
                            + " states, expected " + numStates);
                }
                System.arraycopy(pots[y][x], 0, data, (y * width + x) * numStates, numStates);
            }
        }
        return new PotentialMap(width, height, numStates, data);
    }

    // Every site gets a copy of pot.
    public static PotentialMap uniform(int width, int height, double[] pot) {
        double[] data = new double[width * height * pot.length];
        for (int i = 0; i < width * height; i++) {
            System.arraycopy(pot, 0, data, i * pot.length, pot.length);
        }
        return new PotentialMap(width, height, pot.length, data);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getNumStates() {
        return numStates;
    }

    public double[] get(int x, int y) {
        double[] pot = new double[numStates];
        System.arraycopy(data, (y * width + x) * numStates, pot, 0, numStates);
        return pot;
    }
}
