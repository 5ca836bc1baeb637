package com.layeredcrf.server.crf.training;

import java.util.Arrays;

/**
 * Co-occurrence counts of (row state, column state) pairs with Laplace
 * smoothing. The potential table is the smoothed joint probability scaled by
 * {@code rows * cols}, so an uninformed table is all ones.
 */
public class LabelPairCounts {

    private final int rows;
    private final int cols;
    private final double alpha;

    // [rowState][colState]
    private final long[][] counts;
    private long total = 0;
    private long skipped = 0;

    private double[][] potentials = null;

    public LabelPairCounts(int rows, int cols, double alpha) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Table dimensions must be positive: " + rows + "x" + cols);
        }
        if (alpha <= 0) {
            throw new IllegalArgumentException("Smoothing constant must be positive: " + alpha);
        }
        this.rows = rows;
        this.cols = cols;
        this.alpha = alpha;
        this.counts = new long[rows][cols];
    }

    /**
     * Counts one pair; pairs with a state outside the table (e.g. a void label)
     * are skipped.
     *
     * @return whether the pair was counted
     */
    public boolean add(int rowState, int colState) {
        if (rowState < 0 || rowState >= rows || colState < 0 || colState >= cols) {
            skipped++;
            return false;
        }
        counts[rowState][colState]++;
        total++;
        return true;
    }

    public void finalizePotentials() {
        double denom = total + alpha * rows * cols;
        double[][] pot = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                pot[r][c] = (counts[r][c] + alpha) / denom * rows * cols;
            }
        }
        potentials = pot;
    }

    public boolean isFinalized() {
        return potentials != null;
    }

    /**
     * @throws IllegalStateException before {@link #finalizePotentials()}
     */
    public double[][] getPotentials() {
        if (potentials == null) {
            throw new IllegalStateException("Counts have not been finalized, call train() first");
        }
        double[][] copy = new double[rows][];
        for (int r = 0; r < rows; r++) {
            copy[r] = potentials[r].clone();
        }
        return copy;
    }

    public void clear() {
        for (long[] row : counts) {
            Arrays.fill(row, 0L);
        }
        total = 0;
        skipped = 0;
        potentials = null;
    }

    // Row-major copy of the raw counts.
    public double[] toArray() {
        double[] flat = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                flat[r * cols + c] = counts[r][c];
            }
        }
        return flat;
    }

    /**
     * Replaces the counts with a row-major array produced by {@link #toArray()}.
     * The potentials have to be finalized again afterwards.
     */
    public void restore(double[] flat) {
        if (flat == null || flat.length != rows * cols) {
            throw new IllegalArgumentException("Expected " + (rows * cols) + " counts, got "
                    + (flat == null ? "null" : flat.length));
        }
        long sum = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                long v = Math.round(flat[r * cols + c]);
                if (v < 0) {
                    throw new IllegalArgumentException("Counts must be non-negative, got " + v);
                }
                counts[r][c] = v;
                sum += v;
            }
        }
        total = sum;
        skipped = 0;
        potentials = null;
    }

    public long getCount(int rowState, int colState) {
        return counts[rowState][colState];
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public long getTotal() {
        return total;
    }

    public long getSkipped() {
        return skipped;
    }
}
