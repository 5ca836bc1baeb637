package com.layeredcrf.db;

public class StoredCounts {
    private final String modelName;
    private final ModelKind kind;
    private final int rows;
    private final int cols;
    private final double[] counts;
    private final long createdTs;

    public StoredCounts(String modelName, ModelKind kind, int rows, int cols, double[] counts, long createdTs) {
        this.modelName = modelName;
        this.kind = kind;
        this.rows = rows;
        this.cols = cols;
        this.counts = counts;
        this.createdTs = createdTs;
    }

    public String getModelName() {
        return modelName;
    }

    public ModelKind getKind() {
        return kind;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public double[] getCounts() {
        return counts;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "StoredCounts{name='" + modelName + "', kind=" + kind + ", " + rows + "x" + cols + "}";
    }
}
