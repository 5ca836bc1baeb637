package com.layeredcrf.server.crf;

public final class GridSize {

    public static final GridSize EMPTY = new GridSize(0, 0);

    private final int width;
    private final int height;

    public GridSize(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Grid size must not be negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public int area() {
        return width * height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GridSize)) {
            return false;
        }
        GridSize other = (GridSize) o;
        return width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return 31 * width + height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
