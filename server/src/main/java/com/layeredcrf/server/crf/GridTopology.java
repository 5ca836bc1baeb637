package com.layeredcrf.server.crf;

import java.util.Set;

/**
 * Geometry of a stack of {@code nLayers} grids of {@code width x height}
 * sites: the node index of every site and the edges implied by a set of
 * {@link EdgesType}s.
 *
 * Node index is {@code ((layer * height) + y) * width + x}. Each undirected
 * edge is enumerated once, from the site towards its right, lower, lower-right
 * and lower-left neighbours, and from a layer towards the next one.
 */
public final class GridTopology {

    public static final int DEFAULT_GROUP = 0;
    public static final int LINK_GROUP = 1;

    @FunctionalInterface
    public interface EdgeSink {
        void accept(int src, int dst, int group);
    }

    private final int width;
    private final int height;
    private final int nLayers;
    private final boolean grid;
    private final boolean diag;
    private final boolean link;

    public GridTopology(int width, int height, int nLayers, Set<EdgesType> types) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Grid size must not be negative: " + width + "x" + height);
        }
        if (nLayers <= 0) {
            throw new IllegalArgumentException("Number of layers must be positive: " + nLayers);
        }
        this.width = width;
        this.height = height;
        this.nLayers = nLayers;
        this.grid = types.contains(EdgesType.GRID);
        this.diag = types.contains(EdgesType.DIAG);
        this.link = types.contains(EdgesType.LINK) && nLayers > 1;
    }

    public int nodeIndex(int x, int y, int layer) {
        return ((layer * height) + y) * width + x;
    }

    public int xOf(int node) {
        return node % width;
    }

    public int yOf(int node) {
        return (node / width) % height;
    }

    public int layerOf(int node) {
        return node / (width * height);
    }

    public long numNodes() {
        return (long) width * height * nLayers;
    }

    public long numGridEdges() {
        if (!grid || width == 0 || height == 0) {
            return 0;
        }
        return ((long) width * (height - 1) + (long) height * (width - 1)) * nLayers;
    }

    public long numDiagEdges() {
        if (!diag || width == 0 || height == 0) {
            return 0;
        }
        return 2L * (width - 1) * (height - 1) * nLayers;
    }

    public long numLinkEdges() {
        if (!link) {
            return 0;
        }
        return (long) width * height * (nLayers - 1);
    }

    public long numEdges() {
        return numGridEdges() + numDiagEdges() + numLinkEdges();
    }

    /**
     * Feeds every edge to {@code sink}, layer by layer and row by row.
     */
    public void forEachEdge(EdgeSink sink) {
        for (int l = 0; l < nLayers; l++) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int idx = nodeIndex(x, y, l);
                    if (grid) {
                        if (x < width - 1) {
                            sink.accept(idx, idx + 1, DEFAULT_GROUP);
                        }
                        if (y < height - 1) {
                            sink.accept(idx, idx + width, DEFAULT_GROUP);
                        }
                    }
                    if (diag && y < height - 1) {
                        if (x < width - 1) {
                            sink.accept(idx, idx + width + 1, DEFAULT_GROUP);
                        }
                        if (x > 0) {
                            sink.accept(idx, idx + width - 1, DEFAULT_GROUP);
                        }
                    }
                    if (link && l < nLayers - 1) {
                        sink.accept(idx, idx + width * height, LINK_GROUP);
                    }
                }
            }
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getNumLayers() {
        return nLayers;
    }
}
