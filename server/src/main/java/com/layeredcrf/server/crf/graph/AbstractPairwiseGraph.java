package com.layeredcrf.server.crf.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument checks and potential (un)flattening shared by the graph
 * implementations. Edge potentials are kept row-major in a flat array.
 */
public abstract class AbstractPairwiseGraph implements PairwiseGraph {

    private final int numStates;

    protected AbstractPairwiseGraph(int numStates) {
        if (numStates <= 0) {
            throw new IllegalArgumentException("Number of states must be positive: " + numStates);
        }
        this.numStates = numStates;
    }

    @Override
    public int getNumStates() {
        return numStates;
    }

    @Override
    public int setEdges(GroupFilter filter, double[][] pot) {
        if (filter == null) {
            throw new IllegalArgumentException("Group filter must not be null, use GroupFilter.all()");
        }
        int nEdges = getNumEdges();
        List<Integer> selected = new ArrayList<>();
        for (int e = 0; e < nEdges; e++) {
            if (filter.matches(getEdgeGroup(e))) {
                checkEdgePotential(e, pot);
                selected.add(e);
            }
        }
        if (selected.isEmpty()) {
            return 0;
        }
        double[] flat = flatten(pot);
        for (int e : selected) {
            storeEdge(e, flat.clone());
        }
        return selected.size();
    }

    @Override
    public void setEdge(int edge, double[][] pot) {
        checkEdge(edge);
        checkEdgePotential(edge, pot);
        storeEdge(edge, flatten(pot));
    }

    @Override
    public double[][] getEdge(int edge) {
        checkEdge(edge);
        double[] flat = loadEdge(edge);
        if (flat == null) {
            return null;
        }
        int rows = getNumStates(getEdgeSrc(edge));
        int cols = getNumStates(getEdgeDst(edge));
        double[][] pot = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(flat, r * cols, pot[r], 0, cols);
        }
        return pot;
    }

    @Override
    public void setNode(int node, double[] pot) {
        checkNode(node);
        if (pot == null || pot.length != getNumStates(node)) {
            throw new IllegalArgumentException("Node " + node + " expects a potential of length "
                    + getNumStates(node) + ", got " + (pot == null ? "null" : pot.length));
        }
        for (double v : pot) {
            checkValue(v);
        }
        storeNode(node, pot.clone());
    }

    @Override
    public double[] getNode(int node) {
        checkNode(node);
        double[] pot = loadNode(node);
        return pot == null ? null : pot.clone();
    }

    // The stored array is owned by the graph after this call.
    protected abstract void storeEdge(int edge, double[] flatPot);

    protected abstract double[] loadEdge(int edge);

    protected abstract void storeNode(int node, double[] pot);

    protected abstract double[] loadNode(int node);

    protected void checkNode(int node) {
        if (node < 0 || node >= getNumNodes()) {
            throw new IllegalArgumentException("Node id out of range: " + node + " (nodes: " + getNumNodes() + ")");
        }
    }

    protected void checkEdge(int edge) {
        if (edge < 0 || edge >= getNumEdges()) {
            throw new IllegalArgumentException("Edge id out of range: " + edge + " (edges: " + getNumEdges() + ")");
        }
    }

    protected void checkNewEdge(int src, int dst, int group) {
        checkNode(src);
        checkNode(dst);
        if (src == dst) {
            throw new IllegalArgumentException("Self-loop on node " + src);
        }
        checkGroup(group);
    }

    protected static void checkGroup(int group) {
        if (group < 0) {
            throw new IllegalArgumentException("Edge group must be non-negative: " + group);
        }
    }

    protected static void checkStates(int numStates) {
        if (numStates <= 0) {
            throw new IllegalArgumentException("Number of states must be positive: " + numStates);
        }
    }

    private void checkEdgePotential(int edge, double[][] pot) {
        int rows = getNumStates(getEdgeSrc(edge));
        int cols = getNumStates(getEdgeDst(edge));
        if (pot == null || pot.length != rows) {
            throw new IllegalArgumentException("Edge " + edge + " expects a " + rows + "x" + cols
                    + " potential, got " + (pot == null ? "null" : pot.length + " rows"));
        }
        for (double[] row : pot) {
            if (row == null || row.length != cols) {
                throw new IllegalArgumentException("Edge " + edge + " expects a " + rows + "x" + cols
                        + " potential, got a row of length " + (row == null ? "null" : row.length));
            }
            for (double v : row) {
                checkValue(v);
            }
        }
    }

    private static void checkValue(double v) {
        if (!(v >= 0.0) || Double.isInfinite(v)) {
            throw new IllegalArgumentException("Potentials must be finite and non-negative, got " + v);
        }
    }

    private static double[] flatten(double[][] pot) {
        int cols = pot.length == 0 ? 0 : pot[0].length;
        double[] flat = new double[pot.length * cols];
        for (int r = 0; r < pot.length; r++) {
            System.arraycopy(pot[r], 0, flat, r * cols, cols);
        }
        return flat;
    }
}
