package com.layeredcrf.server.crf.graph;

import java.util.Arrays;

/**
 * Dense graph backed by parallel primitive arrays. Suited to grid models with
 * millions of edges: an edge costs three ints plus its potential.
 *
 * Writes to distinct nodes or distinct edges may run concurrently, and so may
 * adjacency queries; structural changes (addNode, addEdge, reset) may not.
 */
public class ArrayPairwiseGraph extends AbstractPairwiseGraph {

    private static final int INITIAL_CAPACITY = 16;

    private int[] nodeStates = new int[INITIAL_CAPACITY];
    private double[][] nodePots = new double[INITIAL_CAPACITY][];
    private int numNodes = 0;

    private int[] edgeSrc = new int[INITIAL_CAPACITY];
    private int[] edgeDst = new int[INITIAL_CAPACITY];
    private int[] edgeGroup = new int[INITIAL_CAPACITY];
    private double[][] edgePots = new double[INITIAL_CAPACITY][];
    private int numEdges = 0;

    // CSR adjacency, rebuilt on demand after structural changes
    private static final class Adjacency {
        final int[] offsets;
        final int[] edges;

        Adjacency(int[] offsets, int[] edges) {
            this.offsets = offsets;
            this.edges = edges;
        }
    }

    private volatile Adjacency adjacency = null;

    public ArrayPairwiseGraph(int numStates) {
        super(numStates);
    }

    @Override
    public void reset() {
        nodeStates = new int[INITIAL_CAPACITY];
        nodePots = new double[INITIAL_CAPACITY][];
        numNodes = 0;
        edgeSrc = new int[INITIAL_CAPACITY];
        edgeDst = new int[INITIAL_CAPACITY];
        edgeGroup = new int[INITIAL_CAPACITY];
        edgePots = new double[INITIAL_CAPACITY][];
        numEdges = 0;
        invalidateAdjacency();
    }

    @Override
    public void reserve(int nNodes, int nEdges) {
        ensureNodeCapacity(nNodes);
        ensureEdgeCapacity(nEdges);
    }

    @Override
    public int addNode(int numStates) {
        checkStates(numStates);
        ensureNodeCapacity(numNodes + 1);
        nodeStates[numNodes] = numStates;
        invalidateAdjacency();
        return numNodes++;
    }

    @Override
    public int getNumStates(int node) {
        checkNode(node);
        return nodeStates[node];
    }

    @Override
    public int getNumNodes() {
        return numNodes;
    }

    @Override
    public int addEdge(int src, int dst, int group) {
        checkNewEdge(src, dst, group);
        ensureEdgeCapacity(numEdges + 1);
        edgeSrc[numEdges] = src;
        edgeDst[numEdges] = dst;
        edgeGroup[numEdges] = group;
        invalidateAdjacency();
        return numEdges++;
    }

    @Override
    public int getEdgeSrc(int edge) {
        checkEdge(edge);
        return edgeSrc[edge];
    }

    @Override
    public int getEdgeDst(int edge) {
        checkEdge(edge);
        return edgeDst[edge];
    }

    @Override
    public int getEdgeGroup(int edge) {
        checkEdge(edge);
        return edgeGroup[edge];
    }

    @Override
    public void setEdgeGroup(int edge, int group) {
        checkEdge(edge);
        checkGroup(group);
        edgeGroup[edge] = group;
    }

    @Override
    public int getNumEdges() {
        return numEdges;
    }

    @Override
    public int[] getAdjacentEdges(int node) {
        checkNode(node);
        Adjacency adj = adjacency;
        if (adj == null) {
            adj = buildAdjacency();
            adjacency = adj;
        }
        return Arrays.copyOfRange(adj.edges, adj.offsets[node], adj.offsets[node + 1]);
    }

    @Override
    protected void storeEdge(int edge, double[] flatPot) {
        edgePots[edge] = flatPot;
    }

    @Override
    protected double[] loadEdge(int edge) {
        return edgePots[edge];
    }

    @Override
    protected void storeNode(int node, double[] pot) {
        nodePots[node] = pot;
    }

    @Override
    protected double[] loadNode(int node) {
        return nodePots[node];
    }

    private Adjacency buildAdjacency() {
        int[] offsets = new int[numNodes + 1];
        for (int e = 0; e < numEdges; e++) {
            offsets[edgeSrc[e] + 1]++;
            offsets[edgeDst[e] + 1]++;
        }
        for (int n = 0; n < numNodes; n++) {
            offsets[n + 1] += offsets[n];
        }
        int[] fill = Arrays.copyOf(offsets, numNodes);
        int[] edges = new int[2 * numEdges];
        for (int e = 0; e < numEdges; e++) {
            edges[fill[edgeSrc[e]]++] = e;
            edges[fill[edgeDst[e]]++] = e;
        }
        return new Adjacency(offsets, edges);
    }

    private void invalidateAdjacency() {
        adjacency = null;
    }

    private void ensureNodeCapacity(int capacity) {
        if (capacity > nodeStates.length) {
            int newCapacity = Math.max(capacity, nodeStates.length * 2);
            nodeStates = Arrays.copyOf(nodeStates, newCapacity);
            nodePots = Arrays.copyOf(nodePots, newCapacity);
        }
    }

    private void ensureEdgeCapacity(int capacity) {
        if (capacity > edgeSrc.length) {
            int newCapacity = (int) Math.min(Integer.MAX_VALUE - 8, Math.max(capacity, edgeSrc.length * 2L));
            edgeSrc = Arrays.copyOf(edgeSrc, newCapacity);
            edgeDst = Arrays.copyOf(edgeDst, newCapacity);
            edgeGroup = Arrays.copyOf(edgeGroup, newCapacity);
            edgePots = Arrays.copyOf(edgePots, newCapacity);
        }
    }
}
