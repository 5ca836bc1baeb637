package com.layeredcrf.server.crf.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph kept as node and edge objects, each node holding the list of edges that
 * touch it. Adjacency queries are cheap; memory per edge is higher than in
 * {@link ArrayPairwiseGraph}.
 */
public class AdjacencyPairwiseGraph extends AbstractPairwiseGraph {

    private static class Node {
        final int numStates;
        final List<Edge> edges = new ArrayList<>();
        volatile double[] pot;

        Node(int numStates) {
            this.numStates = numStates;
        }
    }

    private static class Edge {
        final int id;
        final int srcId;
        final int dstId;
        int group;
        volatile double[] pot;

        Edge(int id, int srcId, int dstId, int group) {
            this.id = id;
            this.srcId = srcId;
            this.dstId = dstId;
            this.group = group;
        }
    }

    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    public AdjacencyPairwiseGraph(int numStates) {
        super(numStates);
    }

    @Override
    public void reset() {
        nodes.clear();
        edges.clear();
    }

    @Override
    public void reserve(int numNodes, int numEdges) {
        ((ArrayList<Node>) nodes).ensureCapacity(numNodes);
        ((ArrayList<Edge>) edges).ensureCapacity(numEdges);
    }

    @Override
    public int addNode(int numStates) {
        checkStates(numStates);
        nodes.add(new Node(numStates));
        return nodes.size() - 1;
    }

    @Override
    public int getNumStates(int node) {
        checkNode(node);
        return nodes.get(node).numStates;
    }

    @Override
    public int getNumNodes() {
        return nodes.size();
    }

    @Override
    public int addEdge(int src, int dst, int group) {
        checkNewEdge(src, dst, group);
        Edge edge = new Edge(edges.size(), src, dst, group);
        edges.add(edge);
        nodes.get(src).edges.add(edge);
        nodes.get(dst).edges.add(edge);
        return edge.id;
    }

    @Override
    public int getEdgeSrc(int edge) {
        checkEdge(edge);
        return edges.get(edge).srcId;
    }

    @Override
    public int getEdgeDst(int edge) {
        checkEdge(edge);
        return edges.get(edge).dstId;
    }

    @Override
    public int getEdgeGroup(int edge) {
        checkEdge(edge);
        return edges.get(edge).group;
    }

    @Override
    public void setEdgeGroup(int edge, int group) {
        checkEdge(edge);
        checkGroup(group);
        edges.get(edge).group = group;
    }

    @Override
    public int getNumEdges() {
        return edges.size();
    }

    @Override
    public int[] getAdjacentEdges(int node) {
        checkNode(node);
        List<Edge> adjacent = nodes.get(node).edges;
        int[] ids = new int[adjacent.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = adjacent.get(i).id;
        }
        return ids;
    }

    @Override
    protected void storeEdge(int edge, double[] flatPot) {
        edges.get(edge).pot = flatPot;
    }

    @Override
    protected double[] loadEdge(int edge) {
        return edges.get(edge).pot;
    }

    @Override
    protected void storeNode(int node, double[] pot) {
        nodes.get(node).pot = pot;
    }

    @Override
    protected double[] loadNode(int node) {
        return nodes.get(node).pot;
    }
}
