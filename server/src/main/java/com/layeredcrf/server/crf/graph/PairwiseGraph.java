package com.layeredcrf.server.crf.graph;

/**
 * Storage for a pairwise graphical model: nodes carrying a potential vector and
 * undirected edges carrying a potential matrix and a group id.
 *
 * Node ids and edge ids are handed out consecutively from 0 and stay valid
 * until the next {@link #reset()}. Potentials that were never assigned read as
 * {@code null}. An edge potential is a {@code states(src) x states(dst)}
 * matrix.
 */
public interface PairwiseGraph {

    // Removes every node and edge.
    void reset();

    /**
     * Capacity hint ahead of a bulk build. Implementations may ignore it.
     */
    default void reserve(int numNodes, int numEdges) {
    }

    // Default number of states for nodes added with addNode().
    int getNumStates();

    default int addNode() {
        return addNode(getNumStates());
    }

    int addNode(int numStates);

    void setNode(int node, double[] pot);

    double[] getNode(int node);

    int getNumStates(int node);

    int getNumNodes();

    int addEdge(int src, int dst, int group);

    void setEdge(int edge, double[][] pot);

    double[][] getEdge(int edge);

    /**
     * Writes {@code pot} to every edge selected by {@code filter}. Dimensions are
     * checked against every selected edge before anything is written.
     *
     * @return the number of edges written
     */
    int setEdges(GroupFilter filter, double[][] pot);

    int getEdgeSrc(int edge);

    int getEdgeDst(int edge);

    int getEdgeGroup(int edge);

    void setEdgeGroup(int edge, int group);

    int getNumEdges();

    // Ids of all edges touching the node, in insertion order.
    int[] getAdjacentEdges(int node);
}
