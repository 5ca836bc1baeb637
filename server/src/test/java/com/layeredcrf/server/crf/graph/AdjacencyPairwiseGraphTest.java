package com.layeredcrf.server.crf.graph;

public class AdjacencyPairwiseGraphTest extends PairwiseGraphContract {

    @Override
    protected PairwiseGraph newGraph(int numStates) {
        return new AdjacencyPairwiseGraph(numStates);
    }
}
