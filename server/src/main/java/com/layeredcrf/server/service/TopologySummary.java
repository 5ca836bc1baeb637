package com.layeredcrf.server.service;

import java.util.Map;

public class TopologySummary {
    private final int width;
    private final int height;
    private final int layers;
    private final int nodes;
    private final int edges;
    private final int links;
    private final Map<Integer, Integer> edgesPerGroup;

    public TopologySummary(int width, int height, int layers, int nodes, int edges, int links,
            Map<Integer, Integer> edgesPerGroup) {
        this.width = width;
        this.height = height;
        this.layers = layers;
        this.nodes = nodes;
        this.edges = edges;
        this.links = links;
        this.edgesPerGroup = edgesPerGroup;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getLayers() {
        return layers;
    }

    public int getNodes() {
        return nodes;
    }

    public int getEdges() {
        return edges;
    }

    public int getLinks() {
        return links;
    }

    public Map<Integer, Integer> getEdgesPerGroup() {
        return edgesPerGroup;
    }

    @Override
    public String toString() {
        return "TopologySummary{" + width + "x" + height + "x" + layers +
                ", nodes=" + nodes +
                ", edges=" + edges +
                ", links=" + links +
                ", groups=" + edgesPerGroup +
                '}';
    }
}
