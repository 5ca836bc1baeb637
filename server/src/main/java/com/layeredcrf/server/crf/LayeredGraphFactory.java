package com.layeredcrf.server.crf;

import com.layeredcrf.server.crf.graph.AdjacencyPairwiseGraph;
import com.layeredcrf.server.crf.graph.ArrayPairwiseGraph;
import com.layeredcrf.server.crf.graph.PairwiseGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Creates layered graphs from the JSON configuration ({@code crf_config.json}).
 */
public class LayeredGraphFactory {

    private static final Logger logger = LoggerFactory.getLogger(LayeredGraphFactory.class);

    public static class DefaultEdgeModelConfig {
        public Double val;
        public Double weight;
    }

    public static class ConfigRoot {
        public Integer layers;
        public List<String> edges;
        public Integer statesBase;
        public Integer statesOccl;
        public String backend = "array";
        public Boolean parallel;
        public DefaultEdgeModelConfig defaultEdgeModel;
        public Double edgeWeight;
        public Double linkWeight;
        public String data_directory;
    }

    public static GraphLayeredExt create(ConfigRoot config) {
        int layers = config != null && config.layers != null ? config.layers : 2;
        int statesBase = config != null && config.statesBase != null ? config.statesBase : 2;
        int statesOccl = config != null && config.statesOccl != null ? config.statesOccl : statesBase;
        Set<EdgesType> type = parseEdges(config != null ? config.edges : null);

        PairwiseGraph graph = createBackingGraph(config != null ? config.backend : null,
                Math.max(statesBase, statesOccl));
        GraphLayeredExt ext = new GraphLayeredExt(graph, layers, type, statesBase, statesOccl);
        ext.setParallel(config != null && Boolean.TRUE.equals(config.parallel));
        logger.debug("Created {}-layer graph, edges={}, states={}/{}, backend={}", layers, type, statesBase,
                statesOccl, graph.getClass().getSimpleName());
        return ext;
    }

    public static PairwiseGraph createBackingGraph(String backend, int numStates) {
        String name = backend;
        if (name == null || name.trim().isEmpty()) {
            name = "array";
        }
        switch (name.toLowerCase()) {
            case "array":
                return new ArrayPairwiseGraph(numStates);
            case "adjacency":
                return new AdjacencyPairwiseGraph(numStates);
            default:
                logger.warn("Unknown graph backend '{}', defaulting to 'array'", backend);
                return new ArrayPairwiseGraph(numStates);
        }
    }

    // Missing or empty list means grid edges only.
    public static Set<EdgesType> parseEdges(List<String> names) {
        if (names == null || names.isEmpty()) {
            return EnumSet.of(EdgesType.GRID);
        }
        EnumSet<EdgesType> type = EnumSet.noneOf(EdgesType.class);
        for (String n : names) {
            try {
                type.add(EdgesType.valueOf(n.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown edge type '" + n + "', expected one of GRID, DIAG, LINK", e);
            }
        }
        return type;
    }
}
