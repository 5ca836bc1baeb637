package com.layeredcrf.server.crf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.layeredcrf.server.crf.graph.AdjacencyPairwiseGraph;
import com.layeredcrf.server.crf.graph.ArrayPairwiseGraph;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

public class LayeredGraphFactoryTest {

    @Test
    public void testConfigParsing() throws Exception {
        String json = "{ \"layers\": 3, \"edges\": [\"grid\", \"DIAG\", \"link\"], \"statesBase\": 4, "
                + "\"statesOccl\": 2, \"backend\": \"adjacency\", \"parallel\": true, "
                + "\"defaultEdgeModel\": { \"val\": 50.0 } }";
        LayeredGraphFactory.ConfigRoot config = new ObjectMapper().readValue(json,
                LayeredGraphFactory.ConfigRoot.class);

        GraphLayeredExt ext = LayeredGraphFactory.create(config);
        assertEquals(3, ext.getNumLayers());
        assertEquals(EnumSet.allOf(EdgesType.class), ext.getType());
        assertEquals(4, ext.getNumStates(0));
        assertEquals(2, ext.getNumStates(2));
        assertTrue(ext.isParallel());
        assertTrue(ext.getGraph() instanceof AdjacencyPairwiseGraph);
        assertEquals(50.0, config.defaultEdgeModel.val);
        assertNull(config.defaultEdgeModel.weight);
    }

    @Test
    public void testDefaults() {
        GraphLayeredExt ext = LayeredGraphFactory.create(new LayeredGraphFactory.ConfigRoot());
        assertEquals(2, ext.getNumLayers());
        assertEquals(EnumSet.of(EdgesType.GRID), ext.getType());
        assertEquals(2, ext.getNumStates(1));
        assertFalse(ext.isParallel());
        assertTrue(ext.getGraph() instanceof ArrayPairwiseGraph);
    }

    @Test
    public void testBackendSelection() {
        assertTrue(LayeredGraphFactory.createBackingGraph(null, 2) instanceof ArrayPairwiseGraph);
        assertTrue(LayeredGraphFactory.createBackingGraph("Adjacency", 2) instanceof AdjacencyPairwiseGraph);
        assertTrue(LayeredGraphFactory.createBackingGraph("foobar", 2) instanceof ArrayPairwiseGraph,
                "Unknown backend should fall back to the array graph");
    }

    @Test
    public void testUnknownEdgeTypeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> LayeredGraphFactory.parseEdges(Arrays.asList("GRID", "HEX")));
    }

    @Test
    public void testEdgeTypeMasks() {
        assertEquals(7, EdgesType.toMask(EnumSet.allOf(EdgesType.class)));
        assertEquals(EnumSet.of(EdgesType.GRID, EdgesType.LINK), EdgesType.fromMask(5));
        assertTrue(EdgesType.fromMask(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> EdgesType.fromMask(8));
    }
}
