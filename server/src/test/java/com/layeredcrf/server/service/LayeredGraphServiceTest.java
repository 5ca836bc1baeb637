package com.layeredcrf.server.service;

import com.layeredcrf.server.crf.GraphLayeredExt;
import com.layeredcrf.server.crf.LayeredGraphFactory;
import com.layeredcrf.server.crf.feature.FeatureMap;
import com.layeredcrf.server.crf.feature.MultiChannelFeatureMap;
import com.layeredcrf.server.crf.feature.PotentialMap;
import com.layeredcrf.server.crf.graph.PairwiseGraph;
import com.layeredcrf.server.crf.training.CooccurrenceEdgeTrainer;
import com.layeredcrf.server.crf.training.CooccurrenceLinkTrainer;
import com.layeredcrf.server.crf.training.PottsEdgeTrainer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LayeredGraphServiceTest {

    @TempDir
    Path tempDir;

    private LayeredGraphService singleLayerService() {
        LayeredGraphFactory.ConfigRoot config = new LayeredGraphFactory.ConfigRoot();
        config.layers = 1;
        config.edges = Collections.singletonList("GRID");
        config.statesBase = 2;
        config.statesOccl = 3;
        return new LayeredGraphService(config, tempDir.resolve("edge_models.db").toString());
    }

    private static FeatureMap features2x2() {
        return new MultiChannelFeatureMap(2, 2, 1, new double[] { 0, 1, 2, 3 });
    }

    private static FeatureMap constantFeatures3x3() {
        double[] data = new double[9];
        Arrays.fill(data, 4);
        return new MultiChannelFeatureMap(3, 3, 1, data);
    }

    // Node ids of a 3x3 grid below 9 are in the base layer
    private static void assertLayerDiagonals(GraphLayeredExt ext, double base, double occl) {
        PairwiseGraph graph = ext.getGraph();
        for (int e = 0; e < graph.getNumEdges(); e++) {
            double[][] pot = graph.getEdge(e);
            if (ext.isLink(e)) {
                assertNull(pot);
            } else if (graph.getEdgeSrc(e) < 9) {
                assertEquals(2, pot.length);
                assertEquals(base, pot[1][1], 1e-9);
                assertEquals(1.0, pot[0][1], 1e-9);
            } else {
                assertEquals(3, pot.length);
                assertEquals(occl, pot[2][2], 1e-9);
                assertEquals(1.0, pot[2][0], 1e-9);
            }
        }
    }

    @Test
    public void testConfigLoadedFromClasspath() {
        LayeredGraphService service = new LayeredGraphService();
        LayeredGraphFactory.ConfigRoot config = service.getConfig();
        assertEquals(2, config.layers);
        assertEquals(Arrays.asList("GRID", "LINK"), config.edges);
        assertEquals(2, config.statesBase);
        assertEquals(3, config.statesOccl);
        assertEquals(100.0, config.defaultEdgeModel.val);
    }

    @Test
    public void testDescribeTopology() {
        LayeredGraphService service = new LayeredGraphService();
        TopologySummary summary = service.describeTopology(3, 3, null);
        assertEquals(18, summary.getNodes());
        assertEquals(33, summary.getEdges());
        assertEquals(9, summary.getLinks());
        assertEquals(24, summary.getEdgesPerGroup().get(0));
        assertEquals(9, summary.getEdgesPerGroup().get(1));
    }

    @Test
    public void testDescribeTopologyWithLine() {
        LayeredGraphService service = new LayeredGraphService();
        LayeredGraphService.EdgeLine line = new LayeredGraphService.EdgeLine();
        line.a = 1;
        line.c = -1.5;
        line.group = 2;

        TopologySummary summary = service.describeTopology(4, 3, line);
        assertEquals(46, summary.getEdges());
        assertEquals(28, summary.getEdgesPerGroup().get(0));
        assertEquals(12, summary.getEdgesPerGroup().get(1));
        assertEquals(6, summary.getEdgesPerGroup().get(2));
    }

    @Test
    public void testAssembleWithDefaultModel() {
        LayeredGraphService service = new LayeredGraphService();
        GraphLayeredExt ext = service.assemble(PotentialMap.uniform(3, 3, new double[] { 0.5, 0.5 }),
                PotentialMap.uniform(3, 3, new double[] { 1, 1, 1 }), null, null, null, null);

        PairwiseGraph graph = ext.getGraph();
        for (int e = 0; e < graph.getNumEdges(); e++) {
            double[][] pot = graph.getEdge(e);
            if (ext.isLink(e)) {
                assertNull(pot);
            } else {
                assertEquals(100.0, pot[0][0], 1e-9);
                assertEquals(1.0, pot[0][1], 1e-9);
            }
        }
        assertEquals(3, graph.getNode(ext.getNodeIndex(0, 0, 1)).length);
    }

    @Test
    public void testTrainSaveLoadEdgeModel() {
        LayeredGraphService service = singleLayerService();
        int[][] gt = { { 0, 1 }, { 1, 1 } };
        CooccurrenceEdgeTrainer trained = service.trainEdgeModel(Collections.singletonList(features2x2()),
                Collections.singletonList(gt));
        assertEquals(8, trained.getCounts().getTotal());
        assertEquals(4, trained.getCounts().getCount(1, 1));

        service.saveEdgeModel("toy", trained);
        Optional<CooccurrenceEdgeTrainer> loaded = service.loadEdgeModel("toy");
        assertTrue(loaded.isPresent());
        double[][] expected = trained.calculateEdgePotentials(null, null, null);
        double[][] actual = loaded.get().calculateEdgePotentials(null, null, null);
        for (int r = 0; r < expected.length; r++) {
            assertArrayEquals(expected[r], actual[r], 1e-12);
        }

        assertFalse(service.loadEdgeModel("missing").isPresent());

        // the trained model drives the filler
        GraphLayeredExt ext = service.assemble(PotentialMap.uniform(2, 2, new double[] { 1, 1 }), null,
                features2x2(), loaded.get(), null, null);
        assertArrayEquals(actual[1], ext.getGraph().getEdge(0)[1], 1e-12);
    }

    @Test
    public void testTrainSaveLoadLinkModel() {
        LayeredGraphService service = singleLayerService();
        List<int[][]> base = Collections.singletonList(new int[][] { { 0, 1 }, { 1, 1 } });
        List<int[][]> occl = Collections.singletonList(new int[][] { { 2, 2 }, { 0, 2 } });
        CooccurrenceLinkTrainer trained = service.trainLinkModel(Collections.singletonList(features2x2()), base,
                occl);
        assertEquals(4, trained.getCounts().getTotal());
        assertEquals(2, trained.getCounts().getCount(1, 2));

        service.saveLinkModel("toy", trained);
        CooccurrenceLinkTrainer loaded = service.loadLinkModel("toy").orElseThrow();
        assertEquals(2, loaded.getCounts().getRows());
        assertEquals(3, loaded.getCounts().getCols());
        assertArrayEquals(trained.calculateLinkPotentials(null)[1], loaded.calculateLinkPotentials(null)[1], 1e-12);
    }

    @Test
    public void testTrainingInputsMustPair() {
        LayeredGraphService service = singleLayerService();
        assertThrows(IllegalArgumentException.class,
                () -> service.trainEdgeModel(Collections.singletonList(features2x2()), Collections.emptyList()));
    }

    @Test
    public void testAssembleWithBaseTrainerKeepsDefaultOcclusionModel() {
        LayeredGraphService service = new LayeredGraphService();
        GraphLayeredExt ext = service.assemble(PotentialMap.uniform(3, 3, new double[] { 0.5, 0.5 }),
                PotentialMap.uniform(3, 3, new double[] { 1, 1, 1 }), constantFeatures3x3(),
                new PottsEdgeTrainer(2), null, new double[] { 10 });
        assertLayerDiagonals(ext, 10, 100);
    }

    @Test
    public void testAssembleWithOcclusionTrainer() {
        LayeredGraphService service = new LayeredGraphService();
        GraphLayeredExt ext = service.assemble(PotentialMap.uniform(3, 3, new double[] { 0.5, 0.5 }),
                PotentialMap.uniform(3, 3, new double[] { 1, 1, 1 }), constantFeatures3x3(),
                new PottsEdgeTrainer(2), new PottsEdgeTrainer(3), null, new double[] { 10 });
        assertLayerDiagonals(ext, 10, 10);

        assertThrows(IllegalArgumentException.class,
                () -> service.assemble(PotentialMap.uniform(3, 3, new double[] { 0.5, 0.5 }), null,
                        constantFeatures3x3(), new PottsEdgeTrainer(2), new PottsEdgeTrainer(2), null,
                        new double[] { 10 }));
    }

    @Test
    public void testTrainOcclusionEdgeModel() {
        LayeredGraphService service = singleLayerService();
        int[][] gt = { { 2, 2 }, { 0, 2 } };
        CooccurrenceEdgeTrainer trained = service.trainEdgeModel(Collections.singletonList(features2x2()),
                Collections.singletonList(gt), 1);
        assertEquals(3, trained.getNumStates());
        assertEquals(8, trained.getCounts().getTotal());
        assertEquals(4, trained.getCounts().getCount(2, 2));

        assertThrows(IllegalArgumentException.class, () -> service.trainEdgeModel(
                Collections.singletonList(features2x2()), Collections.singletonList(gt), -1));
    }

    @Test
    public void testLinkModelKeepsUpperLevels() {
        LayeredGraphService service = singleLayerService();
        CooccurrenceLinkTrainer trained = service.trainLinkModel(Collections.singletonList(features2x2()),
                Collections.singletonList(new int[][] { { 0, 1 }, { 1, 1 } }),
                Collections.singletonList(new int[][] { { 2, 2 }, { 0, 2 } }));
        trained.addFeatureVecs(new double[] { 0 }, 2, 1, 1);
        trained.addFeatureVecs(new double[] { 0 }, 2, 1, 1);
        trained.train();

        service.saveLinkModel("layers", trained);
        CooccurrenceLinkTrainer loaded = service.loadLinkModel("layers").orElseThrow();
        assertEquals(2, loaded.getUpperCounts().getTotal());
        assertEquals(2, loaded.getUpperCounts().getCount(2, 1));
        assertArrayEquals(trained.calculateLinkPotentials(null, 1)[2], loaded.calculateLinkPotentials(null, 1)[2],
                1e-12);
    }
}
