package com.layeredcrf.server.crf;

import com.layeredcrf.server.crf.feature.FeatureMap;
import com.layeredcrf.server.crf.feature.PotentialMap;
import com.layeredcrf.server.crf.graph.GroupFilter;
import com.layeredcrf.server.crf.graph.PairwiseGraph;
import com.layeredcrf.server.crf.training.EdgePotentials;
import com.layeredcrf.server.crf.training.EdgeTrainer;
import com.layeredcrf.server.crf.training.LinkTrainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Multi-layer pairwise graph over a 2D image, used for labeling partially
 * occluded regions. Layer 0 is the base (visible) layer; every further layer is
 * an occlusion layer. Nodes of one layer are the pixel sites; links connect the
 * same site in adjacent layers.
 *
 * <p>
 * The backing {@link PairwiseGraph} is borrowed, not owned: the caller keeps
 * it alive and must not change its structure behind this object's back.
 * Intra-layer edges are built with group 0, links with group 1.
 * </p>
 *
 * <p>
 * Not thread-safe. With {@link #setParallel(boolean)} enabled, the per-site
 * and per-edge passes run on a parallel stream; each unit of work writes one
 * node or one edge.
 * </p>
 */
public class GraphLayeredExt {

    private static final Logger logger = LoggerFactory.getLogger(GraphLayeredExt.class);

    private final PairwiseGraph graph;
    private final int nLayers;
    private final Set<EdgesType> type;
    private final int statesBase;
    private final int statesOccl;

    private GridSize size = GridSize.EMPTY;
    private GridTopology topology;
    private boolean parallel = false;

    public GraphLayeredExt(PairwiseGraph graph, int nLayers) {
        this(graph, nLayers, EnumSet.of(EdgesType.GRID));
    }

    public GraphLayeredExt(PairwiseGraph graph, int nLayers, Set<EdgesType> type) {
        this(graph, nLayers, type, graph.getNumStates(), graph.getNumStates());
    }

    /**
     * @param graph      the backing graph; it is reset by every build
     * @param nLayers    number of layers, at least 1
     * @param type       edge classes to build
     * @param statesBase number of states of the base layer nodes
     * @param statesOccl number of states of the nodes in layers 1 and above
     */
    public GraphLayeredExt(PairwiseGraph graph, int nLayers, Set<EdgesType> type, int statesBase, int statesOccl) {
        if (graph == null) {
            throw new IllegalArgumentException("Backing graph must not be null");
        }
        if (nLayers <= 0) {
            throw new IllegalArgumentException("Number of layers must be positive: " + nLayers);
        }
        if (statesBase <= 0 || statesOccl <= 0) {
            throw new IllegalArgumentException(
                    "Number of states must be positive: base=" + statesBase + ", occl=" + statesOccl);
        }
        this.graph = graph;
        this.nLayers = nLayers;
        EnumSet<EdgesType> types = EnumSet.noneOf(EdgesType.class);
        types.addAll(type);
        this.type = Collections.unmodifiableSet(types);
        this.statesBase = statesBase;
        this.statesOccl = statesOccl;
        this.topology = new GridTopology(0, 0, nLayers, this.type);
    }

    public void buildGraph(GridSize graphSize) {
        buildGraph(graphSize.getWidth(), graphSize.getHeight());
    }

    /**
     * Builds the graph for an image of {@code width x height} pixels. Any
     * previous structure, including all potentials, is discarded. A zero area
     * leaves the graph empty.
     */
    public void buildGraph(int width, int height) {
        GridTopology topo = new GridTopology(width, height, nLayers, type);
        long nNodes = topo.numNodes();
        long nEdges = topo.numEdges();
        if (nNodes > Integer.MAX_VALUE || nEdges > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Graph of size " + width + "x" + height + "x" + nLayers
                    + " exceeds the addressable node/edge range (" + nNodes + " nodes, " + nEdges + " edges)");
        }

        long startTime = System.currentTimeMillis();
        graph.reset();
        topology = topo;
        size = new GridSize(width, height);
        if (size.isEmpty()) {
            logger.debug("Empty graph size {}, graph left empty", size);
            return;
        }

        graph.reserve((int) nNodes, (int) nEdges);
        int expected = 0;
        for (int l = 0; l < nLayers; l++) {
            int nStates = getNumStates(l);
            for (int i = 0; i < size.area(); i++) {
                int id = graph.addNode(nStates);
                if (id != expected) {
                    throw new IllegalStateException("Backing graph returned node id " + id + ", expected " + expected);
                }
                expected++;
            }
        }
        topo.forEachEdge(graph::addEdge);

        logger.info("Built {}-layer graph {}: {} nodes, {} edges ({} links) in {} ms", nLayers, size, nNodes,
                nEdges, topo.numLinkEdges(), System.currentTimeMillis() - startTime);
    }

    /**
     * Moves every edge crossing the line {@code A*x + B*y + C = 0} into
     * {@code group}. An edge crosses the line when the sign of the line equation
     * differs between its two end sites; layers are ignored, so links never
     * cross. Nothing is moved while the graph is not built.
     *
     * @return the number of edges moved
     */
    public int defineEdgeGroup(double a, double b, double c, int group) {
        if (a == 0 && b == 0) {
            throw new IllegalArgumentException("Line coefficients A and B must not both be zero");
        }
        if (group < 0) {
            throw new IllegalArgumentException("Edge group must be non-negative: " + group);
        }
        if (size.isEmpty()) {
            return 0;
        }
        int moved = 0;
        int nEdges = graph.getNumEdges();
        for (int e = 0; e < nEdges; e++) {
            int src = graph.getEdgeSrc(e);
            int dst = graph.getEdgeDst(e);
            double s = Math.signum(a * topology.xOf(src) + b * topology.yOf(src) + c);
            double d = Math.signum(a * topology.xOf(dst) + b * topology.yOf(dst) + c);
            if (s != d) {
                graph.setEdgeGroup(e, group);
                moved++;
            }
        }
        logger.debug("Line {}x + {}y + {} = 0: {} edges moved to group {}", a, b, c, moved, group);
        return moved;
    }

    /**
     * Writes {@code pot} to the edges selected by {@code filter}.
     *
     * @return the number of edges written
     */
    public int setEdges(GroupFilter filter, double[][] pot) {
        requireBuilt("setEdges");
        int written = graph.setEdges(filter, pot);
        logger.debug("setEdges {}: {} edges written", filter, written);
        return written;
    }

    /**
     * Fills the base layer nodes with {@code pots}. Builds the graph with the
     * size of {@code pots} when nothing has been built yet.
     */
    public void setGraph(PotentialMap pots) {
        checkNodePotentials(pots, 0);
        if (size.isEmpty()) {
            buildGraph(pots.getWidth(), pots.getHeight());
        }
        fillLayer(pots, 0);
    }

    /**
     * Fills the base layer with {@code potBase} and every occlusion layer with
     * {@code potOccl}. Builds the graph with the size of {@code potBase} when
     * nothing has been built yet.
     */
    public void setGraph(PotentialMap potBase, PotentialMap potOccl) {
        if (nLayers < 2) {
            throw new IllegalStateException("Occlusion potentials need at least 2 layers, graph has " + nLayers);
        }
        checkNodePotentials(potBase, 0);
        checkNodePotentials(potOccl, 1);
        if (potBase.getWidth() != potOccl.getWidth() || potBase.getHeight() != potOccl.getHeight()) {
            throw new IllegalArgumentException("Base and occlusion potentials differ in size: "
                    + potBase.getWidth() + "x" + potBase.getHeight() + " vs "
                    + potOccl.getWidth() + "x" + potOccl.getHeight());
        }
        if (size.isEmpty()) {
            buildGraph(potBase.getWidth(), potBase.getHeight());
        }
        fillLayer(potBase, 0);
        for (int l = 1; l < nLayers; l++) {
            fillLayer(potOccl, l);
        }
    }

    /**
     * Data-independent Potts model on every intra-layer edge: {@code val^weight}
     * on the diagonal, 1 elsewhere. Links are not touched.
     *
     * @param val    at least 1, so equal labels are never penalized
     * @param weight non-negative exponent applied to {@code val}
     */
    public void addDefaultEdgesModel(double val, double weight) {
        requireBuilt("addDefaultEdgesModel");
        checkSmoothness(val, weight);
        double smoothness = Math.pow(val, weight);
        Map<Integer, double[][]> potByStates = new HashMap<>();
        int written = 0;
        int nEdges = graph.getNumEdges();
        for (int e = 0; e < nEdges; e++) {
            if (isLink(e)) {
                continue;
            }
            int nStates = graph.getNumStates(graph.getEdgeSrc(e));
            graph.setEdge(e, potByStates.computeIfAbsent(nStates, n -> EdgePotentials.potts(n, smoothness)));
            written++;
        }
        logger.debug("Default edge model val={}, weight={} set on {} edges", val, weight, written);
    }

    /**
     * Contrast-sensitive Potts model on every intra-layer edge. The diagonal is
     * {@code 1 + (val^weight - 1) * exp(-beta * d2)} where {@code d2} is the
     * squared distance between the end-site features and
     * {@code beta = 1 / (2 * mean(d2))} over all intra-layer edges (0 when every
     * distance is 0). Links are not touched.
     */
    public void addDefaultEdgesModel(FeatureMap featureVectors, double val, double weight) {
        requireBuilt("addDefaultEdgesModel");
        checkFeatureSize(featureVectors);
        checkSmoothness(val, weight);
        double smoothness = Math.pow(val, weight);
        int nEdges = graph.getNumEdges();
        long nIntra = nEdges - topology.numLinkEdges();

        IntStream edges = IntStream.range(0, nEdges);
        if (parallel) {
            edges = edges.parallel();
        }
        double sum = edges.filter(e -> !isLink(e)).mapToDouble(e -> squaredDistance(featureVectors, e)).sum();
        double mean = nIntra > 0 ? sum / nIntra : 0.0;
        double beta = mean > 0 ? 1.0 / (2.0 * mean) : 0.0;

        forEach(nEdges, e -> {
            if (isLink(e)) {
                return;
            }
            double diag = EdgePotentials.contrastSmoothness(smoothness, beta, squaredDistance(featureVectors, e));
            graph.setEdge(e, EdgePotentials.potts(graph.getNumStates(graph.getEdgeSrc(e)), diag));
        });
        logger.debug("Contrast-sensitive edge model val={}, weight={}, beta={} set on {} edges", val, weight, beta,
                nIntra);
    }

    /**
     * Hands every edge to {@code edgeTrainer} as one sample: the feature vectors
     * and the ground-truth states of its two end sites. Only single-layer graphs
     * are supported.
     *
     * @param gt ground-truth state per site, indexed [y][x]
     */
    public void addFeatureVecs(EdgeTrainer edgeTrainer, FeatureMap featureVectors, int[][] gt) {
        if (nLayers != 1) {
            throw new IllegalStateException(
                    "Feature vectors can only be sampled from a single-layer graph, this one has " + nLayers);
        }
        requireBuilt("addFeatureVecs");
        checkFeatureSize(featureVectors);
        if (gt == null || gt.length != size.getHeight()) {
            throw new IllegalArgumentException("Ground truth must have " + size.getHeight() + " rows");
        }
        for (int y = 0; y < gt.length; y++) {
            if (gt[y].length != size.getWidth()) {
                throw new IllegalArgumentException(
                        "Ground truth row " + y + " has " + gt[y].length + " sites, expected " + size.getWidth());
            }
        }

        int nFeatures = featureVectors.getNumFeatures();
        double[] f1 = new double[nFeatures];
        double[] f2 = new double[nFeatures];
        int nEdges = graph.getNumEdges();
        for (int e = 0; e < nEdges; e++) {
            int src = graph.getEdgeSrc(e);
            int dst = graph.getEdgeDst(e);
            int x1 = topology.xOf(src);
            int y1 = topology.yOf(src);
            int x2 = topology.xOf(dst);
            int y2 = topology.yOf(dst);
            featureVectors.get(x1, y1, f1);
            featureVectors.get(x2, y2, f2);
            edgeTrainer.addFeatureVecs(f1.clone(), f2.clone(), gt[y1][x1], gt[y2][x2]);
        }
        logger.debug("Added {} edge samples to {}", nEdges, edgeTrainer.getClass().getSimpleName());
    }

    public void fillEdges(EdgeTrainer edgeTrainer, LinkTrainer linkTrainer, FeatureMap featureVectors,
            double[] params) {
        fillEdges(edgeTrainer, null, linkTrainer, featureVectors, params, 1.0, 1.0);
    }

    public void fillEdges(EdgeTrainer edgeTrainer, LinkTrainer linkTrainer, FeatureMap featureVectors,
            double[] params, double edgeWeight, double linkWeight) {
        fillEdges(edgeTrainer, null, linkTrainer, featureVectors, params, edgeWeight, linkWeight);
    }

    /**
     * Overwrites the potential of every intra-layer edge with the prediction of
     * an edge trainer raised to {@code edgeWeight}, and of every link with the
     * prediction of {@code linkTrainer} raised to {@code linkWeight}.
     *
     * <p>
     * Base layer edges use {@code edgeTrainer}; edges of the occlusion layers use
     * {@code occlTrainer}. When {@code occlTrainer} is null, the occlusion layers
     * reuse {@code edgeTrainer} if it predicts their label count and keep their
     * current potentials otherwise. When {@code linkTrainer} is null, links keep
     * their current potential.
     * </p>
     *
     * <p>
     * Every prediction is computed and checked against its edge before the
     * first one is written, so a rejected call leaves the graph unchanged.
     * </p>
     */
    public void fillEdges(EdgeTrainer edgeTrainer, EdgeTrainer occlTrainer, LinkTrainer linkTrainer,
            FeatureMap featureVectors, double[] params, double edgeWeight, double linkWeight) {
        if (edgeTrainer == null) {
            throw new IllegalArgumentException("Edge trainer must not be null");
        }
        requireBuilt("fillEdges");
        checkFeatureSize(featureVectors);
        EdgeTrainer upperTrainer = occlTrainer;
        if (upperTrainer == null && edgeTrainer.getNumStates() == statesOccl) {
            upperTrainer = edgeTrainer;
        }
        if (type.contains(EdgesType.GRID) || type.contains(EdgesType.DIAG)) {
            checkTrainerStates(edgeTrainer, 0);
            if (nLayers > 1 && upperTrainer != null) {
                checkTrainerStates(upperTrainer, 1);
            }
        }

        final EdgeTrainer upperLayerTrainer = upperTrainer;
        long startTime = System.currentTimeMillis();
        int nEdges = graph.getNumEdges();
        double[][][] pots = new double[nEdges][][];
        forEach(nEdges, e -> {
            int src = graph.getEdgeSrc(e);
            int dst = graph.getEdgeDst(e);
            int layer = topology.layerOf(src);
            double[][] pot;
            double weight;
            if (layer != topology.layerOf(dst)) {
                if (linkTrainer == null) {
                    return;
                }
                double[] f = featureVectors.get(topology.xOf(src), topology.yOf(src));
                pot = linkTrainer.calculateLinkPotentials(f, layer);
                weight = linkWeight;
            } else {
                double[] f1 = featureVectors.get(topology.xOf(src), topology.yOf(src));
                double[] f2 = featureVectors.get(topology.xOf(dst), topology.yOf(dst));
                EdgeTrainer trainer = layer == 0 ? edgeTrainer : upperLayerTrainer;
                if (trainer == null) {
                    return;
                }
                pot = trainer.calculateEdgePotentials(f1, f2, params);
                weight = edgeWeight;
            }
            checkPrediction(e, pot);
            double[][] weighted = EdgePotentials.pow(pot, weight);
            if (weighted != pot) {
                // large weights can overflow
                checkPrediction(e, weighted);
            }
            pots[e] = weighted;
        });
        forEach(nEdges, e -> {
            if (pots[e] != null) {
                graph.setEdge(e, pots[e]);
            }
        });

        if (logger.isDebugEnabled()) {
            logger.debug("Filled {} edges (links {}) in {} ms", nEdges,
                    linkTrainer == null ? "skipped" : "filled", System.currentTimeMillis() - startTime);
        }
    }

    public int getNodeIndex(int x, int y, int layer) {
        if (x < 0 || x >= size.getWidth() || y < 0 || y >= size.getHeight() || layer < 0 || layer >= nLayers) {
            throw new IllegalArgumentException("Site (" + x + ", " + y + ", layer " + layer + ") is outside the "
                    + size + "x" + nLayers + " graph");
        }
        return topology.nodeIndex(x, y, layer);
    }

    // Whether the edge connects two different layers.
    public boolean isLink(int edge) {
        return topology.layerOf(graph.getEdgeSrc(edge)) != topology.layerOf(graph.getEdgeDst(edge));
    }

    public int getNumStates(int layer) {
        if (layer < 0 || layer >= nLayers) {
            throw new IllegalArgumentException("Layer out of range: " + layer);
        }
        return layer == 0 ? statesBase : statesOccl;
    }

    public GridSize getSize() {
        return size;
    }

    public Set<EdgesType> getType() {
        return type;
    }

    public int getTypeMask() {
        return EdgesType.toMask(type);
    }

    public int getNumLayers() {
        return nLayers;
    }

    public PairwiseGraph getGraph() {
        return graph;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    private void fillLayer(PotentialMap pots, int layer) {
        int width = size.getWidth();
        forEach(size.getHeight(), y -> {
            for (int x = 0; x < width; x++) {
                graph.setNode(topology.nodeIndex(x, y, layer), pots.get(x, y));
            }
        });
    }

    private double squaredDistance(FeatureMap featureVectors, int edge) {
        int src = graph.getEdgeSrc(edge);
        int dst = graph.getEdgeDst(edge);
        return EdgePotentials.squaredDistance(
                featureVectors.get(topology.xOf(src), topology.yOf(src)),
                featureVectors.get(topology.xOf(dst), topology.yOf(dst)));
    }

    private void forEach(int n, IntConsumer body) {
        if (parallel) {
            IntStream.range(0, n).parallel().forEach(body);
        } else {
            for (int i = 0; i < n; i++) {
                body.accept(i);
            }
        }
    }

    private void requireBuilt(String operation) {
        if (size.isEmpty()) {
            throw new IllegalStateException(operation + " needs a built graph, call buildGraph() first");
        }
    }

    private void checkNodePotentials(PotentialMap pots, int layer) {
        if (pots == null) {
            throw new IllegalArgumentException("Potentials must not be null");
        }
        if (!size.isEmpty() && (pots.getWidth() != size.getWidth() || pots.getHeight() != size.getHeight())) {
            throw new IllegalArgumentException("Potentials of size " + pots.getWidth() + "x" + pots.getHeight()
                    + " do not match the graph size " + size);
        }
        if (pots.getNumStates() != getNumStates(layer)) {
            throw new IllegalArgumentException("Layer " + layer + " has " + getNumStates(layer)
                    + " states, potentials have " + pots.getNumStates());
        }
    }

    private void checkFeatureSize(FeatureMap featureVectors) {
        if (featureVectors == null) {
            throw new IllegalArgumentException("Feature vectors must not be null");
        }
        if (!featureVectors.hasSize(size.getWidth(), size.getHeight())) {
            throw new IllegalArgumentException("Feature map of size " + featureVectors.getWidth() + "x"
                    + featureVectors.getHeight() + " does not match the graph size " + size);
        }
    }

    private void checkTrainerStates(EdgeTrainer trainer, int layer) {
        if (trainer.getNumStates() != getNumStates(layer)) {
            throw new IllegalArgumentException("Edge trainer predicts " + trainer.getNumStates() + " states, layer "
                    + layer + " has " + getNumStates(layer));
        }
    }

    private void checkPrediction(int edge, double[][] pot) {
        int rows = graph.getNumStates(graph.getEdgeSrc(edge));
        int cols = graph.getNumStates(graph.getEdgeDst(edge));
        if (pot == null || pot.length != rows) {
            throw new IllegalArgumentException("Trainer returned " + (pot == null ? "null" : pot.length + " rows")
                    + " for edge " + edge + ", expected a " + rows + "x" + cols + " potential");
        }
        for (double[] row : pot) {
            if (row == null || row.length != cols) {
                throw new IllegalArgumentException("Trainer returned a row of length "
                        + (row == null ? "null" : row.length) + " for edge " + edge + ", expected " + cols);
            }
            for (double v : row) {
                if (!(v >= 0.0) || Double.isInfinite(v)) {
                    throw new IllegalArgumentException("Trainer returned potential " + v + " for edge " + edge);
                }
            }
        }
    }

    // Values below 1 would favour label changes over equal labels.
    private static void checkSmoothness(double val, double weight) {
        if (!(val >= 1.0) || Double.isInfinite(val)) {
            throw new IllegalArgumentException("Smoothness value must be finite and at least 1: " + val);
        }
        if (!(weight >= 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Edge weight must be finite and non-negative: " + weight);
        }
    }
}
