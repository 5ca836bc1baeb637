package com.layeredcrf.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.layeredcrf.db.EdgeModelDao;
import com.layeredcrf.db.ModelKind;
import com.layeredcrf.db.SqliteInitializer;
import com.layeredcrf.db.StoredCounts;
import com.layeredcrf.server.crf.EdgesType;
import com.layeredcrf.server.crf.GraphLayeredExt;
import com.layeredcrf.server.crf.LayeredGraphFactory;
import com.layeredcrf.server.crf.feature.FeatureMap;
import com.layeredcrf.server.crf.feature.PotentialMap;
import com.layeredcrf.server.crf.graph.PairwiseGraph;
import com.layeredcrf.server.crf.training.CooccurrenceEdgeTrainer;
import com.layeredcrf.server.crf.training.CooccurrenceLinkTrainer;
import com.layeredcrf.server.crf.training.EdgeTrainer;
import com.layeredcrf.server.crf.training.LabelPairCounts;
import com.layeredcrf.server.crf.training.LinkTrainer;
import com.layeredcrf.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

@Service
public class LayeredGraphService {

    private static final Logger logger = LoggerFactory.getLogger(LayeredGraphService.class);

    private static final double DEFAULT_EDGE_VAL = 100.0;

    private final LayeredGraphFactory.ConfigRoot config;
    private final String dbPath;
    private boolean dbReady = false;

    public LayeredGraphService() {
        this(loadConfig(), DataPathResolver.resolveDbPath());
    }

    public LayeredGraphService(LayeredGraphFactory.ConfigRoot config, String dbPath) {
        this.config = config != null ? config : new LayeredGraphFactory.ConfigRoot();
        this.dbPath = dbPath;
    }

    public static class EdgeLine {
        public double a;
        public double b;
        public double c;
        public int group;
    }

    public LayeredGraphFactory.ConfigRoot getConfig() {
        return config;
    }

    public GraphLayeredExt createGraph() {
        return LayeredGraphFactory.create(config);
    }

    /**
     * Builds the configured graph for a {@code width x height} image, optionally
     * carves out the edges crossing {@code line}, and reports the counts.
     */
    public TopologySummary describeTopology(int width, int height, EdgeLine line) {
        GraphLayeredExt ext = createGraph();
        ext.buildGraph(width, height);
        if (line != null) {
            ext.defineEdgeGroup(line.a, line.b, line.c, line.group);
        }

        PairwiseGraph graph = ext.getGraph();
        Map<Integer, Integer> perGroup = new TreeMap<>();
        int links = 0;
        for (int e = 0; e < graph.getNumEdges(); e++) {
            perGroup.merge(graph.getEdgeGroup(e), 1, Integer::sum);
            if (ext.isLink(e)) {
                links++;
            }
        }
        return new TopologySummary(width, height, ext.getNumLayers(), graph.getNumNodes(), graph.getNumEdges(),
                links, perGroup);
    }

    public GraphLayeredExt assemble(PotentialMap potBase, PotentialMap potOccl, FeatureMap features,
            EdgeTrainer edgeTrainer, LinkTrainer linkTrainer, double[] params) {
        return assemble(potBase, potOccl, features, edgeTrainer, null, linkTrainer, params);
    }

    /**
     * Builds the configured graph around the given node potentials and fills
     * its edges: with the trainers when an edge trainer is given, otherwise with
     * the default model (contrast-sensitive when features are given).
     *
     * @param potOccl     occlusion-layer potentials, may be null
     * @param features    per-site features, may be null only without an edge trainer
     * @param occlTrainer edge trainer for the occlusion layers; when null they
     *                    reuse {@code edgeTrainer} if it predicts their label
     *                    count and get the default model otherwise
     */
    public GraphLayeredExt assemble(PotentialMap potBase, PotentialMap potOccl, FeatureMap features,
            EdgeTrainer edgeTrainer, EdgeTrainer occlTrainer, LinkTrainer linkTrainer, double[] params) {
        long startTime = System.currentTimeMillis();
        GraphLayeredExt ext = createGraph();
        if (potOccl != null) {
            ext.setGraph(potBase, potOccl);
        } else {
            ext.setGraph(potBase);
        }

        double edgeWeight = config.edgeWeight != null ? config.edgeWeight : 1.0;
        double linkWeight = config.linkWeight != null ? config.linkWeight : 1.0;
        if (edgeTrainer != null) {
            if (occlTrainer == null && ext.getNumLayers() > 1
                    && edgeTrainer.getNumStates() != ext.getNumStates(1)) {
                // occlusion layers the trainer cannot fill keep the default model
                addDefaultModel(ext, features, edgeWeight);
            }
            ext.fillEdges(edgeTrainer, occlTrainer, linkTrainer, features, params, edgeWeight, linkWeight);
        } else {
            addDefaultModel(ext, features, edgeWeight);
        }
        logger.info("Assembled graph {} in {} ms", ext.getSize(), System.currentTimeMillis() - startTime);
        return ext;
    }

    private void addDefaultModel(GraphLayeredExt ext, FeatureMap features, double edgeWeight) {
        double val = DEFAULT_EDGE_VAL;
        double weight = edgeWeight;
        if (config.defaultEdgeModel != null) {
            if (config.defaultEdgeModel.val != null) {
                val = config.defaultEdgeModel.val;
            }
            if (config.defaultEdgeModel.weight != null) {
                weight = config.defaultEdgeModel.weight;
            }
        }
        if (features != null) {
            ext.addDefaultEdgesModel(features, val, weight);
        } else {
            ext.addDefaultEdgesModel(val, weight);
        }
    }

    public CooccurrenceEdgeTrainer trainEdgeModel(List<FeatureMap> features, List<int[][]> groundTruth) {
        return trainEdgeModel(features, groundTruth, 0);
    }

    /**
     * Trains an edge co-occurrence model over a set of labeled images, sampling
     * every image with the configured intra-layer edge classes. Layer 0 trains
     * the base-layer model; any higher layer trains the occlusion-layer model
     * with the occlusion label count.
     */
    public CooccurrenceEdgeTrainer trainEdgeModel(List<FeatureMap> features, List<int[][]> groundTruth, int layer) {
        if (features.size() != groundTruth.size()) {
            throw new IllegalArgumentException("Got " + features.size() + " feature maps but "
                    + groundTruth.size() + " ground-truth maps");
        }
        if (layer < 0) {
            throw new IllegalArgumentException("Layer out of range: " + layer);
        }
        int statesBase = config.statesBase != null ? config.statesBase : 2;
        int statesOccl = config.statesOccl != null ? config.statesOccl : statesBase;
        int states = layer == 0 ? statesBase : statesOccl;
        Set<EdgesType> type = EnumSet.noneOf(EdgesType.class);
        type.addAll(LayeredGraphFactory.parseEdges(config.edges));
        type.remove(EdgesType.LINK);

        CooccurrenceEdgeTrainer trainer = new CooccurrenceEdgeTrainer(states);
        PairwiseGraph graph = LayeredGraphFactory.createBackingGraph(config.backend, states);
        GraphLayeredExt ext = new GraphLayeredExt(graph, 1, type, states, states);
        for (int i = 0; i < features.size(); i++) {
            FeatureMap fv = features.get(i);
            ext.buildGraph(fv.getWidth(), fv.getHeight());
            ext.addFeatureVecs(trainer, fv, groundTruth.get(i));
        }
        trainer.train();
        return trainer;
    }

    /**
     * Trains a link co-occurrence model from the base and occlusion ground truth
     * of each site.
     */
    public CooccurrenceLinkTrainer trainLinkModel(List<FeatureMap> features, List<int[][]> gtBase,
            List<int[][]> gtOccl) {
        if (features.size() != gtBase.size() || features.size() != gtOccl.size()) {
            throw new IllegalArgumentException("Feature and ground-truth lists differ in length");
        }
        int statesBase = config.statesBase != null ? config.statesBase : 2;
        int statesOccl = config.statesOccl != null ? config.statesOccl : statesBase;

        CooccurrenceLinkTrainer trainer = new CooccurrenceLinkTrainer(statesBase, statesOccl);
        for (int i = 0; i < features.size(); i++) {
            FeatureMap fv = features.get(i);
            int[][] base = gtBase.get(i);
            int[][] occl = gtOccl.get(i);
            for (int y = 0; y < fv.getHeight(); y++) {
                for (int x = 0; x < fv.getWidth(); x++) {
                    trainer.addFeatureVecs(fv.get(x, y), base[y][x], occl[y][x]);
                }
            }
        }
        trainer.train();
        return trainer;
    }

    public void saveEdgeModel(String name, CooccurrenceEdgeTrainer trainer) {
        saveCounts(name, ModelKind.EDGE, trainer.getCounts());
    }

    public void saveLinkModel(String name, CooccurrenceLinkTrainer trainer) {
        saveCounts(name, ModelKind.LINK, trainer.getCounts());
        saveCounts(name, ModelKind.LINK_UPPER, trainer.getUpperCounts());
    }

    public Optional<CooccurrenceEdgeTrainer> loadEdgeModel(String name) {
        return loadCounts(name, ModelKind.EDGE).map(stored -> {
            CooccurrenceEdgeTrainer trainer = new CooccurrenceEdgeTrainer(stored.getRows());
            trainer.getCounts().restore(stored.getCounts());
            trainer.train();
            return trainer;
        });
    }

    public Optional<CooccurrenceLinkTrainer> loadLinkModel(String name) {
        return loadCounts(name, ModelKind.LINK).map(stored -> {
            CooccurrenceLinkTrainer trainer = new CooccurrenceLinkTrainer(stored.getRows(), stored.getCols());
            trainer.getCounts().restore(stored.getCounts());
            loadCounts(name, ModelKind.LINK_UPPER)
                    .ifPresent(upper -> trainer.getUpperCounts().restore(upper.getCounts()));
            trainer.train();
            return trainer;
        });
    }

    private void saveCounts(String name, ModelKind kind, LabelPairCounts counts) {
        try {
            new EdgeModelDao(ensureDb()).upsertCounts(name, kind, counts.getRows(), counts.getCols(),
                    counts.toArray());
            logger.info("Saved {} model '{}' ({}x{}, {} samples)", kind, name, counts.getRows(), counts.getCols(),
                    counts.getTotal());
        } catch (SQLException e) {
            logger.error("Failed to save {} model '{}'", kind, name, e);
            throw new IllegalStateException(e);
        }
    }

    private Optional<StoredCounts> loadCounts(String name, ModelKind kind) {
        try {
            Optional<StoredCounts> stored = new EdgeModelDao(ensureDb()).loadCounts(name, kind);
            if (stored.isEmpty()) {
                logger.warn("No {} model named '{}' in {}", kind, name, dbPath);
            }
            return stored;
        } catch (SQLException e) {
            logger.error("Failed to load {} model '{}'", kind, name, e);
            throw new IllegalStateException(e);
        }
    }

    private synchronized String ensureDb() throws SQLException {
        if (!dbReady) {
            SqliteInitializer.initialize(dbPath);
            logger.info("Initialized SQLite model store at {}", dbPath);
            dbReady = true;
        }
        return dbPath;
    }

    static LayeredGraphFactory.ConfigRoot loadConfig() {
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream is = LayeredGraphService.class.getResourceAsStream("/crf_config.json")) {
            if (is == null) {
                logger.warn("crf_config.json not found on classpath, using defaults");
                return new LayeredGraphFactory.ConfigRoot();
            }
            return mapper.readValue(is, LayeredGraphFactory.ConfigRoot.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read crf_config.json", e);
        }
    }
}
