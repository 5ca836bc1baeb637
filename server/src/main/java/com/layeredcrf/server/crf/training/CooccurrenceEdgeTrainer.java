package com.layeredcrf.server.crf.training;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Learns a feature-independent edge potential from how often two states are
 * observed on the two ends of an edge. Edges are undirected, so each sample is
 * counted in both orientations and the learned table is symmetric.
 */
public class CooccurrenceEdgeTrainer implements EdgeTrainer {

    private static final Logger logger = LoggerFactory.getLogger(CooccurrenceEdgeTrainer.class);
    private static final double DEFAULT_ALPHA = 1.0;

    private final int numStates;
    private final LabelPairCounts counts;

    public CooccurrenceEdgeTrainer(int numStates) {
        this(numStates, DEFAULT_ALPHA);
    }

    public CooccurrenceEdgeTrainer(int numStates, double alpha) {
        this.numStates = numStates;
        this.counts = new LabelPairCounts(numStates, numStates, alpha);
    }

    @Override
    public int getNumStates() {
        return numStates;
    }

    @Override
    public void addFeatureVecs(double[] featureVector1, double[] featureVector2, int gt1, int gt2) {
        if (counts.add(gt1, gt2)) {
            counts.add(gt2, gt1);
        }
    }

    @Override
    public void train() {
        long startTime = System.currentTimeMillis();
        counts.finalizePotentials();
        if (counts.getSkipped() > 0) {
            logger.warn("Skipped {} edge samples with states outside [0, {})", counts.getSkipped(), numStates);
        }
        logger.info("Edge co-occurrence model trained on {} samples in {} ms", counts.getTotal() / 2,
                System.currentTimeMillis() - startTime);
    }

    @Override
    public void reset() {
        counts.clear();
    }

    /**
     * Features and params are ignored; the learned table is returned.
     */
    @Override
    public double[][] calculateEdgePotentials(double[] featureVector1, double[] featureVector2, double[] params) {
        return counts.getPotentials();
    }

    public LabelPairCounts getCounts() {
        return counts;
    }
}
