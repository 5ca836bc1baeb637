package com.layeredcrf.server.crf.training;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Learns link potentials from how often a state of the lower layer is observed
 * together with a state of the upper layer at the same site. Links from the
 * base layer and links between two occlusion layers have separate tables; a
 * table without samples is neutral (all ones).
 */
public class CooccurrenceLinkTrainer implements LinkTrainer {

    private static final Logger logger = LoggerFactory.getLogger(CooccurrenceLinkTrainer.class);
    private static final double DEFAULT_ALPHA = 1.0;

    // base -> first occlusion layer
    private final LabelPairCounts counts;
    // occlusion -> occlusion, for graphs with 3 or more layers
    private final LabelPairCounts upperCounts;

    public CooccurrenceLinkTrainer(int statesBase, int statesOccl) {
        this(statesBase, statesOccl, DEFAULT_ALPHA);
    }

    public CooccurrenceLinkTrainer(int statesBase, int statesOccl, double alpha) {
        this.counts = new LabelPairCounts(statesBase, statesOccl, alpha);
        this.upperCounts = new LabelPairCounts(statesOccl, statesOccl, alpha);
    }

    @Override
    public void addFeatureVecs(double[] featureVector, int gtBase, int gtOccl) {
        counts.add(gtBase, gtOccl);
    }

    @Override
    public void addFeatureVecs(double[] featureVector, int gtLower, int gtUpper, int lowerLayer) {
        if (lowerLayer < 0) {
            throw new IllegalArgumentException("Layer out of range: " + lowerLayer);
        }
        (lowerLayer == 0 ? counts : upperCounts).add(gtLower, gtUpper);
    }

    @Override
    public void train() {
        counts.finalizePotentials();
        upperCounts.finalizePotentials();
        long skipped = counts.getSkipped() + upperCounts.getSkipped();
        if (skipped > 0) {
            logger.warn("Skipped {} link samples with states outside the {}x{} table", skipped,
                    counts.getRows(), counts.getCols());
        }
        logger.info("Link co-occurrence model trained on {} base and {} occlusion samples", counts.getTotal(),
                upperCounts.getTotal());
    }

    @Override
    public void reset() {
        counts.clear();
        upperCounts.clear();
    }

    @Override
    public double[][] calculateLinkPotentials(double[] featureVector) {
        return counts.getPotentials();
    }

    @Override
    public double[][] calculateLinkPotentials(double[] featureVector, int lowerLayer) {
        return lowerLayer == 0 ? counts.getPotentials() : upperCounts.getPotentials();
    }

    public LabelPairCounts getCounts() {
        return counts;
    }

    public LabelPairCounts getUpperCounts() {
        return upperCounts;
    }
}
