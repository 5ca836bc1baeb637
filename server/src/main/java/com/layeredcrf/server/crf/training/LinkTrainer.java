package com.layeredcrf.server.crf.training;

/**
 * A statistical model for the potentials of links, the edges connecting the
 * same site in two adjacent layers. Both ends share one feature vector.
 *
 * The link between layers 0 and 1 joins a base node to an occlusion node; links
 * higher up join two occlusion nodes, so their matrices have a different shape
 * when the two layer kinds differ in label count.
 */
public interface LinkTrainer {

    void addFeatureVecs(double[] featureVector, int gtBase, int gtOccl);

    /**
     * Adds one sample for the link between {@code lowerLayer} and
     * {@code lowerLayer + 1}. Trainers that only model the base link reject
     * samples from higher links.
     */
    default void addFeatureVecs(double[] featureVector, int gtLower, int gtUpper, int lowerLayer) {
        if (lowerLayer != 0) {
            throw new UnsupportedOperationException(
                    getClass().getSimpleName() + " only models links from the base layer");
        }
        addFeatureVecs(featureVector, gtLower, gtUpper);
    }

    void train();

    void reset();

    /**
     * @return a {@code statesBase x statesOccl} matrix of non-negative potentials
     */
    double[][] calculateLinkPotentials(double[] featureVector);

    /**
     * Prediction for the link between {@code lowerLayer} and
     * {@code lowerLayer + 1}: a {@code states(lowerLayer) x states(lowerLayer + 1)}
     * matrix. Defaults to {@link #calculateLinkPotentials(double[])}.
     */
    default double[][] calculateLinkPotentials(double[] featureVector, int lowerLayer) {
        return calculateLinkPotentials(featureVector);
    }
}
