package com.layeredcrf.server.crf.training;

/**
 * A statistical model for the potentials of edges connecting two sites of the
 * same layer. Samples are accumulated during training; potentials are
 * predicted from a pair of feature vectors afterwards.
 *
 * Implementations used for parallel filling must allow concurrent calls to
 * {@link #calculateEdgePotentials(double[], double[], double[])}.
 */
public interface EdgeTrainer {

    int getNumStates();

    /**
     * Adds one training sample: the feature vectors of the two end sites and
     * their ground-truth states.
     */
    void addFeatureVecs(double[] featureVector1, double[] featureVector2, int gt1, int gt2);

    // Turns the accumulated samples into a model.
    void train();

    void reset();

    /**
     * @param params model-specific control parameters
     * @return a {@code numStates x numStates} matrix of non-negative potentials
     */
    double[][] calculateEdgePotentials(double[] featureVector1, double[] featureVector2, double[] params);
}
