package com.layeredcrf.server.crf.training;

/**
 * Data-independent Potts edge model. {@code params[0]} is the diagonal value;
 * features and training samples are ignored.
 */
public class PottsEdgeTrainer implements EdgeTrainer {

    private final int numStates;

    public PottsEdgeTrainer(int numStates) {
        if (numStates <= 0) {
            throw new IllegalArgumentException("Number of states must be positive: " + numStates);
        }
        this.numStates = numStates;
    }

    @Override
    public int getNumStates() {
        return numStates;
    }

    @Override
    public void addFeatureVecs(double[] featureVector1, double[] featureVector2, int gt1, int gt2) {
        // nothing to learn
    }

    @Override
    public void train() {
        // nothing to learn
    }

    @Override
    public void reset() {
        // stateless
    }

    @Override
    public double[][] calculateEdgePotentials(double[] featureVector1, double[] featureVector2, double[] params) {
        if (params == null || params.length < 1) {
            throw new IllegalArgumentException("Potts model expects params[0] = smoothness value");
        }
        return EdgePotentials.potts(numStates, params[0]);
    }
}
