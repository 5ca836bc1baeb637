package com.layeredcrf.server.crf.training;

/**
 * Contrast-sensitive Potts edge model: the diagonal decays from
 * {@code params[0]} towards 1 as the end-site features drift apart, with
 * {@code params[1]} as the decay rate on the squared feature distance.
 */
public class ContrastPottsEdgeTrainer extends PottsEdgeTrainer {

    public ContrastPottsEdgeTrainer(int numStates) {
        super(numStates);
    }

    @Override
    public double[][] calculateEdgePotentials(double[] featureVector1, double[] featureVector2, double[] params) {
        if (params == null || params.length < 2) {
            throw new IllegalArgumentException("Contrast-sensitive Potts model expects params = {value, beta}");
        }
        double d2 = EdgePotentials.squaredDistance(featureVector1, featureVector2);
        return EdgePotentials.potts(getNumStates(), EdgePotentials.contrastSmoothness(params[0], params[1], d2));
    }
}
