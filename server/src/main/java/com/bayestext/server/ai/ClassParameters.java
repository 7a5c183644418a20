package com.bayestext.server.ai;

import java.util.Arrays;

/**
 * Estimated parameters for one class label: its prior and its per-word
 * conditional probabilities.
 */
public final class ClassParameters {

    private final int label;
    private final double prior;
    private final double[] conditional;
    // log P(word_j | class), cached at construction
    private final double[] logConditional;

    public ClassParameters(int label, double prior, double[] conditional) {
        if (prior <= 0.0) {
            throw new IllegalArgumentException("Prior for class " + label + " must be positive, was " + prior);
        }
        this.label = label;
        this.prior = prior;
        this.conditional = conditional.clone();
        this.logConditional = new double[conditional.length];
        for (int j = 0; j < conditional.length; j++) {
            logConditional[j] = Math.log(conditional[j]);
        }
    }

    public int getLabel() {
        return label;
    }

    public double getPrior() {
        return prior;
    }

    public double[] getConditional() {
        return conditional.clone();
    }

    public int getWidth() {
        return conditional.length;
    }

    /**
     * log P(class) + sum_j log P(word_j | class) * feature[j].
     * Words with a zero count contribute nothing.
     */
    public double logPosterior(double[] feature) {
        double logP = Math.log(prior);
        for (int j = 0; j < feature.length; j++) {
            if (feature[j] != 0.0) {
                logP += logConditional[j] * feature[j];
            }
        }
        return logP;
    }

    @Override
    public String toString() {
        return "ClassParameters{label=" + label + ", prior=" + prior + ", conditional="
                + Arrays.toString(conditional) + '}';
    }
}
