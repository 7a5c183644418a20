package com.bayestext.server.ai.inference;

public class MathUtil {

    /**
     * Computes the softmax of an array of scores.
     * Uses the "max trick" for numerical stability:
     * softmax(x_i) = exp(x_i - max(x)) / sum(exp(x_j - max(x)))
     * If every score is -Infinity the result is all NaN.
     */
    public static double[] softmax(double[] scores) {
        double max = Double.NEGATIVE_INFINITY;
        for (double s : scores) {
            if (s > max)
                max = s;
        }

        double[] probs = new double[scores.length];
        double sum = 0.0;
        for (int i = 0; i < scores.length; i++) {
            double val = Math.exp(scores[i] - max);
            probs[i] = val;
            sum += val;
        }

        for (int i = 0; i < probs.length; i++) {
            probs[i] /= sum;
        }
        return probs;
    }

    /**
     * Entropy of a probability distribution in nats.
     * H(p) = -sum(p_i * log(p_i))
     */
    public static double entropy(double[] probs) {
        double h = 0.0;
        for (double p : probs) {
            if (p > 1e-12) {
                h -= p * Math.log(p);
            }
        }
        return h;
    }

    /**
     * Returns the index of the maximum value in the array.
     * On ties the first index wins.
     */
    public static int argmax(double[] x) {
        if (x.length == 0) {
            throw new IllegalArgumentException("Cannot take argmax of an empty array");
        }
        int bestIdx = 0;
        double bestVal = x[0];
        for (int i = 1; i < x.length; i++) {
            if (x[i] > bestVal) {
                bestVal = x[i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }
}
