package com.bayestext.server.ai;

public class ClassificationResult {
    private final int predictedLabel;
    // all arrays below are indexed by ascending class label
    private final int[] labels;
    private final double[] logPosteriors;
    private final double[] probabilities;
    private final double entropy;

    public ClassificationResult(int predictedLabel, int[] labels, double[] logPosteriors, double[] probabilities,
            double entropy) {
        this.predictedLabel = predictedLabel;
        this.labels = labels;
        this.logPosteriors = logPosteriors;
        this.probabilities = probabilities;
        this.entropy = entropy;
    }

    public int getPredictedLabel() {
        return predictedLabel;
    }

    public int[] getLabels() {
        return labels;
    }

    public double[] getLogPosteriors() {
        return logPosteriors;
    }

    public double[] getProbabilities() {
        return probabilities;
    }

    public double getEntropy() {
        return entropy;
    }

    @Override
    public String toString() {
        return "ClassificationResult{" +
                "predicted=" + predictedLabel +
                ", entropy=" + String.format("%.4f", entropy) +
                ", classes=" + labels.length +
                '}';
    }
}
