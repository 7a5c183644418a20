package com.bayestext.server.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable result of a training run. Classes are kept in ascending label
 * order; every per-class output array produced from this model uses the same
 * order.
 */
public final class TrainedNaiveBayesModel implements NaiveBayesModel {

    private final List<ClassParameters> classes;
    private final int[] labels;
    private final int vocabularySize;
    private final int featureWidth;
    private final double delta;

    public TrainedNaiveBayesModel(List<ClassParameters> classes, int vocabularySize, double delta) {
        if (classes.isEmpty()) {
            throw new IllegalArgumentException("A trained model needs at least one class");
        }
        List<ClassParameters> sorted = new ArrayList<>(classes);
        sorted.sort(Comparator.comparingInt(ClassParameters::getLabel));

        int width = sorted.get(0).getWidth();
        this.labels = new int[sorted.size()];
        for (int k = 0; k < sorted.size(); k++) {
            ClassParameters params = sorted.get(k);
            if (params.getWidth() != width) {
                throw new IllegalArgumentException("Class " + params.getLabel() + " has " + params.getWidth()
                        + " conditional probabilities, expected " + width);
            }
            if (k > 0 && labels[k - 1] == params.getLabel()) {
                throw new IllegalArgumentException("Duplicate class label " + params.getLabel());
            }
            labels[k] = params.getLabel();
        }

        this.classes = Collections.unmodifiableList(sorted);
        this.vocabularySize = vocabularySize;
        this.featureWidth = width;
        this.delta = delta;
    }

    @Override
    public boolean isTrained() {
        return true;
    }

    @Override
    public TrainedNaiveBayesModel requireTrained() {
        return this;
    }

    public List<ClassParameters> getClasses() {
        return classes;
    }

    public int[] getLabels() {
        return labels.clone();
    }

    public int getNumClasses() {
        return labels.length;
    }

    public int getVocabularySize() {
        return vocabularySize;
    }

    public int getFeatureWidth() {
        return featureWidth;
    }

    public double getDelta() {
        return delta;
    }

    /**
     * Log-posterior of every class for a single bag-of-words vector, index k
     * being the k-th smallest label.
     */
    public double[] logPosteriors(double[] feature) {
        if (feature.length != featureWidth) {
            throw new IllegalArgumentException(
                    "Feature vector length must be " + featureWidth + " but was " + feature.length);
        }
        double[] logPosteriors = new double[classes.size()];
        for (int k = 0; k < classes.size(); k++) {
            logPosteriors[k] = classes.get(k).logPosterior(feature);
        }
        return logPosteriors;
    }

    @Override
    public String toString() {
        return "TrainedNaiveBayesModel{classes=" + labels.length + ", vocabularySize=" + vocabularySize
                + ", featureWidth=" + featureWidth + ", delta=" + delta + '}';
    }
}
