package com.bayestext.server.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Estimates multinomial Naive Bayes parameters from bag-of-words count
 * vectors and produces an immutable {@link TrainedNaiveBayesModel}.
 */
public class NaiveBayesTrainer {

    private static final Logger logger = LoggerFactory.getLogger(NaiveBayesTrainer.class);

    private final VocabularySizing vocabularySizing;

    public NaiveBayesTrainer() {
        this(VocabularySizing.LABEL_COUNT);
    }

    public NaiveBayesTrainer(VocabularySizing vocabularySizing) {
        this.vocabularySizing = vocabularySizing;
    }

    public VocabularySizing getVocabularySizing() {
        return vocabularySizing;
    }

    public TrainedNaiveBayesModel train(double[][] features, int[] labels, double delta) {
        if (delta < 0.0) {
            throw new IllegalArgumentException("Smoothing delta must be >= 0 but was " + delta);
        }
        checkShapes(features, labels);

        logger.info("Starting training with {} samples, delta={}", labels.length, delta);
        long startTime = System.currentTimeMillis();

        SortedMap<Integer, Double> priors = estimateClassPriors(labels);
        int vocabularySize = vocabularySizing.resolve(features, labels);
        SortedMap<Integer, double[]> conditionals = estimateConditionalProbabilities(features, labels, delta,
                vocabularySize);

        List<ClassParameters> classes = new ArrayList<>(priors.size());
        for (Map.Entry<Integer, Double> entry : priors.entrySet()) {
            int label = entry.getKey();
            classes.add(new ClassParameters(label, entry.getValue(), conditionals.get(label)));
            logger.debug("Class {}: prior = {}", label, entry.getValue());
            if (logger.isTraceEnabled()) {
                logger.trace("Class {} conditional probabilities: {}", label,
                        Arrays.toString(conditionals.get(label)));
            }
        }

        TrainedNaiveBayesModel model = new TrainedNaiveBayesModel(classes, vocabularySize, delta);
        long duration = System.currentTimeMillis() - startTime;
        logger.info("Training complete in {} ms: {}", duration, model);
        return model;
    }

    /**
     * Empirical class frequencies: count(label) / number of labels. No smoothing.
     */
    public static SortedMap<Integer, Double> estimateClassPriors(int[] labels) {
        if (labels.length == 0) {
            throw new IllegalArgumentException("Cannot estimate class priors from an empty label vector");
        }
        SortedMap<Integer, Integer> counts = new TreeMap<>();
        for (int label : labels) {
            counts.merge(label, 1, Integer::sum);
        }

        SortedMap<Integer, Double> priors = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            priors.put(entry.getKey(), (double) entry.getValue() / labels.length);
        }
        return priors;
    }

    /**
     * Per-class word likelihoods with additive smoothing.
     * <p>
     * For class c the denominator is {@code vocabularySize * delta + total_words(c)}.
     * The first training row seen for c contributes {@code (row + delta) / denom},
     * every later row of c contributes {@code row / denom}, so delta enters the
     * numerator once per class.
     */
    public static SortedMap<Integer, double[]> estimateConditionalProbabilities(double[][] features, int[] labels,
            double delta, int vocabularySize) {
        checkShapes(features, labels);

        Map<Integer, Double> totalWordsPerClass = new HashMap<>();
        for (int i = 0; i < labels.length; i++) {
            totalWordsPerClass.merge(labels[i], sum(features[i]), Double::sum);
        }

        SortedMap<Integer, double[]> conditionals = new TreeMap<>();
        for (int i = 0; i < labels.length; i++) {
            int label = labels[i];
            double[] row = features[i];
            double denom = vocabularySize * delta + totalWordsPerClass.get(label);

            double[] accumulated = conditionals.get(label);
            if (accumulated == null) {
                accumulated = new double[row.length];
                for (int j = 0; j < row.length; j++) {
                    accumulated[j] = (row[j] + delta) / denom;
                }
                conditionals.put(label, accumulated);
            } else {
                for (int j = 0; j < row.length; j++) {
                    accumulated[j] += row[j] / denom;
                }
            }
        }
        return conditionals;
    }

    private static double sum(double[] row) {
        double total = 0.0;
        for (double v : row) {
            total += v;
        }
        return total;
    }

    static void checkShapes(double[][] features, int[] labels) {
        if (labels.length == 0) {
            throw new IllegalArgumentException("Training set is empty");
        }
        if (features.length != labels.length) {
            throw new IllegalArgumentException(
                    "Got " + features.length + " feature rows but " + labels.length + " labels");
        }
        for (int i = 0; i < features.length; i++) {
            if (features[i] == null) {
                throw new IllegalArgumentException("Feature row " + i + " is missing");
            }
        }
        int width = features[0].length;
        for (int i = 1; i < features.length; i++) {
            if (features[i].length != width) {
                throw new IllegalArgumentException(
                        "Feature row " + i + " has length " + features[i].length + ", expected " + width);
            }
        }
    }
}
