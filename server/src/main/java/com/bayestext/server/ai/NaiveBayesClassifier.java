package com.bayestext.server.ai;

import com.bayestext.server.ai.inference.MathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Multinomial Naive Bayes over bag-of-words count vectors.
 * <p>
 * Starts untrained. Each call to {@link #fit} replaces the whole model. Every
 * per-class array returned (posteriors, probabilities) is indexed by the rank
 * of the class label among the sorted training labels, see {@link #classLabels()}.
 * Not safe for a {@code fit} concurrent with any other call.
 */
public class NaiveBayesClassifier {
    private static final Logger logger = LoggerFactory.getLogger(NaiveBayesClassifier.class);

    public static final double DEFAULT_DELTA = 1.0;

    private final NaiveBayesTrainer trainer;
    private NaiveBayesModel model = UntrainedModel.INSTANCE;

    public NaiveBayesClassifier() {
        this(VocabularySizing.LABEL_COUNT);
    }

    public NaiveBayesClassifier(VocabularySizing vocabularySizing) {
        this.trainer = new NaiveBayesTrainer(vocabularySizing);
    }

    public void fit(double[][] features, int[] labels) {
        fit(features, labels, DEFAULT_DELTA);
    }

    /**
     * Estimates priors and conditional probabilities, discarding any earlier model.
     *
     * @param features N x V word counts, one row per training example
     * @param labels   N class labels aligned with the feature rows
     * @param delta    additive smoothing strength, {@code >= 0}
     */
    public void fit(double[][] features, int[] labels, double delta) {
        model = trainer.train(features, labels, delta);
    }

    public SortedMap<Integer, Double> estimateClassPriors(int[] labels) {
        return NaiveBayesTrainer.estimateClassPriors(labels);
    }

    /**
     * Runs the conditional estimator with the vocabulary size of the current model.
     *
     * @throws ModelNotTrainedException if no vocabulary size has been set by {@link #fit}
     */
    public SortedMap<Integer, double[]> estimateConditionalProbabilities(double[][] features, int[] labels,
            double delta) {
        int vocabularySize = model.requireTrained().getVocabularySize();
        return NaiveBayesTrainer.estimateConditionalProbabilities(features, labels, delta, vocabularySize);
    }

    public double[] estimateClassPosteriors(double[] feature) {
        return model.requireTrained().logPosteriors(feature);
    }

    public int predict(double[] feature) {
        TrainedNaiveBayesModel trained = model.requireTrained();
        double[] logPosteriors = trained.logPosteriors(feature);
        return trained.getClasses().get(MathUtil.argmax(logPosteriors)).getLabel();
    }

    /**
     * Softmax of {@link #estimateClassPosteriors}. With {@code delta == 0} a query
     * can hit a zero likelihood in every class; all log-posteriors are then
     * -Infinity and every returned probability is NaN.
     */
    public double[] predictProba(double[] feature) {
        return MathUtil.softmax(estimateClassPosteriors(feature));
    }

    public ClassificationResult classifyWithScores(double[] feature) {
        TrainedNaiveBayesModel trained = model.requireTrained();
        double[] logPosteriors = trained.logPosteriors(feature);
        double[] probabilities = MathUtil.softmax(logPosteriors);
        int[] labels = trained.getLabels();
        int best = MathUtil.argmax(logPosteriors);

        if (logger.isDebugEnabled()) {
            for (int k = 0; k < labels.length; k++) {
                logger.debug("Class {} log-posterior = {}", labels[k], logPosteriors[k]);
            }
        }

        return new ClassificationResult(labels[best], labels, logPosteriors, probabilities,
                MathUtil.entropy(probabilities));
    }

    public double evaluateAccuracy(double[][] features, int[] labels) {
        if (features.length != labels.length) {
            throw new IllegalArgumentException(
                    "Got " + features.length + " feature rows but " + labels.length + " labels");
        }
        int correct = 0;
        int total = labels.length;

        logger.info("Evaluating accuracy on {} samples...", total);

        for (int i = 0; i < total; i++) {
            int predicted = predict(features[i]);
            if (predicted == labels[i]) {
                correct++;
            } else {
                logger.debug("Misclassified label {} as {}", labels[i], predicted);
            }
        }

        double accuracy = total == 0 ? 0.0 : (double) correct / total;
        logger.info("Evaluation complete. Accuracy: {} ({}/{})", accuracy, correct, total);
        return accuracy;
    }

    public boolean isTrained() {
        return model.isTrained();
    }

    public NaiveBayesModel getModel() {
        return model;
    }

    public int[] classLabels() {
        return model.requireTrained().getLabels();
    }

    public SortedMap<Integer, Double> classPriors() {
        SortedMap<Integer, Double> priors = new TreeMap<>();
        for (ClassParameters params : model.requireTrained().getClasses()) {
            priors.put(params.getLabel(), params.getPrior());
        }
        return priors;
    }

    public SortedMap<Integer, double[]> conditionalProbabilities() {
        SortedMap<Integer, double[]> conditionals = new TreeMap<>();
        for (ClassParameters params : model.requireTrained().getClasses()) {
            conditionals.put(params.getLabel(), params.getConditional());
        }
        return conditionals;
    }

    public int vocabularySize() {
        return model.requireTrained().getVocabularySize();
    }

    public VocabularySizing getVocabularySizing() {
        return trainer.getVocabularySizing();
    }
}
