package com.bayestext.server.service;

import com.bayestext.server.ai.ClassificationResult;
import com.bayestext.server.ai.ModelNotTrainedException;
import com.bayestext.server.ai.NaiveBayesClassifier;
import com.bayestext.server.ai.NaiveBayesConfig;
import com.bayestext.server.util.NaiveBayesConfigLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds the classifier served by the application. Training builds a fresh
 * classifier and swaps it in once fitting succeeded, so a failed or running
 * training never disturbs requests against the previous model.
 */
@Service
public class ClassifierService {

    private static final Logger logger = LoggerFactory.getLogger(ClassifierService.class);

    private final NaiveBayesConfig config;
    private volatile NaiveBayesClassifier classifier;

    public ClassifierService() {
        this(NaiveBayesConfigLoader.loadOrDefault());
    }

    public ClassifierService(NaiveBayesConfig config) {
        this.config = config.copy();
    }

    @PostConstruct
    public void init() {
        logger.info("Classifier service initialized with {}", config);
    }

    public NaiveBayesConfig getConfig() {
        return config.copy();
    }

    public boolean isReady() {
        return classifier != null;
    }

    public NaiveBayesClassifier getClassifier() {
        NaiveBayesClassifier current = classifier;
        if (current == null) {
            throw new ModelNotTrainedException();
        }
        return current;
    }

    /**
     * @param delta smoothing strength, or {@code null} for the configured one
     */
    public NaiveBayesClassifier train(double[][] features, int[] labels, Double delta) {
        double effectiveDelta = delta != null ? delta : config.delta;
        NaiveBayesClassifier fresh = new NaiveBayesClassifier(config.vocabularySizing);
        fresh.fit(features, labels, effectiveDelta);
        classifier = fresh;
        logger.info("Serving new model: {}", fresh.getModel());
        return fresh;
    }

    public ClassificationResult classify(double[] feature) {
        ClassificationResult result = getClassifier().classifyWithScores(feature);
        logger.info("Classified as label: {}", result.getPredictedLabel());
        return result;
    }
}
