package com.bayestext.server.ai;

/**
 * State held by a {@link NaiveBayesClassifier}: either {@link UntrainedModel}
 * or a {@link TrainedNaiveBayesModel}.
 */
public interface NaiveBayesModel {

    boolean isTrained();

    /**
     * Returns this model as a trained one.
     *
     * @throws ModelNotTrainedException if no parameters have been estimated
     */
    TrainedNaiveBayesModel requireTrained();
}
