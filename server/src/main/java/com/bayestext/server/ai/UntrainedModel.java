package com.bayestext.server.ai;

public final class UntrainedModel implements NaiveBayesModel {

    public static final UntrainedModel INSTANCE = new UntrainedModel();

    private UntrainedModel() {
    }

    @Override
    public boolean isTrained() {
        return false;
    }

    @Override
    public TrainedNaiveBayesModel requireTrained() {
        throw new ModelNotTrainedException();
    }

    @Override
    public String toString() {
        return "UntrainedModel";
    }
}
