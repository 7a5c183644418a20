package com.bayestext.server.ai;

public class NaiveBayesConfig {
    public double delta = NaiveBayesClassifier.DEFAULT_DELTA;
    public VocabularySizing vocabularySizing = VocabularySizing.LABEL_COUNT;

    public NaiveBayesConfig() {
    }

    public NaiveBayesConfig(double delta, VocabularySizing vocabularySizing) {
        this.delta = delta;
        this.vocabularySizing = vocabularySizing;
    }

    public static NaiveBayesConfig defaults() {
        return new NaiveBayesConfig(NaiveBayesClassifier.DEFAULT_DELTA, VocabularySizing.LABEL_COUNT);
    }

    public NaiveBayesConfig copy() {
        return new NaiveBayesConfig(this.delta, this.vocabularySizing);
    }

    @Override
    public String toString() {
        return "NaiveBayesConfig{delta=" + delta + ", vocabularySizing=" + vocabularySizing + '}';
    }
}
