package com.bayestext.server.ai;

/**
 * Where {@code fit} takes the vocabulary size used in the smoothing denominator.
 */
public enum VocabularySizing {
    /** Number of training labels (rows). Historical behaviour, kept as the default. */
    LABEL_COUNT,
    /** Column count of the feature matrix. */
    FEATURE_WIDTH;

    public int resolve(double[][] features, int[] labels) {
        switch (this) {
            case FEATURE_WIDTH:
                return features.length == 0 ? 0 : features[0].length;
            case LABEL_COUNT:
            default:
                return labels.length;
        }
    }
}
