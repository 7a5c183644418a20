package com.bayestext.server.ai;

/**
 * Thrown by inference operations on a classifier that has not been fit yet.
 */
public class ModelNotTrainedException extends IllegalStateException {

    public ModelNotTrainedException() {
        super("Model not trained. Please call fit first.");
    }

    public ModelNotTrainedException(String message) {
        super(message);
    }
}
