package com.farepredict.exception;

public class NoModelAvailableException extends FarePredictionException {
    public NoModelAvailableException() {
        super("NO_MODEL_AVAILABLE", "No models available for prediction");
    }
    public NoModelAvailableException(String identifier) {
        super("NO_MODEL_AVAILABLE", "Model '" + identifier + "' is not available for prediction");
    }
}
