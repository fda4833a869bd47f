package com.farepredict.exception;

public class PredictionFailedException extends FarePredictionException {
    public PredictionFailedException(String message) {
        super("PREDICTION_FAILED", message);
    }
    public PredictionFailedException(String message, Throwable cause) {
        super("PREDICTION_FAILED", message, cause);
    }
}
