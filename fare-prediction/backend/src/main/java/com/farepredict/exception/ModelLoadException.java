package com.farepredict.exception;

import java.nio.file.Path;

public class ModelLoadException extends FarePredictionException {
    public ModelLoadException(Path artifact, Throwable cause) {
        super("MODEL_LOAD_FAILED", "Failed to load model artifact " + artifact.getFileName() + ": " + cause.getMessage(), cause);
    }
}
