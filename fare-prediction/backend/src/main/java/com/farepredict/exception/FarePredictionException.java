package com.farepredict.exception;

import lombok.Getter;

@Getter
public abstract class FarePredictionException extends RuntimeException {
    private final String errorCode;
    protected FarePredictionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected FarePredictionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
