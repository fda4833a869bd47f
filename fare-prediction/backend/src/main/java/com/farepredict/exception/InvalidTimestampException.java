package com.farepredict.exception;

public class InvalidTimestampException extends FarePredictionException {
    public InvalidTimestampException(String value) {
        super("INVALID_TIMESTAMP", "Unable to parse pickup_datetime: '" + value + "'");
    }
    public InvalidTimestampException(String value, Throwable cause) {
        super("INVALID_TIMESTAMP", "Unable to parse pickup_datetime: '" + value + "'", cause);
    }
}
