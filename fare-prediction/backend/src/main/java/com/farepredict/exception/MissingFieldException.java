package com.farepredict.exception;

import lombok.Getter;

@Getter
public class MissingFieldException extends FarePredictionException {
    private final String field;

    public MissingFieldException(String field) {
        super("MISSING_FIELD", "Missing required field: " + field);
        this.field = field;
    }
}
