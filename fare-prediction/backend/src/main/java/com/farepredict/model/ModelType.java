package com.farepredict.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of servable models. Declaration order is the fallback order.
 */
@Getter
@RequiredArgsConstructor
public enum ModelType {

    LINEAR_REGRESSION("linear_regression", "$5.24", "0.82"),
    DECISION_TREE("decision_tree", "$4.12", "0.86"),
    RANDOM_FOREST("random_forest", "$3.42", "0.91"),
    XGBOOST("xgboost", "$3.56", "0.90");

    public static final String ARTIFACT_SUFFIX = "_model.json";

    private final String identifier;
    private final String rmse;
    private final String r2;

    public String artifactFileName() {
        return identifier + ARTIFACT_SUFFIX;
    }

    public static Optional<ModelType> fromIdentifier(String identifier) {
        return Arrays.stream(values())
            .filter(t -> t.identifier.equals(identifier))
            .findFirst();
    }
}
