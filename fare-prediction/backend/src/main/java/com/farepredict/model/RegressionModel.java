package com.farepredict.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A pre-trained regressor: a fixed-length numeric feature vector in, a scalar estimate out.
 * Implementations are immutable and safe for concurrent use.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LinearRegressionModel.class, name = "linear_regression"),
    @JsonSubTypes.Type(value = DecisionTreeModel.class, name = "decision_tree"),
    @JsonSubTypes.Type(value = RandomForestModel.class, name = "random_forest"),
    @JsonSubTypes.Type(value = GradientBoostedTreesModel.class, name = "xgboost")
})
public interface RegressionModel {

    /**
     * @param features values in training order
     * @return the raw, unclamped estimate
     */
    double predict(double[] features);

    /**
     * Checks the model's structure against the width of the feature vector it will be given.
     *
     * @throws IllegalArgumentException if the model cannot score vectors of that width
     */
    void validate(int featureCount);
}
