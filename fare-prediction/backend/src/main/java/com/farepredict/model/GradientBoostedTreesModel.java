package com.farepredict.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Boosted trees in the xgboost layout: leaf values already include the learning rate,
 * splits route left on a strict less-than, and the estimate is {@code base_score} plus every tree's leaf.
 */
@Value
@Builder
@Jacksonized
public class GradientBoostedTreesModel implements RegressionModel {

    @JsonProperty("base_score")
    double baseScore;
    List<TreeNode> trees;

    @Override
    public double predict(double[] features) {
        double sum = baseScore;
        for (TreeNode tree : trees) {
            sum += tree.evaluate(features, true);
        }
        return sum;
    }

    @Override
    public void validate(int featureCount) {
        if (trees == null) {
            throw new IllegalArgumentException("xgboost has no tree list");
        }
        trees.forEach(t -> t.validate(featureCount));
    }
}
