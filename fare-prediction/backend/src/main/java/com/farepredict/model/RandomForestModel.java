package com.farepredict.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Bagged trees; the estimate is the mean of the member trees.
 */
@Value
@Builder
@Jacksonized
public class RandomForestModel implements RegressionModel {

    List<TreeNode> trees;

    @Override
    public double predict(double[] features) {
        double sum = 0.0;
        for (TreeNode tree : trees) {
            sum += tree.evaluate(features, false);
        }
        return sum / trees.size();
    }

    @Override
    public void validate(int featureCount) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("random_forest has no trees");
        }
        trees.forEach(t -> t.validate(featureCount));
    }
}
