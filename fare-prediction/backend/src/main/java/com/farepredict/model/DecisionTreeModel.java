package com.farepredict.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DecisionTreeModel implements RegressionModel {

    TreeNode tree;

    @Override
    public double predict(double[] features) {
        return tree.evaluate(features, false);
    }

    @Override
    public void validate(int featureCount) {
        if (tree == null) {
            throw new IllegalArgumentException("decision_tree has no tree");
        }
        tree.validate(featureCount);
    }
}
