package com.farepredict.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One node of a regression tree. Leaves carry {@code value}; split nodes carry
 * {@code feature}, {@code threshold} and both children.
 */
@Value
@Builder
@Jacksonized
public class TreeNode {

    Integer feature;
    Double threshold;
    TreeNode left;
    TreeNode right;
    Double value;

    @JsonIgnore
    public boolean isLeaf() {
        return value != null;
    }

    /**
     * Walks from this node to a leaf.
     *
     * @param strictLess route left on {@code x < threshold} instead of {@code x <= threshold}
     */
    public double evaluate(double[] features, boolean strictLess) {
        TreeNode node = this;
        while (!node.isLeaf()) {
            double x = features[node.feature];
            boolean goLeft = strictLess ? x < node.threshold : x <= node.threshold;
            node = goLeft ? node.left : node.right;
        }
        return node.value;
    }

    void validate(int featureCount) {
        if (isLeaf()) {
            return;
        }
        if (feature == null || feature < 0 || feature >= featureCount) {
            throw new IllegalArgumentException("Split feature index " + feature
                + " outside [0, " + featureCount + ")");
        }
        if (threshold == null || left == null || right == null) {
            throw new IllegalArgumentException("Split on feature " + feature
                + " needs a threshold and two children");
        }
        left.validate(featureCount);
        right.validate(featureCount);
    }
}
