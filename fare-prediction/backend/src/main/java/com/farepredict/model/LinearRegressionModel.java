package com.farepredict.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class LinearRegressionModel implements RegressionModel {

    double intercept;
    double[] coefficients;

    @Override
    public double predict(double[] features) {
        if (features.length != coefficients.length) {
            throw new IllegalArgumentException("Linear model expects " + coefficients.length
                + " features but got " + features.length);
        }
        double sum = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            sum += coefficients[i] * features[i];
        }
        return sum;
    }

    @Override
    public void validate(int featureCount) {
        if (coefficients == null || coefficients.length != featureCount) {
            throw new IllegalArgumentException("linear_regression needs exactly " + featureCount + " coefficients");
        }
    }
}
