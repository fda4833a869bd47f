package com.farepredict.feature;

import java.util.Arrays;
import java.util.List;

/**
 * The sixteen model inputs in the order the regressors were trained on.
 */
public final class FeatureVector {

    public static final List<String> FEATURE_NAMES = List.of(
        "distance_km", "hour", "day_of_week", "month", "year",
        "pickup_lat", "pickup_lon", "dropoff_lat", "dropoff_lon",
        "is_morning", "is_afternoon", "is_evening", "is_night",
        "is_weekend", "is_rush_hour", "is_peak_hour"
    );

    public static final int SIZE = FEATURE_NAMES.size();

    private final double[] values;

    FeatureVector(double[] values) {
        if (values.length != SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE + " features but got " + values.length);
        }
        this.values = values.clone();
    }

    public double get(int index) {
        return values[index];
    }

    public double get(String name) {
        int index = FEATURE_NAMES.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown feature: " + name);
        }
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector)) {
            return false;
        }
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FeatureVector{");
        for (int i = 0; i < SIZE; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(FEATURE_NAMES.get(i)).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }
}
