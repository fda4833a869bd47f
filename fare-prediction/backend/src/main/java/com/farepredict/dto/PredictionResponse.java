package com.farepredict.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PredictionResponse {
    double prediction;
    @JsonProperty("model_used")
    String modelUsed;
    @JsonProperty("distance_km")
    double distanceKm;
}
