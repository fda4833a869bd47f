package com.farepredict.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HealthResponse {
    String status;
    @JsonProperty("models_available")
    long modelsAvailable;
    @JsonProperty("total_models")
    int totalModels;
}
