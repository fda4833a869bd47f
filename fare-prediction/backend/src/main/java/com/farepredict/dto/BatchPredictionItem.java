package com.farepredict.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One position of a batch result: either a prediction or the error that item failed with.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchPredictionItem {
    Double prediction;
    @JsonProperty("model_used")
    String modelUsed;
    String error;

    public static BatchPredictionItem success(double prediction, String modelUsed) {
        return BatchPredictionItem.builder().prediction(prediction).modelUsed(modelUsed).build();
    }

    public static BatchPredictionItem failure(String error) {
        return BatchPredictionItem.builder().error(error).build();
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
