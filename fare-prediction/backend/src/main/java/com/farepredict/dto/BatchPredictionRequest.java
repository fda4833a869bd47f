package com.farepredict.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Items stay as raw JSON so that a malformed entry fails on its own rather than failing the body.
 */
@Value
@Builder
@Jacksonized
public class BatchPredictionRequest {
    List<JsonNode> predictions;
}
