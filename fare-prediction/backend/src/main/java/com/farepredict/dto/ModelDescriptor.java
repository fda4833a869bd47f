package com.farepredict.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ModelDescriptor {
    @JsonIgnore
    String identifier;
    String file;
    boolean available;
    Map<String, String> metrics;
}
