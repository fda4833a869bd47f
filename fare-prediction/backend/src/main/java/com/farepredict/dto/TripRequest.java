package com.farepredict.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Raw trip attributes as supplied by the caller. Presence of the required fields
 * is checked by the prediction service so that the first missing one can be reported.
 */
@Value
@Builder
@Jacksonized
public class TripRequest {

    @JsonProperty("pickup_latitude")
    Double pickupLatitude;

    @JsonProperty("pickup_longitude")
    Double pickupLongitude;

    @JsonProperty("dropoff_latitude")
    Double dropoffLatitude;

    @JsonProperty("dropoff_longitude")
    Double dropoffLongitude;

    @JsonProperty("pickup_datetime")
    String pickupDatetime;

    String model;
}
